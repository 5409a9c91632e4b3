package org.labrad.timing.errors;

/**
 * An operation was used in a way that breaks the compilation phase order.
 * These always indicate a bug in tree construction or in a device's
 * implementation of a phase hook.
 */
public class PhaseException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public PhaseException(String message) {
    super(message);
  }
}
