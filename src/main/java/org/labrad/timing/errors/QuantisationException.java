package org.labrad.timing.errors;

/**
 * A requested time cannot be represented on the tick grid of the
 * pseudoclock that has to produce it.
 */
public class QuantisationException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public QuantisationException(String message) {
    super(message);
  }

  public QuantisationException(String message, Throwable cause) {
    super(message, cause);
  }
}
