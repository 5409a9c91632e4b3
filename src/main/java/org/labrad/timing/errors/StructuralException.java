package org.labrad.timing.errors;

/**
 * Illegal composition of the device tree, such as a device or instruction
 * attached to a host that does not accept its kind, a second master
 * pseudoclock device, or two waits at the same time.
 */
public class StructuralException extends CompilationException {
  private static final long serialVersionUID = 1L;

  public StructuralException(String message) {
    super(message);
  }
}
