package org.labrad.timing.errors;

/**
 * Base class for all errors raised while building or compiling a shot.
 */
public class CompilationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public CompilationException(String message) {
    super(message);
  }

  public CompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
