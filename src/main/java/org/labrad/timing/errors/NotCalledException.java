package org.labrad.timing.errors;

public class NotCalledException extends PhaseException {
  private static final long serialVersionUID = 1L;

  public NotCalledException(String message) {
    super(message);
  }
}
