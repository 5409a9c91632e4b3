package org.labrad.timing.errors;

public class AlreadyCalledException extends PhaseException {
  private static final long serialVersionUID = 1L;

  public AlreadyCalledException(String message) {
    super(message);
  }
}
