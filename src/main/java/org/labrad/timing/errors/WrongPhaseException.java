package org.labrad.timing.errors;

public class WrongPhaseException extends PhaseException {
  private static final long serialVersionUID = 1L;

  public WrongPhaseException(String message) {
    super(message);
  }
}
