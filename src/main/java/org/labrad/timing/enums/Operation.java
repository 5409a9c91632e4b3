package org.labrad.timing.enums;

import com.google.common.base.CaseFormat;

/**
 * Operations whose use is gated by the compilation phase.
 *
 * Each operation may only run in its own phase.  Operations marked
 * exactly-once must run exactly one time on every node that requires them
 * before the shot may leave that phase.
 */
public enum Operation {
  ADD_DEVICE(Phase.ADD_DEVICES, false),
  CONFIGURE_DEVICE(Phase.ADD_DEVICES, false),
  START(Phase.ADD_DEVICES, false),
  ESTABLISH_COMMON_LIMITS(Phase.ESTABLISH_COMMON_LIMITS, true),
  ESTABLISH_INITIAL_ATTRIBUTES(Phase.ESTABLISH_INITIAL_ATTRIBUTES, true),
  ADD_INSTRUCTION(Phase.ADD_INSTRUCTIONS, false),
  STOP(Phase.ADD_INSTRUCTIONS, false),
  CONVERT_TIMING(Phase.CONVERT_TIMING, true),
  CHECK_INSTRUCTIONS_VALID(Phase.CHECK_INSTRUCTIONS_VALID, true);

  private final Phase phase;
  private final boolean exactlyOnce;

  Operation(Phase phase, boolean exactlyOnce) {
    this.phase = phase;
    this.exactlyOnce = exactlyOnce;
  }

  public Phase getPhase() {
    return phase;
  }

  public boolean isExactlyOnce() {
    return exactlyOnce;
  }

  /**
   * Name of the method implementing this operation, for error messages.
   */
  public String getMethodName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name()) + "()";
  }
}
