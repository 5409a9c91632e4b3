package org.labrad.timing.enums;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * The phases of compiling a shot, in the order they happen.
 * A shot moves through them strictly forward, one at a time.
 */
public enum Phase {
  ADD_DEVICES("add_devices"),
  ESTABLISH_COMMON_LIMITS("establish_common_limits"),
  ESTABLISH_INITIAL_ATTRIBUTES("establish_initial_attributes"),
  ADD_INSTRUCTIONS("add_instructions"),
  CONVERT_TIMING("convert_timing"),
  CHECK_INSTRUCTIONS_VALID("check_instructions_valid");

  private final String name;
  private static final Map<String, Phase> map = Maps.newHashMap();

  Phase(String name) {
    this.name = name;
  }

  /**
   * Get the phase that follows this one.
   */
  public Phase next() {
    Preconditions.checkState(!isLast(), "Phase %s is the last phase", this);
    return values()[ordinal() + 1];
  }

  public boolean isLast() {
    return ordinal() == values().length - 1;
  }

  public String toString() {
    return name;
  }

  static {
    for (Phase phase : values()) {
      map.put(phase.name, phase);
    }
  }

  public static Phase fromString(String name) {
    String key = name.toLowerCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid phase '%s'", name);
    return map.get(key);
  }
}
