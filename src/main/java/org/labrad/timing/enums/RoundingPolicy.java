package org.labrad.timing.enums;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * How a requested time is snapped onto a pseudoclock's tick grid.
 */
public enum RoundingPolicy {
  /**
   * Round to the nearest tick; times further than the quantisation
   * tolerance from a tick are rejected.
   */
  NEAREST("nearest"),

  /**
   * Round up to the next tick, so that nothing is ever scheduled earlier
   * than requested.  Times within the tolerance above a tick stay on it.
   */
  CEILING("ceiling");

  private final String name;
  private static final Map<String, RoundingPolicy> map = Maps.newHashMap();

  RoundingPolicy(String name) {
    this.name = name;
  }

  public String toString() {
    return name;
  }

  static {
    for (RoundingPolicy policy : values()) {
      map.put(policy.name, policy);
    }
  }

  public static RoundingPolicy fromString(String name) {
    String key = name.toLowerCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid rounding policy '%s'", name);
    return map.get(key);
  }
}
