package org.labrad.timing.enums;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

public enum InstructionKind {
  WAIT("wait"),
  FUNCTION("function"),
  CONSTANT("constant"),
  STATIC("static");

  private final String name;
  private static final Map<String, InstructionKind> map = Maps.newHashMap();

  InstructionKind(String name) {
    this.name = name;
  }

  public String toString() {
    return name;
  }

  static {
    for (InstructionKind kind : values()) {
      map.put(kind.name, kind);
    }
  }

  public static InstructionKind fromString(String name) {
    String key = name.toLowerCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid instruction kind '%s'", name);
    return map.get(key);
  }
}
