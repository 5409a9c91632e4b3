package org.labrad.timing.enums;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * The closed set of node variants that can make up a shot's tree.
 *
 * Which devices and instructions a node may own is a property of its kind,
 * looked up in the tables built below, and never of a particular instance.
 */
public enum NodeKind {
  SHOT("shot"),
  DEVICE("device"),
  STATIC_DEVICE("static_device"),
  TRIGGERABLE_DEVICE("triggerable_device"),
  CLOCKABLE_DEVICE("clockable_device"),
  CLOCK_LINE("clock_line"),
  PSEUDOCLOCK("pseudoclock"),
  PSEUDOCLOCK_DEVICE("pseudoclock_device"),
  OUTPUT("output"),
  TRIGGER("trigger"),
  STATIC_OUTPUT("static_output");

  private final String name;
  private static final Map<String, NodeKind> map = Maps.newHashMap();
  private static final Map<NodeKind, Set<NodeKind>> acceptedDevices = Maps.newEnumMap(NodeKind.class);
  private static final Map<NodeKind, Set<InstructionKind>> acceptedInstructions = Maps.newEnumMap(NodeKind.class);

  NodeKind(String name) {
    this.name = name;
  }

  public String toString() {
    return name;
  }

  public boolean isDevice() {
    return this != SHOT;
  }

  /**
   * Get the kinds of device that a node of this kind may own.
   */
  public Set<NodeKind> getAcceptedDevices() {
    return acceptedDevices.get(this);
  }

  /**
   * Get the kinds of instruction that a node of this kind may own.
   */
  public Set<InstructionKind> getAcceptedInstructions() {
    return acceptedInstructions.get(this);
  }

  public boolean acceptsDevice(NodeKind child) {
    return acceptedDevices.get(this).contains(child);
  }

  public boolean acceptsInstruction(InstructionKind instruction) {
    return acceptedInstructions.get(this).contains(instruction);
  }

  static {
    for (NodeKind kind : values()) {
      map.put(kind.name, kind);
    }

    devices(SHOT, PSEUDOCLOCK_DEVICE, STATIC_DEVICE);
    devices(DEVICE, DEVICE);
    devices(STATIC_DEVICE, STATIC_OUTPUT);
    devices(TRIGGERABLE_DEVICE, OUTPUT, TRIGGER, STATIC_OUTPUT);
    devices(CLOCKABLE_DEVICE, OUTPUT, TRIGGER, STATIC_OUTPUT);
    devices(CLOCK_LINE, CLOCKABLE_DEVICE);
    devices(PSEUDOCLOCK, CLOCK_LINE);
    devices(PSEUDOCLOCK_DEVICE, PSEUDOCLOCK);
    devices(OUTPUT, DEVICE);
    devices(TRIGGER, TRIGGERABLE_DEVICE, PSEUDOCLOCK_DEVICE);
    devices(STATIC_OUTPUT, DEVICE);

    for (NodeKind kind : values()) {
      acceptedInstructions.put(kind, Collections.<InstructionKind>emptySet());
    }
    instructions(SHOT, InstructionKind.WAIT);
    instructions(OUTPUT, InstructionKind.FUNCTION, InstructionKind.CONSTANT);
    instructions(TRIGGER, InstructionKind.FUNCTION, InstructionKind.CONSTANT);
    instructions(STATIC_OUTPUT, InstructionKind.STATIC);
  }

  private static void devices(NodeKind host, NodeKind... children) {
    acceptedDevices.put(host, Sets.immutableEnumSet(Arrays.asList(children)));
  }

  private static void instructions(NodeKind host, InstructionKind... kinds) {
    acceptedInstructions.put(host, Sets.immutableEnumSet(Arrays.asList(kinds)));
  }

  public static NodeKind fromString(String name) {
    String key = name.toLowerCase();
    Preconditions.checkArgument(map.containsKey(key),
        "Invalid node kind '%s'", name);
    return map.get(key);
  }
}
