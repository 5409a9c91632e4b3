package org.labrad.timing.util;

import java.util.List;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.InstructionHost;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.instructions.Instruction;

import com.google.common.collect.Lists;

/**
 * Depth-first, pre-order walks over a host's descendants.
 *
 * Unless asked to recurse into pseudoclocks, a walk stays inside one clock
 * domain: nested pseudoclocks and everything below them are left out.
 */
public class Traversal {

  /**
   * Get the devices below a host, not including the host itself.
   */
  public static List<Device> descendantDevices(DeviceHost root, boolean recurseIntoPseudoclocks) {
    List<Device> devices = Lists.newArrayList();
    collectDevices(root, recurseIntoPseudoclocks, devices);
    return devices;
  }

  /**
   * Get the devices below a host that are of a particular class.
   */
  @SuppressWarnings("unchecked")
  public static <T extends Device> List<T> descendantDevices(DeviceHost root,
      boolean recurseIntoPseudoclocks, Class<T> cls) {
    List<T> matches = Lists.newArrayList();
    for (Device device : descendantDevices(root, recurseIntoPseudoclocks)) {
      if (cls.isInstance(device)) {
        matches.add((T)device);
      }
    }
    return matches;
  }

  private static void collectDevices(DeviceHost host, boolean recurse, List<Device> devices) {
    for (Device device : host.getDevices()) {
      if (device instanceof Pseudoclock && !recurse) {
        continue;
      }
      devices.add(device);
      collectDevices(device, recurse, devices);
    }
  }

  /**
   * Get the instructions of a host (if it has any) followed by those of
   * its descendant devices, in pre-order.
   */
  public static List<Instruction> descendantInstructions(DeviceHost root, boolean recurseIntoPseudoclocks) {
    List<Instruction> instructions = Lists.newArrayList();
    if (root instanceof InstructionHost) {
      instructions.addAll(((InstructionHost)root).getInstructions());
    }
    for (Device device : descendantDevices(root, recurseIntoPseudoclocks)) {
      if (device instanceof InstructionHost) {
        instructions.addAll(((InstructionHost)device).getInstructions());
      }
    }
    return instructions;
  }
}
