package org.labrad.timing.devices;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A device started by a trigger pulse, which has to be held high for a
 * minimum time before the device notices it.
 */
public class TriggerableDevice extends Device {
  private final double minimumTriggerDuration;

  public TriggerableDevice(String name, DeviceHost parent, String connection,
      double minimumTriggerDuration) {
    super(name, checkTriggerDuration(name, parent, minimumTriggerDuration), connection);
    this.minimumTriggerDuration = minimumTriggerDuration;
  }

  private static DeviceHost checkTriggerDuration(String name, DeviceHost parent,
      double minimumTriggerDuration) {
    Preconditions.checkArgument(minimumTriggerDuration >= 0,
        "Minimum trigger duration of '%s' must not be negative", name);
    return parent;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TRIGGERABLE_DEVICE;
  }

  /**
   * Shortest trigger pulse, in seconds, that this device responds to.
   */
  public double getMinimumTriggerDuration() {
    return minimumTriggerDuration;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", getName())
        .add("parent", getParent().getName())
        .add("minimumTriggerDuration", minimumTriggerDuration)
        .toString();
  }
}
