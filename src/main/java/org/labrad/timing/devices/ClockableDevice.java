package org.labrad.timing.devices;

import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;

import com.google.common.base.Preconditions;

/**
 * A device that updates its outputs on every tick of a clock line.
 * Ticks must be at least its minimum period apart, and each must be
 * high and low for at least its minimum trigger duration.
 */
public class ClockableDevice extends TriggerableDevice {
  private final double minimumPeriod;

  public ClockableDevice(String name, DeviceHost parent, String connection,
      double minimumTriggerDuration, double minimumPeriod) {
    super(name, checkPeriod(name, parent, minimumPeriod), connection, minimumTriggerDuration);
    this.minimumPeriod = minimumPeriod;
  }

  private static DeviceHost checkPeriod(String name, DeviceHost parent, double minimumPeriod) {
    Preconditions.checkArgument(minimumPeriod >= 0,
        "Minimum clock period of '%s' must not be negative", name);
    return parent;
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.CLOCKABLE_DEVICE;
  }

  /**
   * Shortest time, in seconds, between two clock ticks.
   */
  public double getMinimumPeriod() {
    return minimumPeriod;
  }
}
