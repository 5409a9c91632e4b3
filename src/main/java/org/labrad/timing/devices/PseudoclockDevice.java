package org.labrad.timing.devices;

import java.util.List;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.enums.Operation;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A physical box holding one or more pseudoclocks.  The master is started
 * by the shot itself; any other is started by a trigger output of a device
 * in another clock domain.
 */
public class PseudoclockDevice extends TriggerableDevice {
  private double initialTriggerTime = 0;

  public PseudoclockDevice(String name, DeviceHost parent, String connection,
      double minimumTriggerDuration) {
    super(name, parent, connection, minimumTriggerDuration);
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.PSEUDOCLOCK_DEVICE;
  }

  /**
   * Whether this device is started by the shot rather than by a trigger.
   */
  public boolean isMaster() {
    return getParent() == getShot();
  }

  public List<Pseudoclock> getPseudoclocks() {
    List<Pseudoclock> pseudoclocks = Lists.newArrayList();
    for (Device device : getDevices()) {
      if (device instanceof Pseudoclock) {
        pseudoclocks.add((Pseudoclock)device);
      }
    }
    return pseudoclocks;
  }

  /**
   * Set the time, from the start of its parent, at which this device is
   * first triggered.
   */
  public void setInitialTriggerTime(double t) {
    enforce(Operation.CONFIGURE_DEVICE);
    Preconditions.checkArgument(t >= 0, "Initial trigger time of '%s' must not be negative", getName());
    this.initialTriggerTime = t;
  }

  public double getInitialTriggerTime() {
    return initialTriggerTime;
  }

  @Override
  protected double computeT0() {
    return super.computeT0() + initialTriggerTime;
  }
}
