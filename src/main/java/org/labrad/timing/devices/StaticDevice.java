package org.labrad.timing.devices;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;

/**
 * A device with no clock and no trigger, whose outputs hold one value for
 * the whole shot.
 */
public class StaticDevice extends Device {

  public StaticDevice(String name, DeviceHost parent, String connection) {
    super(name, parent, connection);
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.STATIC_DEVICE;
  }
}
