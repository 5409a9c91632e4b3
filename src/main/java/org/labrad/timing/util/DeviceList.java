package org.labrad.timing.util;

import java.util.List;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.errors.StructuralException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The child devices of a host, in the order they were attached.
 * Only devices of a kind accepted by the host can be added.
 */
public class DeviceList {
  private final DeviceHost host;
  private final List<Device> devices = Lists.newArrayList();

  public DeviceList(DeviceHost host) {
    this.host = host;
  }

  public void add(Device device) {
    NodeKind kind = device.getKind();
    if (!host.getKind().acceptsDevice(kind)) {
      throw new StructuralException(String.format(
          "Device '%s' of kind %s not permitted as child of %s '%s', which accepts only %s"
          + "%n  created at %s",
          device.getName(), kind, host.getKind(), host.getName(),
          host.getKind().getAcceptedDevices(), device.getCreationSite()));
    }
    Preconditions.checkArgument(device.getParent() == host,
        "Device '%s' belongs to '%s', not '%s'", device.getName(),
        device.getParent().getName(), host.getName());
    Preconditions.checkArgument(!devices.contains(device),
        "Device '%s' has already been added to '%s'", device.getName(), host.getName());
    devices.add(device);
  }

  public List<Device> asList() {
    return ImmutableList.copyOf(devices);
  }

  public int size() {
    return devices.size();
  }
}
