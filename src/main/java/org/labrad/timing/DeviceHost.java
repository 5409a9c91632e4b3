package org.labrad.timing;

import java.util.List;

import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.NodeKind;

/**
 * A node that can own child devices: the shot and every device.
 */
public interface DeviceHost {
  public String getName();
  public NodeKind getKind();
  public Shot getShot();

  /**
   * The pseudoclock whose clock domain this node belongs to, or null
   * for nodes outside any clock domain.
   */
  public Pseudoclock getPseudoclock();

  /**
   * Attach a device as a child of this host.  Called by the device's
   * constructor; fails if the device's kind is not accepted here.
   */
  public void addDevice(Device device);
  public List<Device> getDevices();

  //
  // Initial attributes
  //

  public double getT0();
  public double getAncestorLatency();

  /**
   * The time between this host being triggered and it producing output
   * for the given child device or instruction.
   */
  public double getOutputDelay(Node child);
}
