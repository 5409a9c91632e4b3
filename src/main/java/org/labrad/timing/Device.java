package org.labrad.timing;

import java.util.List;
import java.util.Set;

import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.enums.Operation;
import org.labrad.timing.util.DeviceList;
import org.labrad.timing.validation.ValidationReport;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A piece of hardware in the shot's tree.
 *
 * A device is attached to its parent when it is constructed, and its
 * parent, shot and pseudoclock never change after that.  Subclasses that
 * override one of the phase hooks ({@link #establishCommonLimits()},
 * {@link #establishInitialAttributes()},
 * {@link #checkInstructionsValid(ValidationReport)}) must call the base
 * implementation first; forgetting to is caught when the shot leaves
 * the phase.
 *
 * A plain Device has no timing requirements of its own; it stands for
 * hardware such as an amplifier that simply passes an output through.
 */
public class Device extends Node implements DeviceHost {
  private final String name;
  private final DeviceHost parent;
  private final String connection;
  private final Shot shot;
  private final Pseudoclock pseudoclock;
  private final DeviceList devices = new DeviceList(this);

  private double outputDelay = 0;

  // set in establishInitialAttributes
  private Double t0 = null;
  private Double ancestorLatency = null;

  public Device(String name, DeviceHost parent, String connection) {
    Preconditions.checkNotNull(name, "Device name must not be null");
    Preconditions.checkNotNull(parent, "Device '%s' must have a parent", name);
    this.name = name;
    this.parent = parent;
    this.connection = connection;
    this.shot = parent.getShot();
    enforce(Operation.ADD_DEVICE);
    this.pseudoclock = (this instanceof Pseudoclock) ? (Pseudoclock)this : parent.getPseudoclock();
    shot.checkDeviceName(this);
    parent.addDevice(this);
    shot.registerDevice(this);
  }

  public String getName() {
    return name;
  }

  public NodeKind getKind() {
    return NodeKind.DEVICE;
  }

  public DeviceHost getParent() {
    return parent;
  }

  /**
   * Hardware address of this device on its parent.
   */
  public String getConnection() {
    return connection;
  }

  @Override
  public Shot getShot() {
    return shot;
  }

  public Pseudoclock getPseudoclock() {
    return pseudoclock;
  }

  @Override
  public Set<Operation> getRequiredOperations() {
    return TREE_PASSES;
  }

  //
  // Child devices
  //

  public void addDevice(Device device) {
    devices.add(device);
  }

  public List<Device> getDevices() {
    return devices.asList();
  }

  //
  // Delays
  //

  /**
   * Set the delay between this device being triggered or clocked and it
   * producing output, for all of its children.
   */
  public void setOutputDelay(double delay) {
    enforce(Operation.CONFIGURE_DEVICE);
    Preconditions.checkArgument(delay >= 0, "Output delay of '%s' must not be negative", name);
    this.outputDelay = delay;
  }

  /**
   * The time between this device being triggered or clocked and it
   * producing output for the given child.  Subclasses whose delays differ
   * between children should override this.
   */
  public double getOutputDelay(Node child) {
    return outputDelay;
  }

  //
  // Common limits
  //

  /**
   * Work out the limits that satisfy every device below this one.
   * Children are always done first, so their limits are known by the
   * time a subclass computes its own.
   */
  public void establishCommonLimits() {
    enforce(Operation.ESTABLISH_COMMON_LIMITS);
    for (Device device : devices.asList()) {
      device.establishCommonLimits();
    }
  }

  //
  // Initial attributes
  //

  /**
   * Work out this device's start time and latency from its parent's, then
   * do the same for all children.  Must not change any common limit.
   */
  public void establishInitialAttributes() {
    enforce(Operation.ESTABLISH_INITIAL_ATTRIBUTES);
    t0 = computeT0();
    ancestorLatency = parent.getAncestorLatency() + parent.getOutputDelay(this);
    for (Device device : devices.asList()) {
      device.establishInitialAttributes();
    }
  }

  protected double computeT0() {
    return parent.getT0() + parent.getOutputDelay(this);
  }

  /**
   * The time at which this device starts, relative to the start of the shot.
   */
  public double getT0() {
    Preconditions.checkState(t0 != null, "t0 of '%s' is not known until the shot has started", name);
    return t0;
  }

  /**
   * The total output delay of every device between this one and the shot.
   */
  public double getAncestorLatency() {
    Preconditions.checkState(ancestorLatency != null,
        "Latency of '%s' is not known until the shot has started", name);
    return ancestorLatency;
  }

  //
  // Validation
  //

  /**
   * Add any problems with this device's instructions to the report, then
   * check all children.
   */
  public void checkInstructionsValid(ValidationReport report) {
    enforce(Operation.CHECK_INSTRUCTIONS_VALID);
    for (Device device : devices.asList()) {
      device.checkInstructionsValid(report);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("parent", parent.getName())
        .add("connection", connection)
        .toString();
  }
}
