package org.labrad.timing.devices;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.Quantiser;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.Constant;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.validation.ValidationReport;

import com.google.common.base.Preconditions;

/**
 * A digital output that starts other devices, including pseudoclock
 * devices in a nested clock domain.
 */
public class Trigger extends Output {
  private static final double HIGH = 1;
  private static final double LOW = 0;

  // set in establishCommonLimits
  private Double minimumTriggerDuration = null;
  private Device limitingDevice = null;

  public Trigger(String name, DeviceHost parent, String connection) {
    super(name, parent, connection);
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.TRIGGER;
  }

  /**
   * Send a trigger pulse.
   * @param t time the pulse goes high
   * @param duration time the pulse stays high
   * @return the duration of the pulse
   */
  public double trigger(double t, double duration) {
    new Constant(this, t, HIGH);
    new Constant(this, t + duration, LOW);
    return duration;
  }

  //
  // Common limits
  //

  /**
   * Find the longest trigger pulse needed by the devices this output starts.
   */
  @Override
  public void establishCommonLimits() {
    super.establishCommonLimits();
    double duration = 0;
    Device limiting = null;
    for (Device device : getDevices()) {
      if (device instanceof TriggerableDevice) {
        double d = ((TriggerableDevice)device).getMinimumTriggerDuration();
        if (d > duration) {
          duration = d;
          limiting = device;
        }
      }
    }
    minimumTriggerDuration = duration;
    limitingDevice = limiting;
  }

  public double getMinimumTriggerDuration() {
    Preconditions.checkState(minimumTriggerDuration != null,
        "Common limits of '%s' have not been established", getName());
    return minimumTriggerDuration;
  }

  public Device getLimitingDevice() {
    getMinimumTriggerDuration();
    return limitingDevice;
  }

  //
  // Validation
  //

  /**
   * Check that every pulse is long enough for the devices it starts.
   */
  @Override
  public void checkInstructionsValid(ValidationReport report) {
    super.checkInstructionsValid(report);
    double timebase = getPseudoclock().getTimebase();
    OutputInstruction rise = null;
    for (OutputInstruction inst : getSortedInstructions()) {
      if (!(inst instanceof Constant)) {
        rise = null;
        continue;
      }
      if (rise != null && rise.getSegment() != inst.getSegment()) {
        rise = null;
      }
      boolean high = ((Constant)inst).getValue() != LOW;
      if (high && rise == null) {
        rise = inst;
      } else if (!high && rise != null) {
        double width = Quantiser.ticksToTime(inst.getQuantisedT() - rise.getQuantisedT(), timebase);
        if (width < minimumTriggerDuration) {
          report.add(rise, "is a trigger pulse of %s s, shorter than the %s s needed by '%s'",
              width, minimumTriggerDuration, limitingDevice.getName());
        }
        rise = null;
      }
    }
  }
}
