package org.labrad.timing.devices;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.Quantiser;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.Function;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.util.Traversal;
import org.labrad.timing.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * One physical clock signal of a pseudoclock, shared by every clockable
 * device connected to it.
 */
public class ClockLine extends Device {
  private static final Logger log = LoggerFactory.getLogger(ClockLine.class);

  // set in establishCommonLimits
  private Long commonMinimumPeriodTicks = null;
  private double commonMinimumTriggerDuration;
  private Device limitingDevice;
  private Device limitingTriggerDevice;

  public ClockLine(String name, DeviceHost parent, String connection) {
    super(name, parent, connection);
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.CLOCK_LINE;
  }

  public List<ClockableDevice> getClockableDevices() {
    return Traversal.descendantDevices(this, false, ClockableDevice.class);
  }

  //
  // Common limits
  //

  /**
   * Find the slowest clock period and longest trigger duration required by
   * the devices on this line.  The period is rounded up to a whole number
   * of ticks, so no device is ever clocked faster than it allows.
   */
  @Override
  public void establishCommonLimits() {
    super.establishCommonLimits();
    Pseudoclock pseudoclock = getPseudoclock();
    double period = pseudoclock.getMinimumPeriod();
    double trigger = 0;
    Device limiting = pseudoclock;
    Device limitingTrigger = null;
    for (ClockableDevice device : getClockableDevices()) {
      if (device.getMinimumPeriod() > period) {
        period = device.getMinimumPeriod();
        limiting = device;
      }
      if (device.getMinimumTriggerDuration() > trigger) {
        trigger = device.getMinimumTriggerDuration();
        limitingTrigger = device;
      }
    }
    commonMinimumPeriodTicks = Quantiser.ceilToTicks(period, pseudoclock.getTimebase(),
        getShot().getQuantiser().getTolerance());
    commonMinimumTriggerDuration = trigger;
    limitingDevice = limiting;
    limitingTriggerDevice = limitingTrigger;
    log.debug("Clock line '{}': common minimum period {} s (limited by '{}'), "
        + "minimum trigger duration {} s", getName(), getCommonMinimumPeriod(),
        limiting.getName(), trigger);
  }

  private void checkLimits() {
    Preconditions.checkState(commonMinimumPeriodTicks != null,
        "Common limits of '%s' have not been established", getName());
  }

  /**
   * Shortest allowed time between two ticks on this line, in ticks of
   * the pseudoclock.
   */
  public long getCommonMinimumPeriodTicks() {
    checkLimits();
    return commonMinimumPeriodTicks;
  }

  /**
   * Shortest allowed time between two ticks on this line, in seconds.
   * Always a whole number of ticks.
   */
  public double getCommonMinimumPeriod() {
    return Quantiser.ticksToTime(getCommonMinimumPeriodTicks(), getPseudoclock().getTimebase());
  }

  public double getCommonMinimumTriggerDuration() {
    checkLimits();
    return commonMinimumTriggerDuration;
  }

  /**
   * The device that sets the common minimum period.  This is the
   * pseudoclock itself if every device on the line is faster than it.
   */
  public Device getLimitingDevice() {
    checkLimits();
    return limitingDevice;
  }

  /**
   * The device that sets the common minimum trigger duration, or null if
   * no device on the line has one.
   */
  public Device getLimitingTriggerDevice() {
    checkLimits();
    return limitingTriggerDevice;
  }

  //
  // Validation
  //

  /**
   * Check that the ticks this line has to produce are far enough apart for
   * every device on it.
   */
  @Override
  public void checkInstructionsValid(ValidationReport report) {
    super.checkInstructionsValid(report);
    long minTicks = getCommonMinimumPeriodTicks();
    double timebase = getPseudoclock().getTimebase();

    for (OutputInstruction inst : getClockedInstructions()) {
      if (inst instanceof Function) {
        long sample = ((Function)inst).getQuantisedSamplePeriod();
        if (sample > 0 && sample < minTicks) {
          report.add(inst, "samples every %s s, faster than clock line '%s' allows (%s s, limited by '%s')",
              Quantiser.ticksToTime(sample, timebase), getName(),
              getCommonMinimumPeriod(), limitingDevice.getName());
        }
      }
    }

    for (TreeMap<Long, List<OutputInstruction>> segment : getTicksBySegment().values()) {
      Map.Entry<Long, List<OutputInstruction>> previous = null;
      for (Map.Entry<Long, List<OutputInstruction>> entry : segment.entrySet()) {
        if (previous != null && !sameSingleInstruction(previous.getValue(), entry.getValue())) {
          long spacing = entry.getKey() - previous.getKey();
          OutputInstruction inst = entry.getValue().get(0);
          if (spacing < minTicks) {
            report.add(inst, "needs a tick %s s after the previous one, but clock line '%s' "
                + "needs at least %s s between ticks (limited by '%s')",
                Quantiser.ticksToTime(spacing, timebase), getName(),
                getCommonMinimumPeriod(), limitingDevice.getName());
          } else if (Quantiser.ticksToTime(spacing, timebase) < 2 * commonMinimumTriggerDuration) {
            report.add(inst, "needs a tick %s s after the previous one, too soon for the %s s "
                + "trigger duration of '%s' on clock line '%s'",
                Quantiser.ticksToTime(spacing, timebase), commonMinimumTriggerDuration,
                limitingTriggerDevice.getName(), getName());
          }
        }
        previous = entry;
      }
    }
  }

  /**
   * Every instruction that makes this line tick.  Static outputs never do.
   */
  List<OutputInstruction> getClockedInstructions() {
    List<OutputInstruction> instructions = Lists.newArrayList();
    for (Output output : Traversal.descendantDevices(this, false, Output.class)) {
      if (output instanceof StaticOutput) {
        continue;
      }
      for (Instruction instruction : output.getInstructions()) {
        instructions.add((OutputInstruction)instruction);
      }
    }
    return instructions;
  }

  /**
   * The ticks this line has to produce: segment -> tick -> instructions
   * needing that tick.  A ramp needs its start and its end.
   */
  Map<Integer, TreeMap<Long, List<OutputInstruction>>> getTicksBySegment() {
    Map<Integer, TreeMap<Long, List<OutputInstruction>>> ticks = Maps.newTreeMap();
    for (OutputInstruction inst : getClockedInstructions()) {
      addTick(ticks, inst.getSegment(), inst.getQuantisedT(), inst);
      if (!inst.isPoint()) {
        addTick(ticks, inst.getSegment(), inst.getQuantisedT() + inst.getQuantisedDuration(), inst);
      }
    }
    return ticks;
  }

  private static void addTick(Map<Integer, TreeMap<Long, List<OutputInstruction>>> ticks,
      int segment, long tick, OutputInstruction inst) {
    TreeMap<Long, List<OutputInstruction>> bySegment = ticks.get(segment);
    if (bySegment == null) {
      bySegment = Maps.newTreeMap();
      ticks.put(segment, bySegment);
    }
    List<OutputInstruction> atTick = bySegment.get(tick);
    if (atTick == null) {
      atTick = Lists.newArrayList();
      bySegment.put(tick, atTick);
    }
    atTick.add(inst);
  }

  /**
   * The two ends of one ramp; its samples are checked on their own.
   */
  static boolean sameSingleInstruction(List<OutputInstruction> a, List<OutputInstruction> b) {
    return a.size() == 1 && b.size() == 1 && a.get(0) == b.get(0);
  }
}
