package org.labrad.timing.devices;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.Quantiser;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.collect.TreeBasedTable;

/**
 * A clock source inside a pseudoclock device.  It produces ticks on a grid
 * of width {@code timebase} on each of its clock lines, and everything
 * below it (up to any nested pseudoclock) is in its clock domain.
 */
public class Pseudoclock extends Device {
  private static final Logger log = LoggerFactory.getLogger(Pseudoclock.class);

  private final double timebase;
  private final double minimumPeriod;
  private final double minimumWaitDuration;

  // set in establishCommonLimits
  private Long commonMinimumPeriodTicks = null;
  private double commonMinimumTriggerDuration;
  private Device limitingDevice;

  /**
   * Create a pseudoclock that can tick on every step of its timebase.
   */
  public Pseudoclock(String name, DeviceHost parent, String connection,
      double timebase, double minimumWaitDuration) {
    this(name, parent, connection, timebase, timebase, minimumWaitDuration);
  }

  /**
   * Create a pseudoclock.
   * @param name
   * @param parent
   * @param connection
   * @param timebase smallest time step in seconds
   * @param minimumPeriod shortest time in seconds between two ticks this pseudoclock can produce
   * @param minimumWaitDuration time in seconds after a wait before it can be triggered again
   */
  public Pseudoclock(String name, DeviceHost parent, String connection,
      double timebase, double minimumPeriod, double minimumWaitDuration) {
    super(name, checkTiming(name, parent, timebase, minimumPeriod, minimumWaitDuration), connection);
    this.timebase = timebase;
    this.minimumPeriod = minimumPeriod;
    this.minimumWaitDuration = minimumWaitDuration;
  }

  /**
   * Check the timing arguments before the pseudoclock is attached to its parent.
   */
  private static DeviceHost checkTiming(String name, DeviceHost parent,
      double timebase, double minimumPeriod, double minimumWaitDuration) {
    Preconditions.checkArgument(timebase > 0, "Timebase of '%s' must be positive", name);
    Preconditions.checkArgument(minimumPeriod >= timebase,
        "Minimum period of '%s' must be at least its timebase", name);
    Preconditions.checkArgument(minimumWaitDuration >= 0,
        "Minimum wait duration of '%s' must not be negative", name);
    return parent;
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.PSEUDOCLOCK;
  }

  public double getTimebase() {
    return timebase;
  }

  public double getMinimumPeriod() {
    return minimumPeriod;
  }

  public double getMinimumWaitDuration() {
    return minimumWaitDuration;
  }

  public List<ClockLine> getClockLines() {
    List<ClockLine> lines = Lists.newArrayList();
    for (Device device : getDevices()) {
      if (device instanceof ClockLine) {
        lines.add((ClockLine)device);
      }
    }
    return lines;
  }

  //
  // Common limits
  //

  @Override
  public void establishCommonLimits() {
    super.establishCommonLimits();
    long ticks = Quantiser.ceilToTicks(minimumPeriod, timebase, getShot().getQuantiser().getTolerance());
    double trigger = 0;
    Device limiting = this;
    for (ClockLine line : getClockLines()) {
      if (line.getCommonMinimumPeriodTicks() > ticks) {
        ticks = line.getCommonMinimumPeriodTicks();
        limiting = line.getLimitingDevice();
      }
      trigger = Math.max(trigger, line.getCommonMinimumTriggerDuration());
    }
    commonMinimumPeriodTicks = ticks;
    commonMinimumTriggerDuration = trigger;
    limitingDevice = limiting;
    log.debug("Pseudoclock '{}': common minimum period {} ticks ({} s, limited by '{}'), "
        + "minimum trigger duration {} s", getName(), ticks, getCommonMinimumPeriod(),
        limiting.getName(), trigger);
  }

  private void checkLimits() {
    Preconditions.checkState(commonMinimumPeriodTicks != null,
        "Common limits of '%s' have not been established", getName());
  }

  /**
   * Shortest tick spacing, in ticks, that every clock line of this
   * pseudoclock can handle.
   */
  public long getCommonMinimumPeriodTicks() {
    checkLimits();
    return commonMinimumPeriodTicks;
  }

  public double getCommonMinimumPeriod() {
    return Quantiser.ticksToTime(getCommonMinimumPeriodTicks(), timebase);
  }

  public double getCommonMinimumTriggerDuration() {
    checkLimits();
    return commonMinimumTriggerDuration;
  }

  /**
   * The device that sets the common minimum period.
   */
  public Device getLimitingDevice() {
    checkLimits();
    return limitingDevice;
  }

  //
  // Validation
  //

  /**
   * Check the ticks of all clock lines together, since they all come from
   * this pseudoclock.  Pairs of ticks that one line alone needs too close
   * together are left to that line to report.
   */
  @Override
  public void checkInstructionsValid(ValidationReport report) {
    super.checkInstructionsValid(report);
    long minTicks = getCommonMinimumPeriodTicks();

    // (segment, tick) -> instructions needing the tick, and the lines they are on
    TreeBasedTable<Integer, Long, List<OutputInstruction>> ticks = TreeBasedTable.create();
    TreeBasedTable<Integer, Long, Set<ClockLine>> lines = TreeBasedTable.create();
    for (ClockLine line : getClockLines()) {
      for (Map.Entry<Integer, TreeMap<Long, List<OutputInstruction>>> segment
          : line.getTicksBySegment().entrySet()) {
        for (Map.Entry<Long, List<OutputInstruction>> tick : segment.getValue().entrySet()) {
          List<OutputInstruction> atTick = ticks.get(segment.getKey(), tick.getKey());
          if (atTick == null) {
            atTick = Lists.newArrayList();
            ticks.put(segment.getKey(), tick.getKey(), atTick);
            lines.put(segment.getKey(), tick.getKey(), Sets.<ClockLine>newHashSet());
          }
          atTick.addAll(tick.getValue());
          lines.get(segment.getKey(), tick.getKey()).add(line);
        }
      }
    }

    for (Integer segment : ticks.rowKeySet()) {
      SortedMap<Long, List<OutputInstruction>> row = ticks.row(segment);
      Long previous = null;
      for (Map.Entry<Long, List<OutputInstruction>> entry : row.entrySet()) {
        long tick = entry.getKey();
        if (previous != null
            && !ClockLine.sameSingleInstruction(row.get(previous), entry.getValue())) {
          long spacing = tick - previous;
          if (spacing < minTicks && !reportedByLine(lines.get(segment, previous),
              lines.get(segment, tick), spacing)) {
            report.add(entry.getValue().get(0), "needs a tick %s s after the previous one, "
                + "but pseudoclock '%s' needs at least %s s between ticks (limited by '%s')",
                Quantiser.ticksToTime(spacing, timebase), getName(),
                getCommonMinimumPeriod(), limitingDevice.getName());
          }
        }
        previous = tick;
      }
    }
  }

  private static boolean reportedByLine(Set<ClockLine> before, Set<ClockLine> after, long spacing) {
    if (before.size() != 1 || !before.equals(after)) {
      return false;
    }
    return spacing < before.iterator().next().getCommonMinimumPeriodTicks();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", getName())
        .add("parent", getParent().getName())
        .add("timebase", timebase)
        .toString();
  }
}
