package org.labrad.timing.instructions;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.Quantiser;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.InstructionKind;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A ramp: the output follows a function of the time since the ramp
 * started, sampled at a fixed rate.
 */
public class Function extends OutputInstruction {
  private final double duration;
  private final DoubleUnaryOperator function;
  private final double sampleRate;

  private long quantisedDuration;
  private long quantisedSamplePeriod;

  /**
   * Create a ramp.
   * @param parent
   * @param t start time in seconds
   * @param duration length of the ramp in seconds
   * @param function maps seconds since the start of the ramp to a value
   * @param sampleRate samples per second, or 0 for a single sample
   */
  public Function(InstructionHost parent, double t, double duration,
      DoubleUnaryOperator function, double sampleRate) {
    super(checkRamp(parent, function, sampleRate), t);
    this.duration = duration;
    this.function = function;
    this.sampleRate = sampleRate;
  }

  /**
   * Check the ramp's arguments before it is added to its parent.
   */
  private static InstructionHost checkRamp(InstructionHost parent,
      DoubleUnaryOperator function, double sampleRate) {
    Preconditions.checkNotNull(function, "Function must not be null");
    Preconditions.checkArgument(sampleRate >= 0, "Sample rate must not be negative: %s", sampleRate);
    return parent;
  }

  @Override
  public InstructionKind getKind() {
    return InstructionKind.FUNCTION;
  }

  public double getDuration() {
    return duration;
  }

  public DoubleUnaryOperator getFunction() {
    return function;
  }

  public double getSampleRate() {
    return sampleRate;
  }

  @Override
  public double getEndT() {
    return getT() + duration;
  }

  //
  // Timing
  //

  @Override
  public void convertTiming(List<Wait> waits) {
    super.convertTiming(waits);
    // the end is measured from the start's segment even if a wait comes first;
    // the validator reports that case
    Long end = quantise(toRelative(getEndT()), "end time");
    quantisedDuration = end - getQuantisedT();
    if (sampleRate == 0) {
      quantisedSamplePeriod = 0;
    } else {
      // never sample faster than asked
      Pseudoclock pseudoclock = getParent().getPseudoclock();
      double tolerance = getShot().getQuantiser().getTolerance();
      quantisedSamplePeriod = (pseudoclock == null) ? 0
          : Math.max(1, Quantiser.ceilToTicks(1 / sampleRate, pseudoclock.getTimebase(), tolerance));
    }
  }

  @Override
  public long getQuantisedDuration() {
    checkConverted();
    return quantisedDuration;
  }

  /**
   * Sample period in ticks, or 0 if the function is sampled only once.
   */
  public long getQuantisedSamplePeriod() {
    checkConverted();
    return quantisedSamplePeriod;
  }

  /**
   * The ticks at which the function is sampled, from the start of the ramp
   * up to but not including its end.
   */
  @Override
  public List<Long> getTicks() {
    long start = getQuantisedT();
    long period = getQuantisedSamplePeriod();
    long length = getQuantisedDuration();
    if (period == 0 || length <= 0) {
      return ImmutableList.of(start);
    }
    List<Long> ticks = Lists.newArrayList();
    for (long offset = 0; offset < length; offset += period) {
      ticks.add(start + offset);
    }
    return ticks;
  }

  /**
   * Evaluate the function at each of its sample ticks.
   */
  public double[] evaluate() {
    Pseudoclock pseudoclock = getParent().getPseudoclock();
    double timebase = (pseudoclock == null) ? 0 : pseudoclock.getTimebase();
    List<Long> ticks = getTicks();
    long start = getQuantisedT();
    double[] values = new double[ticks.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = function.applyAsDouble(Quantiser.ticksToTime(ticks.get(i) - start, timebase));
    }
    return values;
  }
}
