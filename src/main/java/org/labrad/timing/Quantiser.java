package org.labrad.timing;

import java.math.RoundingMode;

import org.labrad.timing.enums.RoundingPolicy;
import org.labrad.timing.errors.QuantisationException;

import com.google.common.base.Preconditions;
import com.google.common.math.DoubleMath;

/**
 * Converts times in seconds to whole numbers of pseudoclock ticks.
 */
public class Quantiser {
  // 2^63, the first tick count a long cannot hold
  private static final double MAX_TICKS = 0x1p63;

  private final RoundingPolicy policy;
  private final double tolerance;

  public Quantiser(RoundingPolicy policy, double tolerance) {
    this.policy = Preconditions.checkNotNull(policy);
    this.tolerance = tolerance;
  }

  public static Quantiser forOptions(ShotOptions options) {
    return new Quantiser(options.getRoundingPolicy(), options.getQuantisationTolerance());
  }

  public RoundingPolicy getPolicy() {
    return policy;
  }

  public double getTolerance() {
    return tolerance;
  }

  /**
   * Convert a time to ticks of the given timebase.
   * @param time time in seconds
   * @param timebase tick length in seconds
   * @param what description of the time, for error messages
   * @return
   */
  public long toTicks(double time, double timebase, String what) {
    if (Double.isNaN(time) || Double.isInfinite(time)) {
      throw new QuantisationException(String.format("%s is not a finite time: %s", what, time));
    }
    double ticks = time / timebase;
    checkRange(ticks, time, timebase, what);
    switch (policy) {
      case NEAREST:
        long nearest = DoubleMath.roundToLong(ticks, RoundingMode.HALF_EVEN);
        if (Math.abs(ticks - nearest) > tolerance) {
          throw new QuantisationException(String.format(
              "%s of %s s is not a multiple of the %s s timebase "
              + "(%.4f ticks from the nearest tick, tolerance %s)",
              what, time, timebase, Math.abs(ticks - nearest), tolerance));
        }
        return nearest;
      case CEILING:
        return ceilToTicks(time, timebase, tolerance);
      default:
        throw new RuntimeException("Unknown rounding policy: " + policy);
    }
  }

  /**
   * Round a duration up to a whole number of ticks.  A duration within
   * tolerance of a tick is taken to be on it, so that floating point noise
   * never costs a whole extra tick.
   */
  public static long ceilToTicks(double time, double timebase, double tolerance) {
    double ticks = Math.ceil(time / timebase - tolerance);
    checkRange(ticks, time, timebase, "duration");
    return (long)ticks;
  }

  private static void checkRange(double ticks, double time, double timebase, String what) {
    if (Double.isNaN(ticks) || Math.abs(ticks) >= MAX_TICKS) {
      throw new QuantisationException(String.format(
          "%s of %s s is too many ticks of the %s s timebase to count", what, time, timebase));
    }
  }

  public static double ticksToTime(long ticks, double timebase) {
    return ticks * timebase;
  }
}
