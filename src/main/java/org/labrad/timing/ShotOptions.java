package org.labrad.timing;

import java.util.Properties;

import org.labrad.timing.enums.RoundingPolicy;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Settings that control how a shot is compiled.
 */
public class ShotOptions {
  private final double epsilon;
  private final double quantisationTolerance;
  private final RoundingPolicy roundingPolicy;
  private final boolean batchQuantisation;

  private ShotOptions(Builder builder) {
    this.epsilon = builder.epsilon;
    this.quantisationTolerance = builder.quantisationTolerance;
    this.roundingPolicy = builder.roundingPolicy;
    this.batchQuantisation = builder.batchQuantisation;
  }

  public static ShotOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read options from a set of properties.  Keys that are absent keep
   * their default values.
   * @param props
   * @return
   */
  public static ShotOptions fromProperties(Properties props) {
    Builder builder = builder();
    String value = props.getProperty(Constants.EPSILON_KEY);
    if (value != null) {
      builder.epsilon(parseDouble(Constants.EPSILON_KEY, value));
    }
    value = props.getProperty(Constants.QUANTISATION_TOLERANCE_KEY);
    if (value != null) {
      builder.quantisationTolerance(parseDouble(Constants.QUANTISATION_TOLERANCE_KEY, value));
    }
    value = props.getProperty(Constants.ROUNDING_POLICY_KEY);
    if (value != null) {
      builder.roundingPolicy(RoundingPolicy.fromString(value.trim()));
    }
    value = props.getProperty(Constants.BATCH_QUANTISATION_KEY);
    if (value != null) {
      builder.batchQuantisation(Boolean.parseBoolean(value.trim()));
    }
    return builder.build();
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          String.format("Property '%s' is not a number: '%s'", key, value), ex);
    }
  }

  /**
   * Safety margin added to the dead time after every wait.
   */
  public double getEpsilon() {
    return epsilon;
  }

  /**
   * Largest allowed distance between a requested time and its tick,
   * as a fraction of the tick.
   */
  public double getQuantisationTolerance() {
    return quantisationTolerance;
  }

  public RoundingPolicy getRoundingPolicy() {
    return roundingPolicy;
  }

  public boolean isBatchQuantisation() {
    return batchQuantisation;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("epsilon", epsilon)
        .add("quantisationTolerance", quantisationTolerance)
        .add("roundingPolicy", roundingPolicy)
        .add("batchQuantisation", batchQuantisation)
        .toString();
  }

  public static class Builder {
    private double epsilon = Constants.DEFAULT_EPSILON;
    private double quantisationTolerance = Constants.DEFAULT_QUANTISATION_TOLERANCE;
    private RoundingPolicy roundingPolicy = Constants.DEFAULT_ROUNDING_POLICY;
    private boolean batchQuantisation = Constants.DEFAULT_BATCH_QUANTISATION;

    private Builder() {}

    public Builder epsilon(double epsilon) {
      Preconditions.checkArgument(epsilon >= 0, "epsilon must not be negative: %s", epsilon);
      this.epsilon = epsilon;
      return this;
    }

    public Builder quantisationTolerance(double tolerance) {
      Preconditions.checkArgument(tolerance >= 0 && tolerance < 0.5,
          "quantisation tolerance must be in [0, 0.5): %s", tolerance);
      this.quantisationTolerance = tolerance;
      return this;
    }

    public Builder roundingPolicy(RoundingPolicy policy) {
      this.roundingPolicy = Preconditions.checkNotNull(policy, "rounding policy");
      return this;
    }

    public Builder batchQuantisation(boolean batch) {
      this.batchQuantisation = batch;
      return this;
    }

    public ShotOptions build() {
      return new ShotOptions(this);
    }
  }
}
