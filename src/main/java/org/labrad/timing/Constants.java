package org.labrad.timing;

import org.labrad.timing.enums.RoundingPolicy;

public class Constants {
  /*
   * Safety margin (in seconds) added to the wait delay after every wait,
   * on top of the slowest pseudoclock's minimum wait duration
   */
  public static final double DEFAULT_EPSILON = 100e-9;

  /*
   * How far (as a fraction of one tick) a requested time may be from a
   * tick and still be considered on it
   */
  public static final double DEFAULT_QUANTISATION_TOLERANCE = 1e-3;

  public static final RoundingPolicy DEFAULT_ROUNDING_POLICY = RoundingPolicy.NEAREST;

  /*
   * Whether to resolve every instruction before reporting quantisation errors
   */
  public static final boolean DEFAULT_BATCH_QUANTISATION = false;

  /*
   * Property keys understood by ShotOptions.fromProperties
   */
  public static final String EPSILON_KEY = "shot.epsilon";
  public static final String QUANTISATION_TOLERANCE_KEY = "shot.quantisationTolerance";
  public static final String ROUNDING_POLICY_KEY = "shot.rounding";
  public static final String BATCH_QUANTISATION_KEY = "shot.batchQuantisation";
}
