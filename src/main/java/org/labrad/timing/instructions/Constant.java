package org.labrad.timing.instructions;

import java.util.function.DoubleUnaryOperator;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.enums.InstructionKind;

/**
 * Sets an output to a fixed value.  This is a ramp of zero length that is
 * sampled once.
 */
public class Constant extends Function {
  private final double value;

  public Constant(InstructionHost parent, double t, double value) {
    super(parent, t, 0, constantFunction(value), 0);
    this.value = value;
  }

  private static DoubleUnaryOperator constantFunction(final double value) {
    return new DoubleUnaryOperator() {
      @Override
      public double applyAsDouble(double t) {
        return value;
      }
    };
  }

  @Override
  public InstructionKind getKind() {
    return InstructionKind.CONSTANT;
  }

  public double getValue() {
    return value;
  }
}
