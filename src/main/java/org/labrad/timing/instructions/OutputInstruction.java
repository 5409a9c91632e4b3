package org.labrad.timing.instructions;

import java.util.List;

import org.labrad.timing.InstructionHost;

import com.google.common.collect.ImmutableList;

/**
 * An instruction that drives the value of an output.
 */
public abstract class OutputInstruction extends Instruction {

  protected OutputInstruction(InstructionHost parent, double t) {
    super(parent, t);
  }

  /**
   * Nominal time at which this instruction stops driving the output.
   */
  public double getEndT() {
    return getT();
  }

  /**
   * The ticks at which the output has to be updated, measured from the
   * start of the segment.
   */
  public List<Long> getTicks() {
    return ImmutableList.of(getQuantisedT());
  }
}
