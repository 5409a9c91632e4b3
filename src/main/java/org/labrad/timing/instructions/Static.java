package org.labrad.timing.instructions;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.enums.InstructionKind;

/**
 * A value held by a static output for the whole shot.
 */
public class Static extends OutputInstruction {
  private final double value;

  public Static(InstructionHost parent, double value) {
    super(parent, 0);
    this.value = value;
  }

  @Override
  public InstructionKind getKind() {
    return InstructionKind.STATIC;
  }

  public double getValue() {
    return value;
  }
}
