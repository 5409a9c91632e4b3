package org.labrad.timing;

import java.util.List;

import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.Instruction;

/**
 * A node that can own instructions: the shot (waits) and outputs.
 */
public interface InstructionHost {
  public String getName();
  public NodeKind getKind();
  public Shot getShot();
  public Pseudoclock getPseudoclock();

  /**
   * Attach an instruction to this host.  Called by the instruction's
   * constructor; fails if the instruction's kind is not accepted here.
   */
  public void addInstruction(Instruction instruction);
  public List<Instruction> getInstructions();
}
