package org.labrad.timing.util;

import java.util.List;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.enums.InstructionKind;
import org.labrad.timing.errors.StructuralException;
import org.labrad.timing.instructions.Instruction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * The instructions of a host, in the order they were created.
 * Only instructions of a kind accepted by the host can be added.
 */
public class InstructionList {
  private final InstructionHost host;
  private final List<Instruction> instructions = Lists.newArrayList();

  public InstructionList(InstructionHost host) {
    this.host = host;
  }

  public void add(Instruction instruction) {
    InstructionKind kind = instruction.getKind();
    if (!host.getKind().acceptsInstruction(kind)) {
      throw new StructuralException(String.format(
          "Instruction of kind %s not permitted on %s '%s', which accepts only %s"
          + "%n  created at %s",
          kind, host.getKind(), host.getName(),
          host.getKind().getAcceptedInstructions(), instruction.getCreationSite()));
    }
    Preconditions.checkArgument(instruction.getParent() == host,
        "%s belongs to '%s', not '%s'", instruction,
        instruction.getParent().getName(), host.getName());
    instructions.add(instruction);
  }

  public List<Instruction> asList() {
    return ImmutableList.copyOf(instructions);
  }

  public int size() {
    return instructions.size();
  }
}
