package org.labrad.timing.util;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.InstructionHost;
import org.labrad.timing.Shot;
import org.labrad.timing.ShotFixture;
import org.labrad.timing.ShotOptions;
import org.labrad.timing.enums.InstructionKind;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.errors.StructuralException;
import org.labrad.timing.instructions.Constant;
import org.labrad.timing.instructions.Function;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.Static;
import org.labrad.timing.instructions.Wait;

public class InstructionListTest {

  static Instruction create(InstructionHost host, InstructionKind kind) {
    switch (kind) {
      case WAIT: return new Wait(host, 1, "wait");
      case FUNCTION: return new Function(host, 1, 1, ShotFixture.RAMP, 10);
      case CONSTANT: return new Constant(host, 1, 2);
      case STATIC: return new Static(host, 2);
      default:
        throw new RuntimeException("Unknown kind: " + kind);
    }
  }

  @Test public void instructionsAreAcceptedExactlyWhenTheirKindIs() {
    NodeKind[] hosts = { NodeKind.SHOT, NodeKind.OUTPUT, NodeKind.TRIGGER, NodeKind.STATIC_OUTPUT };
    for (NodeKind hostKind : hosts) {
      for (InstructionKind kind : InstructionKind.values()) {
        Shot shot = new Shot("composition", ShotOptions.defaults());
        InstructionHost host = (InstructionHost)DeviceListTest.hostOfKind(shot, hostKind);
        shot.start();
        boolean accepted;
        try {
          Instruction inst = create(host, kind);
          Assert.assertSame(host, inst.getParent());
          accepted = true;
        } catch (StructuralException ex) {
          Assert.assertTrue(ex.getMessage().contains("kind " + kind));
          accepted = false;
        }
        String pair = hostKind + " <- " + kind;
        Assert.assertEquals(pair, hostKind.acceptsInstruction(kind), accepted);
        Assert.assertEquals(pair, accepted ? 1 : 0, host.getInstructions().size());
      }
    }
  }

  @Test public void rejectedInstructionsAreNotAdded() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    try {
      f.shot.wait(1, null);
      Assert.fail("expected NullPointerException");
    } catch (NullPointerException ex) {
      // expected
    }
    try {
      f.ao.function(0, 1, ShotFixture.RAMP, -5);
      Assert.fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException ex) {
      Assert.assertTrue(ex.getMessage().contains("Sample rate"));
    }
    Assert.assertTrue(f.shot.getInstructions().isEmpty());
    Assert.assertTrue(f.ao.getInstructions().isEmpty());
    Assert.assertEquals(0, f.shot.getTotalInstructions());
    f.shot.stop(1);
    Assert.assertTrue(f.shot.isCompiled());
  }

  @Test public void devicesWithoutInstructionsAcceptNone() {
    for (NodeKind kind : NodeKind.values()) {
      if (kind != NodeKind.SHOT && kind != NodeKind.OUTPUT && kind != NodeKind.TRIGGER
          && kind != NodeKind.STATIC_OUTPUT) {
        Assert.assertTrue(kind.getAcceptedInstructions().isEmpty());
      }
    }
  }
}
