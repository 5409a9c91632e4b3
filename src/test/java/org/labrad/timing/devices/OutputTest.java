package org.labrad.timing.devices;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.ShotFixture;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.validation.ValidationReport;
import org.labrad.timing.validation.Violation;

public class OutputTest {

  private static String onlyMessage(List<Violation> violations, Instruction inst) {
    String found = null;
    for (Violation v : violations) {
      if (v.getNode() == inst) {
        Assert.assertNull("more than one violation for " + inst, found);
        found = v.getMessage();
      }
    }
    Assert.assertNotNull("no violation for " + inst, found);
    return found;
  }

  @Test public void overlappingRampsAreReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.function(1, 1, ShotFixture.RAMP, 100);
    f.ao.function(1.5, 1, ShotFixture.RAMP, 100);
    f.ao.function(3, 1, ShotFixture.RAMP, 100);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 5);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(1)).contains("overlaps"));
  }

  @Test public void twoValuesAtTheSameTickConflict() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(2, 1);
    f.ao.constant(2, 3);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 5);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(1)).contains("same tick"));
  }

  @Test public void instructionsInsideWaitDeadTimeAreReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.shot.wait(5, "w");
    f.ao.constant(5.2, 1);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("dead time"));
  }

  @Test public void instructionsBeforeTheShotAreReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(-0.5, 1);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("before the start"));
  }

  @Test public void instructionsBeforeTheOutputStartsAreReported() {
    ShotFixture f = new ShotFixture();
    f.card.setOutputDelay(1e-5);
    f.shot.start();
    f.ao.constant(0, 1);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("starts at"));
  }

  @Test public void rampsMustNotRunIntoTheNextWait() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.function(4, 2, ShotFixture.RAMP, 100);
    f.shot.wait(5, "w");
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("after wait 'w'"));
  }

  @Test public void instructionsMustEndBeforeTheStop() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.function(7, 2, ShotFixture.RAMP, 100);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("end of the shot"));
  }

  @Test public void negativeDurationsAreReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.function(3, -0.5, ShotFixture.RAMP, 100);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 8);
    Assert.assertTrue(onlyMessage(violations, f.ao.getInstructions().get(0)).contains("negative duration"));
  }

  @Test public void compiledInstructionsAreInTickOrder() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(3, 0);
    f.ao.constant(1, 1);
    f.shot.wait(2, "w");
    f.ao.constant(2.75, 2);
    f.shot.stop(4);
    List<OutputInstruction> compiled = f.ao.getCompiledInstructions();
    Assert.assertEquals(3, compiled.size());
    Assert.assertSame(f.ao.getInstructions().get(1), compiled.get(0));
    Assert.assertSame(f.ao.getInstructions().get(2), compiled.get(1));
    Assert.assertSame(f.ao.getInstructions().get(0), compiled.get(2));
    // 3 s is 0.4999999 s after the wait's dead time ends
    Assert.assertEquals(4999999, compiled.get(2).getQuantisedT());
    Assert.assertEquals(2499999, compiled.get(1).getQuantisedT());
  }

  @Test(expected = IllegalStateException.class)
  public void compiledInstructionsNeedACompiledShot() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(1, 0);
    f.ao.getCompiledInstructions();
  }

  @Test public void violationsCarryTheirCreationSite() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(-1, 0);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 1);
    Violation v = violations.get(0);
    Assert.assertEquals(OutputTest.class.getName(), v.getCreationSite().getClassName());
    Assert.assertEquals("violationsCarryTheirCreationSite", v.getCreationSite().getMethodName());
    ValidationReport report = f.shot.getValidationReport();
    Assert.assertTrue(report.format().contains("OutputTest.java"));
  }
}
