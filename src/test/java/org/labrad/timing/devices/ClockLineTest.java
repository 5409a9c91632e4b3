package org.labrad.timing.devices;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.NestedShotFixture;
import org.labrad.timing.ShotFixture;
import org.labrad.timing.errors.ValidationException;
import org.labrad.timing.validation.Violation;

public class ClockLineTest {

  @Test public void commonPeriodIsSlowestDeviceRoundedUpToTimebase() {
    ShotFixture f = new ShotFixture();
    ClockableDevice slow = new ClockableDevice("slow", f.line, "clock", 3e-7, 1.25e-6);
    new ClockableDevice("fast", f.line, "clock", 2e-7, 0.5e-6);
    f.shot.start();
    Assert.assertEquals(13, f.line.getCommonMinimumPeriodTicks());
    Assert.assertEquals(1.3e-6, f.line.getCommonMinimumPeriod(), 1e-15);
    Assert.assertSame(slow, f.line.getLimitingDevice());
    Assert.assertEquals(3e-7, f.line.getCommonMinimumTriggerDuration(), 0);
    Assert.assertSame(slow, f.line.getLimitingTriggerDevice());
  }

  @Test public void exactMultiplesAreNotRoundedUp() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    Assert.assertEquals(12, f.line.getCommonMinimumPeriodTicks());
    Assert.assertSame(f.card, f.line.getLimitingDevice());
  }

  @Test public void pseudoclockLimitsLineWhenDevicesAreFaster() {
    ShotFixture f = new ShotFixture();
    Pseudoclock slowClock = new Pseudoclock("slow_clock", f.pulseblaster, "clock 2", 1e-7, 5e-6, 0.5);
    ClockLine line = new ClockLine("line 2", slowClock, "flag 0");
    new ClockableDevice("card 2", line, "clock", 1e-7, 1e-6);
    f.shot.start();
    Assert.assertEquals(50, line.getCommonMinimumPeriodTicks());
    Assert.assertSame(slowClock, line.getLimitingDevice());
  }

  @Test(expected = IllegalStateException.class)
  public void limitsAreUnknownBeforeStart() {
    ShotFixture f = new ShotFixture();
    f.line.getCommonMinimumPeriod();
  }

  @Test public void ticksTooCloseTogetherAreReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(1.0, 0);
    f.ao.constant(1.0000005, 1);
    List<Violation> violations = stopAndCollect(f, 2);
    Assert.assertEquals(1, violations.size());
    Assert.assertSame(f.ao.getInstructions().get(1), violations.get(0).getNode());
    Assert.assertTrue(violations.get(0).getMessage().contains("ni_card"));
  }

  @Test public void ticksInDifferentSegmentsAreNotCompared() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.constant(1.0, 0);
    f.shot.wait(1.5, "w");
    // five ticks after the first constant, but measured from the end of the wait's dead time
    f.ao.constant(3.0000006, 1);
    f.shot.stop(4);
    Assert.assertTrue(f.shot.isCompiled());
    Assert.assertEquals(10000000, f.ao.getInstructions().get(0).getQuantisedT());
    Assert.assertEquals(10000005, f.ao.getInstructions().get(1).getQuantisedT());
    Assert.assertEquals(1, f.ao.getInstructions().get(1).getSegment());
  }

  @Test public void ticksShorterThanTwoTriggerDurationsAreReported() {
    ShotFixture f = new ShotFixture();
    ClockableDevice sluggish = new ClockableDevice("sluggish", f.line, "clock", 1e-6, 1e-6);
    Output out = new Output("ao1", sluggish, "ao0");
    f.shot.start();
    out.constant(1.0, 0);
    out.constant(1.0000015, 1);
    List<Violation> violations = stopAndCollect(f, 2);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(violations.get(0).getMessage().contains("trigger duration"));
    Assert.assertTrue(violations.get(0).getMessage().contains("sluggish"));
  }

  @Test public void rampSampledTooFastIsReported() {
    ShotFixture f = new ShotFixture();
    f.shot.start();
    f.ao.function(1, 0.001, ShotFixture.RAMP, 1e7);
    List<Violation> violations = stopAndCollect(f, 2);
    Assert.assertEquals(1, violations.size());
    Assert.assertTrue(violations.get(0).getMessage().contains("samples every"));
  }

  @Test public void nestedDomainsAreCheckedSeparately() {
    NestedShotFixture f = new NestedShotFixture();
    f.shot.start();
    f.ao.constant(1.0, 0);
    // two outer ticks later, but on the other pseudoclock
    f.slaveAo.constant(1.0000002, 1);
    f.shot.stop(2);
    Assert.assertTrue(f.shot.isCompiled());
  }

  static List<Violation> stopAndCollect(ShotFixture f, double stop) {
    try {
      f.shot.stop(stop);
    } catch (ValidationException ex) {
      return ex.getReport().getViolations();
    }
    Assert.fail("expected ValidationException");
    return null;
  }
}
