package org.labrad.timing.devices;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.Device;
import org.labrad.timing.NestedShotFixture;
import org.labrad.timing.ShotFixture;

public class DeviceTest {

  @Test public void startTimesFollowOutputDelays() {
    NestedShotFixture f = new NestedShotFixture();
    f.card.setOutputDelay(1e-6);
    f.slave.setInitialTriggerTime(0.01);
    f.shot.start();
    Assert.assertEquals(0, f.pulseblaster.getT0(), 0);
    Assert.assertEquals(0, f.card.getT0(), 0);
    Assert.assertEquals(1e-6, f.ao.getT0(), 0);
    Assert.assertEquals(1e-6, f.trigger.getT0(), 0);
    Assert.assertEquals(0.010001, f.slave.getT0(), 1e-12);
    Assert.assertEquals(0.010001, f.slaveAo.getT0(), 1e-12);
  }

  @Test public void latencyAddsUpAlongThePath() {
    NestedShotFixture f = new NestedShotFixture();
    f.pulseblaster.setOutputDelay(2e-7);
    f.card.setOutputDelay(1e-6);
    f.slaveCard.setOutputDelay(3e-6);
    f.shot.start();
    Assert.assertEquals(0, f.pulseblaster.getAncestorLatency(), 0);
    Assert.assertEquals(2e-7, f.clock.getAncestorLatency(), 1e-15);
    Assert.assertEquals(2e-7, f.card.getAncestorLatency(), 1e-15);
    Assert.assertEquals(1.2e-6, f.trigger.getAncestorLatency(), 1e-15);
    Assert.assertEquals(1.2e-6, f.slaveCard.getAncestorLatency(), 1e-15);
    Assert.assertEquals(4.2e-6, f.slaveAo.getAncestorLatency(), 1e-15);
  }

  @Test public void initialAttributesDoNotChangeLimits() {
    ShotFixture f = new ShotFixture();
    f.card.setOutputDelay(5e-6);
    f.shot.start();
    Assert.assertEquals(12, f.line.getCommonMinimumPeriodTicks());
  }

  @Test(expected = IllegalStateException.class)
  public void startTimeUnknownBeforeStart() {
    ShotFixture f = new ShotFixture();
    f.ao.getT0();
  }

  @Test public void plainDevicesPassOutputsThrough() {
    ShotFixture f = new ShotFixture();
    Device amplifier = new Device("amplifier", f.ao, "in");
    f.shot.start();
    Assert.assertSame(f.clock, amplifier.getPseudoclock());
    Assert.assertEquals("in", amplifier.getConnection());
    Assert.assertSame(f.ao, amplifier.getParent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void outputDelayMustNotBeNegative() {
    ShotFixture f = new ShotFixture();
    f.card.setOutputDelay(-1);
  }
}
