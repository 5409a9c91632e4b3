package org.labrad.timing.devices;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.ShotFixture;
import org.labrad.timing.errors.StructuralException;
import org.labrad.timing.instructions.Static;
import org.labrad.timing.validation.Violation;

public class StaticOutputTest {

  @Test public void staticValueIsAtTheStartOfTheShot() {
    ShotFixture f = new ShotFixture();
    StaticOutput gain = new StaticOutput("gain", f.card, "gain");
    f.card.setOutputDelay(1e-3);
    f.shot.start();
    Assert.assertEquals(0, gain.setStatic(4), 0);
    f.shot.wait(1, "w");
    f.shot.stop(2);
    Static value = (Static)gain.getCompiledInstructions().get(0);
    Assert.assertEquals(4, value.getValue(), 0);
    Assert.assertEquals(0, value.getT(), 0);
    Assert.assertEquals(0, value.getQuantisedT());
    Assert.assertEquals(0, value.getSegment());
  }

  @Test public void canOnlyBeSetOnce() {
    ShotFixture f = new ShotFixture();
    StaticOutput gain = new StaticOutput("gain", f.card, "gain");
    f.shot.start();
    gain.setStatic(4);
    gain.setStatic(5);
    List<Violation> violations = ClockLineTest.stopAndCollect(f, 2);
    Assert.assertEquals(1, violations.size());
    Assert.assertSame(gain.getInstructions().get(1), violations.get(0).getNode());
    Assert.assertTrue(violations.get(0).getMessage().contains("second time"));
  }

  @Test(expected = StructuralException.class)
  public void doesNotAcceptRamps() {
    ShotFixture f = new ShotFixture();
    StaticOutput gain = new StaticOutput("gain", f.card, "gain");
    f.shot.start();
    gain.constant(1, 2);
  }
}
