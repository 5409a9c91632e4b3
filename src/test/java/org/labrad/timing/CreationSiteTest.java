package org.labrad.timing;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.devices.Output;
import org.labrad.timing.errors.StructuralException;

public class CreationSiteTest {

  @Test public void pointsAtTheCallerNotTheNodeClasses() {
    ShotFixture f = new ShotFixture();
    Output output = new Output("ao1", f.card, "ao1") {
      // a downstream subclass
    };
    CreationSite site = output.getCreationSite();
    Assert.assertTrue(site.isKnown());
    Assert.assertEquals(CreationSiteTest.class.getName(), site.getClassName());
    Assert.assertEquals("pointsAtTheCallerNotTheNodeClasses", site.getMethodName());
    Assert.assertEquals("CreationSiteTest.java", site.getFileName());
    Assert.assertTrue(site.getLineNumber() > 0);
  }

  @Test public void fixtureDevicesPointAtTheFixture() {
    ShotFixture f = new ShotFixture();
    Assert.assertEquals(ShotFixture.class.getName(), f.card.getCreationSite().getClassName());
    Assert.assertEquals(ShotFixture.class.getName(), f.shot.getCreationSite().getClassName());
  }

  @Test public void structuralErrorsNameTheCreationSite() {
    ShotFixture f = new ShotFixture();
    try {
      new Device("amplifier", f.card, "0");
      Assert.fail("expected StructuralException");
    } catch (StructuralException ex) {
      Assert.assertTrue(ex.getMessage().contains("structuralErrorsNameTheCreationSite"));
      Assert.assertTrue(ex.getMessage().contains("CreationSiteTest.java"));
    }
  }
}
