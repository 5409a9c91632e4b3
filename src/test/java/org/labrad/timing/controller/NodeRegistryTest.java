package org.labrad.timing.controller;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.ShotFixture;

public class NodeRegistryTest {

  @Test public void nodesAreIndexedInAttachOrder() {
    ShotFixture f = new ShotFixture();
    NodeRegistry registry = f.shot.getRegistry();
    Assert.assertEquals(6, registry.size());
    Assert.assertEquals(0, registry.indexOf(f.shot));
    Assert.assertEquals(1, registry.indexOf(f.pulseblaster));
    Assert.assertEquals(5, registry.indexOf(f.ao));
    Assert.assertSame(f.card, registry.get(4));
  }

  @Test(expected = IllegalArgumentException.class)
  public void nodesRegisterOnce() {
    ShotFixture f = new ShotFixture();
    f.shot.getRegistry().register(f.ao);
  }

  @Test public void nodesOfOtherShotsAreUnknown() {
    ShotFixture a = new ShotFixture();
    ShotFixture b = new ShotFixture();
    Assert.assertFalse(a.shot.getRegistry().isRegistered(b.ao));
    Assert.assertTrue(b.shot.getRegistry().isRegistered(b.ao));
  }
}
