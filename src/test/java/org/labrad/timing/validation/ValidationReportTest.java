package org.labrad.timing.validation;

import org.junit.Assert;
import org.junit.Test;
import org.labrad.timing.ShotFixture;

public class ValidationReportTest {

  @Test public void formatsEveryViolation() {
    ShotFixture f = new ShotFixture();
    ValidationReport report = new ValidationReport();
    Assert.assertTrue(report.isEmpty());
    report.add(f.card, "is too slow by %d ticks", 3);
    report.add(f.ao, "is broken");
    Assert.assertEquals(2, report.size());
    Assert.assertEquals("is too slow by 3 ticks", report.getViolations().get(0).getMessage());
    Assert.assertEquals(1, report.getViolations(f.ao).size());
    String text = report.format();
    Assert.assertTrue(text.startsWith("2 problems found"));
    Assert.assertTrue(text.contains("is broken"));
    Assert.assertTrue(text.contains("created at"));
  }
}
