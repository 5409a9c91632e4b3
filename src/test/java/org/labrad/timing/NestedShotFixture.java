package org.labrad.timing;

import org.labrad.timing.devices.ClockLine;
import org.labrad.timing.devices.ClockableDevice;
import org.labrad.timing.devices.Output;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.devices.PseudoclockDevice;
import org.labrad.timing.devices.Trigger;

/**
 * The simple shot, plus a second pseudoclock device started by a trigger
 * output of the first card: a nested clock domain with a 200 ns timebase.
 */
public class NestedShotFixture extends ShotFixture {
  public static final double SLAVE_TIMEBASE = 2e-7;
  public static final double SLAVE_TRIGGER_DURATION = 1e-6;

  public final Trigger trigger;
  public final PseudoclockDevice slave;
  public final Pseudoclock slaveClock;
  public final ClockLine slaveLine;
  public final ClockableDevice slaveCard;
  public final Output slaveAo;

  public NestedShotFixture() {
    this(ShotOptions.defaults());
  }

  public NestedShotFixture(ShotOptions options) {
    super(options);
    trigger = new Trigger("trigger", card, "port0/line0");
    slave = new PseudoclockDevice("slave", trigger, null, SLAVE_TRIGGER_DURATION);
    slaveClock = new Pseudoclock("slave_clock", slave, "clock", SLAVE_TIMEBASE, 0.1);
    slaveLine = new ClockLine("slave_line", slaveClock, "flag 0");
    slaveCard = new ClockableDevice("slave_card", slaveLine, "clock", 1e-7, 2e-6);
    slaveAo = new Output("slave_ao0", slaveCard, "ao0");
  }
}
