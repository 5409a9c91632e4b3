package org.labrad.timing.instructions;

import java.util.List;
import java.util.Map;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.InstructionKind;
import org.labrad.timing.errors.QuantisationException;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Pauses every pseudoclock until an external trigger arrives, and so ends
 * one segment of the shot.
 *
 * A wait belongs to the shot rather than to one pseudoclock, so its time
 * is quantised separately on each of them.
 */
public class Wait extends Instruction {
  private final String name;
  private Map<Pseudoclock, Long> quantisedTimes = null;

  public Wait(InstructionHost parent, double t, String name) {
    super(checkName(parent, name), t);
    this.name = name;
  }

  private static InstructionHost checkName(InstructionHost parent, String name) {
    Preconditions.checkNotNull(name, "Wait name must not be null");
    return parent;
  }

  @Override
  public InstructionKind getKind() {
    return InstructionKind.WAIT;
  }

  public String getName() {
    return name;
  }

  @Override
  public void convertTiming(List<Wait> waits) {
    super.convertTiming(waits);
    ImmutableMap.Builder<Pseudoclock, Long> times = ImmutableMap.builder();
    for (Pseudoclock pseudoclock : getShot().getPseudoclocks()) {
      try {
        times.put(pseudoclock, getShot().getQuantiser().toTicks(
            getRelativeT(), pseudoclock.getTimebase(), "time of wait '" + name + "'"));
      } catch (QuantisationException ex) {
        throw new QuantisationException(String.format("%s on pseudoclock '%s'%n  created at %s",
            ex.getMessage(), pseudoclock.getName(), getCreationSite()), ex);
      }
    }
    quantisedTimes = times.build();
  }

  /**
   * A wait ends the segment it is in, so only earlier waits count.
   */
  @Override
  protected int findSegment(List<Wait> waits) {
    int count = 0;
    for (Wait wait : waits) {
      if (wait.getT() < getT()) {
        count++;
      }
    }
    return count;
  }

  @Override
  protected Long quantiseWithoutPseudoclock(double relative, String what) {
    return null;
  }

  /**
   * Get the time of this wait in ticks of the given pseudoclock,
   * measured from the start of its segment.
   */
  public long getQuantisedT(Pseudoclock pseudoclock) {
    Preconditions.checkState(quantisedTimes != null, "Timing of wait '%s' has not been converted", name);
    Preconditions.checkArgument(quantisedTimes.containsKey(pseudoclock),
        "Pseudoclock '%s' is not part of this shot", pseudoclock.getName());
    return quantisedTimes.get(pseudoclock);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("t", getT())
        .toString();
  }
}
