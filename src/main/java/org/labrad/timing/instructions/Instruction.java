package org.labrad.timing.instructions;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

import org.labrad.timing.InstructionHost;
import org.labrad.timing.Node;
import org.labrad.timing.Shot;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.enums.InstructionKind;
import org.labrad.timing.enums.Operation;
import org.labrad.timing.errors.QuantisationException;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSet;

/**
 * Something to happen at a given time, owned by the shot (waits) or by
 * an output (everything else).
 *
 * Times given by the user are nominal times in seconds from the start of
 * the shot.  Converting the timing measures each time from the moment the
 * instruction's pseudoclock became responsive after the most recent wait,
 * and puts it on that pseudoclock's tick grid.
 */
public abstract class Instruction extends Node {

  /**
   * Orders instructions by nominal time, then by creation order.
   */
  public static final Comparator<Instruction> NOMINAL_ORDER = new Comparator<Instruction>() {
    @Override
    public int compare(Instruction a, Instruction b) {
      return ComparisonChain.start()
          .compare(a.getT(), b.getT())
          .compare(a.getNumber(), b.getNumber())
          .result();
    }
  };

  private static final Set<Operation> REQUIRED = ImmutableSet.of(Operation.CONVERT_TIMING);

  private final InstructionHost parent;
  private final Shot shot;
  private final double t;
  private final int number;

  // set in convertTiming
  private boolean converted = false;
  private int segment;
  private double segmentOrigin;
  private double relativeT;
  private Long quantisedT;

  protected Instruction(InstructionHost parent, double t) {
    Preconditions.checkNotNull(parent, "Instruction must have a parent");
    this.parent = parent;
    this.shot = parent.getShot();
    this.t = t;
    enforce(Operation.ADD_INSTRUCTION);
    this.number = shot.nextInstructionNumber();
    parent.addInstruction(this);
    shot.getRegistry().register(this);
  }

  public abstract InstructionKind getKind();

  public InstructionHost getParent() {
    return parent;
  }

  @Override
  public Shot getShot() {
    return shot;
  }

  /**
   * Nominal time in seconds from the start of the shot.
   */
  public double getT() {
    return t;
  }

  /**
   * Position of this instruction in the shot's creation order.
   */
  public int getNumber() {
    return number;
  }

  @Override
  public Set<Operation> getRequiredOperations() {
    return REQUIRED;
  }

  //
  // Timing
  //

  /**
   * Resolve this instruction's time relative to its segment, and quantise it.
   * Subclasses with further times to resolve must call this first.
   * @param waits every wait in the shot, sorted by time
   */
  public void convertTiming(List<Wait> waits) {
    enforce(Operation.CONVERT_TIMING);
    segment = findSegment(waits);
    segmentOrigin = (segment == 0) ? 0 : waits.get(segment - 1).getT() + shot.getWaitDeadTime();
    relativeT = t - segmentOrigin;
    quantisedT = quantise(relativeT, "time");
    converted = true;
  }

  /**
   * Count the waits at or before this instruction.
   */
  protected int findSegment(List<Wait> waits) {
    int count = 0;
    for (Wait wait : waits) {
      if (wait.getT() <= t) {
        count++;
      }
    }
    return count;
  }

  /**
   * Measure a nominal time from the start of this instruction's segment.
   */
  protected double toRelative(double time) {
    return time - segmentOrigin;
  }

  /**
   * Quantise a relative time on this instruction's pseudoclock.
   * @param relative seconds from the start of the segment
   * @param what description of the time, for error messages
   * @return
   */
  protected Long quantise(double relative, String what) {
    Pseudoclock pseudoclock = parent.getPseudoclock();
    if (pseudoclock == null) {
      return quantiseWithoutPseudoclock(relative, what);
    }
    try {
      return shot.getQuantiser().toTicks(relative, pseudoclock.getTimebase(), what);
    } catch (QuantisationException ex) {
      throw new QuantisationException(String.format("%s on pseudoclock '%s': %s%n  created at %s",
          this, pseudoclock.getName(), ex.getMessage(), getCreationSite()), ex);
    }
  }

  /**
   * Quantise a time for an instruction outside any clock domain.  Only a
   * time of zero makes sense there.
   */
  protected Long quantiseWithoutPseudoclock(double relative, String what) {
    if (relative != 0) {
      throw new QuantisationException(String.format(
          "%s has no pseudoclock, so its %s must be 0, not %s s%n  created at %s",
          this, what, relative, getCreationSite()));
    }
    return 0L;
  }

  public boolean isConverted() {
    return converted;
  }

  protected void checkConverted() {
    Preconditions.checkState(converted, "Timing of %s has not been converted", this);
  }

  /**
   * Index of the wait-delimited segment this instruction falls in.  Segment
   * 0 runs from the start of the shot to the first wait.
   */
  public int getSegment() {
    checkConverted();
    return segment;
  }

  /**
   * Time from the start of the segment, in seconds.
   */
  public double getRelativeT() {
    checkConverted();
    return relativeT;
  }

  /**
   * Time from the start of the segment, in ticks of the pseudoclock.
   */
  public long getQuantisedT() {
    checkConverted();
    Preconditions.checkState(quantisedT != null, "%s has no single quantised time", this);
    return quantisedT;
  }

  /**
   * Duration in ticks.  Zero for instructions that happen at a single tick.
   */
  public long getQuantisedDuration() {
    checkConverted();
    return 0;
  }

  /**
   * Whether this instruction occupies a single tick.
   */
  public boolean isPoint() {
    return getQuantisedDuration() == 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("number", number)
        .add("t", t)
        .add("on", parent.getName())
        .toString();
  }
}
