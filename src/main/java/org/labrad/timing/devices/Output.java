package org.labrad.timing.devices;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

import org.labrad.timing.Device;
import org.labrad.timing.DeviceHost;
import org.labrad.timing.InstructionHost;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.Constant;
import org.labrad.timing.instructions.Function;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.instructions.Static;
import org.labrad.timing.instructions.Wait;
import org.labrad.timing.util.InstructionList;
import org.labrad.timing.validation.ValidationReport;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A single output channel of a triggered or clocked device.
 *
 * Outputs own the instructions that drive them.  An output may also own
 * plain devices that its signal passes through.
 */
public class Output extends Device implements InstructionHost {

  /**
   * Orders converted instructions by segment, then tick, then creation order.
   */
  public static final Comparator<Instruction> COMPILED_ORDER = new Comparator<Instruction>() {
    @Override
    public int compare(Instruction a, Instruction b) {
      return ComparisonChain.start()
          .compare(a.getSegment(), b.getSegment())
          .compare(a.getQuantisedT(), b.getQuantisedT())
          .compare(a.getNumber(), b.getNumber())
          .result();
    }
  };

  private final InstructionList instructions = new InstructionList(this);

  public Output(String name, DeviceHost parent, String connection) {
    super(name, parent, connection);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.OUTPUT;
  }

  //
  // Instructions
  //

  public void addInstruction(Instruction instruction) {
    instructions.add(instruction);
  }

  public List<Instruction> getInstructions() {
    return instructions.asList();
  }

  /**
   * Set the output to a value at time t.
   * @return the time taken, which is zero
   */
  public double constant(double t, double value) {
    new Constant(this, t, value);
    return 0;
  }

  /**
   * Ramp the output along a function of the time since t.
   * @param t start time
   * @param duration
   * @param function maps seconds since t to the output value
   * @param sampleRate samples per second
   * @return the duration of the ramp
   */
  public double function(double t, double duration, DoubleUnaryOperator function, double sampleRate) {
    new Function(this, t, duration, function, sampleRate);
    return duration;
  }

  /**
   * Get the instructions in the order the output carries them out.
   * Only valid once timing has been converted.
   */
  public List<OutputInstruction> getSortedInstructions() {
    List<Instruction> sorted = Lists.newArrayList(instructions.asList());
    Collections.sort(sorted, COMPILED_ORDER);
    List<OutputInstruction> result = Lists.newArrayList();
    for (Instruction inst : sorted) {
      result.add((OutputInstruction)inst);
    }
    return result;
  }

  /**
   * Get the validated instructions for this output, in order, for code
   * generation.
   */
  public List<OutputInstruction> getCompiledInstructions() {
    Preconditions.checkState(getShot().isCompiled(), "Shot '%s' has not been compiled",
        getShot().getName());
    return ImmutableList.copyOf(getSortedInstructions());
  }

  //
  // Validation
  //

  @Override
  public void checkInstructionsValid(ValidationReport report) {
    super.checkInstructionsValid(report);
    List<Wait> waits = getShot().getWaits();
    double stopTime = getShot().getStopTime();
    List<OutputInstruction> sorted = getSortedInstructions();

    for (OutputInstruction inst : sorted) {
      int segment = inst.getSegment();
      if (inst.getQuantisedDuration() < 0) {
        report.add(inst, "has a negative duration of %d ticks", inst.getQuantisedDuration());
      }
      if (inst.getRelativeT() < 0) {
        if (segment == 0) {
          report.add(inst, "is before the start of the shot");
        } else {
          Wait wait = waits.get(segment - 1);
          report.add(inst, "is %s s after wait '%s', inside its dead time of %s s",
              inst.getT() - wait.getT(), wait.getName(), getShot().getWaitDeadTime());
        }
      } else if (segment == 0 && inst.getT() < getT0() && !(inst instanceof Static)) {
        report.add(inst, "is before output '%s' starts at t=%s", getName(), getT0());
      }
      if (segment < waits.size() && inst.getEndT() > waits.get(segment).getT()) {
        Wait wait = waits.get(segment);
        report.add(inst, "ends at t=%s, after wait '%s' at t=%s",
            inst.getEndT(), wait.getName(), wait.getT());
      }
      if (inst.getEndT() > stopTime) {
        report.add(inst, "ends at t=%s, after the end of the shot at t=%s", inst.getEndT(), stopTime);
      }
    }
    checkOverlaps(report, sorted);
  }

  /**
   * Check that no two ramps overlap, and that no two instructions set the
   * output at the same tick.
   * @param sorted instructions in compiled order
   */
  protected void checkOverlaps(ValidationReport report, List<OutputInstruction> sorted) {
    OutputInstruction running = null;
    long runningEnd = 0;
    OutputInstruction lastPoint = null;
    for (OutputInstruction inst : sorted) {
      if (running != null && running.getSegment() != inst.getSegment()) {
        running = null;
      }
      if (lastPoint != null && lastPoint.getSegment() != inst.getSegment()) {
        lastPoint = null;
      }
      long start = inst.getQuantisedT();
      if (inst.isPoint()) {
        if (lastPoint != null && lastPoint.getQuantisedT() == start) {
          report.add(inst, "sets output '%s' at the same tick as %s", getName(), lastPoint);
        }
        lastPoint = inst;
      } else {
        long end = start + inst.getQuantisedDuration();
        if (running != null && start < runningEnd) {
          report.add(inst, "overlaps %s on output '%s'", running, getName());
        }
        if (running == null || end > runningEnd) {
          running = inst;
          runningEnd = end;
        }
      }
    }
  }
}
