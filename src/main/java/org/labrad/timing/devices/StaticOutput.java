package org.labrad.timing.devices;

import java.util.List;

import org.labrad.timing.DeviceHost;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.OutputInstruction;
import org.labrad.timing.instructions.Static;
import org.labrad.timing.validation.ValidationReport;

/**
 * An output that holds one value for the whole shot.
 */
public class StaticOutput extends Output {

  public StaticOutput(String name, DeviceHost parent, String connection) {
    super(name, parent, connection);
  }

  @Override
  public final NodeKind getKind() {
    return NodeKind.STATIC_OUTPUT;
  }

  /**
   * Set the value of this output for the whole shot.
   * @return the time taken, which is zero
   */
  public double setStatic(double value) {
    new Static(this, value);
    return 0;
  }

  /**
   * A static output can only be set once.
   */
  @Override
  protected void checkOverlaps(ValidationReport report, List<OutputInstruction> sorted) {
    List<Instruction> statics = getInstructions();
    for (int i = 1; i < statics.size(); i++) {
      report.add(statics.get(i), "sets static output '%s' a second time; it is already %s",
          getName(), ((Static)statics.get(0)).getValue());
    }
  }
}
