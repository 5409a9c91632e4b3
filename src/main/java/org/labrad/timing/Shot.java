package org.labrad.timing;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.labrad.timing.controller.NodeRegistry;
import org.labrad.timing.controller.PhaseController;
import org.labrad.timing.devices.Output;
import org.labrad.timing.devices.Pseudoclock;
import org.labrad.timing.devices.PseudoclockDevice;
import org.labrad.timing.enums.NodeKind;
import org.labrad.timing.enums.Operation;
import org.labrad.timing.enums.Phase;
import org.labrad.timing.errors.QuantisationException;
import org.labrad.timing.errors.StructuralException;
import org.labrad.timing.errors.ValidationException;
import org.labrad.timing.instructions.Instruction;
import org.labrad.timing.instructions.Wait;
import org.labrad.timing.util.DeviceList;
import org.labrad.timing.util.InstructionList;
import org.labrad.timing.util.Traversal;
import org.labrad.timing.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * "Shot holds the whole device tree and all instructions for one run of
 * the experiment, and drives their compilation into quantised sequences."
 *
 * Typical use: build the device tree, call {@link #start()}, issue
 * instructions (and {@link #wait(double, String)}s), then call
 * {@link #stop(double)}.  Once stop returns, every output's compiled
 * instruction list is ready for code generation.  A shot whose compilation
 * failed cannot be resumed; build a new one.
 */
public class Shot extends Node implements DeviceHost, InstructionHost {
  private static final Logger log = LoggerFactory.getLogger(Shot.class);

  private final String name;
  private final ShotOptions options;
  private final Quantiser quantiser;
  private final NodeRegistry registry = new NodeRegistry();
  private final PhaseController phaseController;

  private final DeviceList devices = new DeviceList(this);
  private final InstructionList instructions = new InstructionList(this);
  private final Map<String, Device> devicesByName = Maps.newHashMap();
  private PseudoclockDevice masterPseudoclockDevice = null;
  private int totalInstructions = 0;

  private Double nominalWaitDelay = null;
  private List<Wait> sortedWaits = null;
  private Double stopTime = null;
  private ValidationReport validationReport = null;

  /**
   * Create a new shot.
   * @param name
   * @param epsilon safety margin added to the dead time after each wait
   */
  public Shot(String name, double epsilon) {
    this(name, ShotOptions.builder().epsilon(epsilon).build());
  }

  public Shot(String name, ShotOptions options) {
    this.name = Preconditions.checkNotNull(name, "Shot name must not be null");
    this.options = Preconditions.checkNotNull(options, "Shot options must not be null");
    this.quantiser = Quantiser.forOptions(options);
    this.phaseController = new PhaseController(name, registry);
    registry.register(this);
  }

  public String getName() {
    return name;
  }

  public NodeKind getKind() {
    return NodeKind.SHOT;
  }

  @Override
  public Shot getShot() {
    return this;
  }

  /**
   * The shot is outside every clock domain.
   */
  public Pseudoclock getPseudoclock() {
    return null;
  }

  public ShotOptions getOptions() {
    return options;
  }

  public Quantiser getQuantiser() {
    return quantiser;
  }

  public NodeRegistry getRegistry() {
    return registry;
  }

  public PhaseController getPhaseController() {
    return phaseController;
  }

  public Phase getPhase() {
    return phaseController.getPhase();
  }

  @Override
  public Set<Operation> getRequiredOperations() {
    return TREE_PASSES;
  }

  //
  // Devices
  //

  void checkDeviceName(Device device) {
    if (devicesByName.containsKey(device.getName())) {
      throw new StructuralException(String.format(
          "Shot '%s' already has a device named '%s'%n  created at %s",
          name, device.getName(), device.getCreationSite()));
    }
  }

  void registerDevice(Device device) {
    devicesByName.put(device.getName(), device);
    registry.register(device);
  }

  public void addDevice(Device device) {
    if (device instanceof PseudoclockDevice && masterPseudoclockDevice != null) {
      throw new StructuralException(String.format(
          "Cannot add second master pseudoclock device '%s'. "
          + "Already have master pseudoclock device '%s'%n  created at %s",
          device.getName(), masterPseudoclockDevice.getName(), device.getCreationSite()));
    }
    devices.add(device);
    if (device instanceof PseudoclockDevice) {
      masterPseudoclockDevice = (PseudoclockDevice)device;
    }
  }

  public List<Device> getDevices() {
    return devices.asList();
  }

  public Device getDevice(String name) {
    Preconditions.checkArgument(devicesByName.containsKey(name),
        "Device '%s' not found.", name);
    return devicesByName.get(name);
  }

  @SuppressWarnings("unchecked")
  public <T extends Device> T getDevice(String name, Class<T> cls) {
    Device device = getDevice(name);
    Preconditions.checkArgument(cls.isInstance(device),
        "Device '%s' is not of type '%s'", name, cls.getName());
    return (T)device;
  }

  /**
   * The pseudoclock device triggered directly by the shot, or null if
   * there is none.
   */
  public PseudoclockDevice getMasterPseudoclockDevice() {
    return masterPseudoclockDevice;
  }

  /**
   * Get every pseudoclock in the shot, nested ones included.
   */
  public List<Pseudoclock> getPseudoclocks() {
    return Traversal.descendantDevices(this, true, Pseudoclock.class);
  }

  /**
   * Get every output in the shot, nested ones included.
   */
  public List<Output> getOutputs() {
    return Traversal.descendantDevices(this, true, Output.class);
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
   * Hand out the next instruction number.  Numbers follow creation order
   * across the whole shot.
   */
  public int nextInstructionNumber() {
    return totalInstructions++;
  }

  public int getTotalInstructions() {
    return totalInstructions;
  }

  /**
   * Get the waits of this shot, sorted by time once the shot has stopped.
   */
  public List<Wait> getWaits() {
    if (sortedWaits != null) {
      return sortedWaits;
    }
    List<Wait> waits = Lists.newArrayList();
    for (Instruction instruction : instructions.asList()) {
      if (instruction instanceof Wait) {
        waits.add((Wait)instruction);
      }
    }
    return waits;
  }

  //
  // Tree passes
  //

  public void establishCommonLimits() {
    enforce(Operation.ESTABLISH_COMMON_LIMITS);
    for (Device device : devices.asList()) {
      device.establishCommonLimits();
    }
  }

  public void establishInitialAttributes() {
    enforce(Operation.ESTABLISH_INITIAL_ATTRIBUTES);
    double delay = 0;
    for (Pseudoclock pseudoclock : getPseudoclocks()) {
      delay = Math.max(delay, pseudoclock.getMinimumWaitDuration());
    }
    nominalWaitDelay = delay;
    for (Device device : devices.asList()) {
      device.establishInitialAttributes();
    }
  }

  public double getT0() {
    return 0;
  }

  public double getAncestorLatency() {
    return 0;
  }

  public double getOutputDelay(Node child) {
    return 0;
  }

  /**
   * The wait delay that satisfies every pseudoclock in the shot.
   */
  public double getNominalWaitDelay() {
    Preconditions.checkState(nominalWaitDelay != null,
        "Nominal wait delay of shot '%s' is not known until the shot has started", name);
    return nominalWaitDelay;
  }

  /**
   * Time after a wait before every pseudoclock is responsive again.
   */
  public double getWaitDeadTime() {
    return getNominalWaitDelay() + options.getEpsilon();
  }

  public void checkInstructionsValid(ValidationReport report) {
    enforce(Operation.CHECK_INSTRUCTIONS_VALID);
    List<Wait> waits = getWaits();
    for (int i = 0; i < waits.size(); i++) {
      Wait wait = waits.get(i);
      if (wait.getRelativeT() < 0) {
        if (i == 0) {
          report.add(wait, "is before the start of the shot");
        } else {
          report.add(wait, "is %s s after wait '%s', inside its dead time of %s s",
              wait.getT() - waits.get(i - 1).getT(), waits.get(i - 1).getName(), getWaitDeadTime());
        }
      }
      if (wait.getT() > stopTime) {
        report.add(wait, "is after the end of the shot at t=%s", stopTime);
      }
    }
    for (Device device : devices.asList()) {
      device.checkInstructionsValid(report);
    }
  }

  //
  // Compilation
  //

  /**
   * Finish building the device tree: establish common limits and initial
   * attributes, after which instructions may be given.
   */
  public void start() {
    enforce(Operation.START);
    log.info("Starting shot '{}' with {} devices", name, devicesByName.size());
    phaseController.advance();
    establishCommonLimits();
    phaseController.advance();
    establishInitialAttributes();
    phaseController.advance();
  }

  /**
   * Insert a wait at the given time.
   */
  public Wait wait(double t, String name) {
    return new Wait(this, t, name);
  }

  /**
   * End the shot at the given time, and compile it: resolve every
   * instruction's timing, then validate the result.
   * @param t
   * @throws QuantisationException if a time cannot be put on its pseudoclock's tick grid
   * @throws ValidationException listing every problem the validator found
   */
  public void stop(double t) {
    enforce(Operation.STOP);
    stopTime = t;
    phaseController.advance();
    convertTiming();
    phaseController.advance();
    ValidationReport report = new ValidationReport();
    checkInstructionsValid(report);
    phaseController.finish();
    validationReport = report;
    if (!report.isEmpty()) {
      log.warn("Shot '{}' failed validation with {} problems", name, report.size());
      throw new ValidationException(report);
    }
    log.info("Compiled shot '{}': {} instructions on {} outputs",
        name, totalInstructions, getOutputs().size());
  }

  private void convertTiming() {
    sortedWaits = sortWaits(getWaits());
    List<QuantisationException> failures = Lists.newArrayList();
    for (Instruction instruction : Traversal.descendantInstructions(this, true)) {
      try {
        instruction.convertTiming(sortedWaits);
      } catch (QuantisationException ex) {
        if (!options.isBatchQuantisation()) {
          throw ex;
        }
        failures.add(ex);
      }
    }
    if (!failures.isEmpty()) {
      QuantisationException ex = new QuantisationException(String.format(
          "%d instructions could not be quantised; the first was: %s",
          failures.size(), failures.get(0).getMessage()));
      for (QuantisationException failure : failures) {
        ex.addSuppressed(failure);
      }
      throw ex;
    }
  }

  private static List<Wait> sortWaits(List<Wait> waits) {
    List<Wait> sorted = Lists.newArrayList(waits);
    Collections.sort(sorted, Instruction.NOMINAL_ORDER);
    for (int i = 1; i < sorted.size(); i++) {
      Wait previous = sorted.get(i - 1);
      Wait wait = sorted.get(i);
      if (wait.getT() == previous.getT()) {
        throw new StructuralException(String.format(
            "Waits '%s' and '%s' are both at t=%s%n  created at %s%n  created at %s",
            previous.getName(), wait.getName(), wait.getT(),
            previous.getCreationSite(), wait.getCreationSite()));
      }
    }
    return ImmutableList.copyOf(sorted);
  }

  public Double getStopTime() {
    return stopTime;
  }

  /**
   * Whether compilation finished and every instruction passed validation.
   */
  public boolean isCompiled() {
    return phaseController.isFinished() && validationReport != null && validationReport.isEmpty();
  }

  /**
   * The validator's findings, once validation has run.
   */
  public ValidationReport getValidationReport() {
    Preconditions.checkState(validationReport != null, "Shot '%s' has not been validated", name);
    return validationReport;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }
}
