package org.labrad.timing.controller;

import org.labrad.timing.Node;
import org.labrad.timing.enums.Operation;
import org.labrad.timing.enums.Phase;
import org.labrad.timing.errors.AlreadyCalledException;
import org.labrad.timing.errors.NotCalledException;
import org.labrad.timing.errors.WrongPhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Keeps track of which compilation phase a shot is in, and of which
 * exactly-once operations have run on which nodes.
 *
 * Every gated operation checks in here before doing anything.  Leaving a
 * phase is only allowed once every registered node has had every
 * exactly-once operation of that phase run on it, which is how overridden
 * phase hooks in device subclasses are kept honest.  A failed check leaves
 * the phase where it was.
 *
 * One controller belongs to one shot; nothing here is shared between shots.
 */
public class PhaseController {
  private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

  private final String shotName;
  private final NodeRegistry registry;
  private final SetMultimap<Integer, Operation> called = HashMultimap.create();
  private Phase phase = Phase.ADD_DEVICES;
  private boolean finished = false;

  public PhaseController(String shotName, NodeRegistry registry) {
    this.shotName = shotName;
    this.registry = registry;
  }

  public Phase getPhase() {
    return phase;
  }

  /**
   * Whether the last phase has been completed.
   */
  public boolean isFinished() {
    return finished;
  }

  /**
   * Check that an operation may run on a node now, and record it if it is
   * an exactly-once operation.
   */
  public void enforce(Node node, Operation op) {
    if (finished || op.getPhase() != phase) {
      throw new WrongPhaseException(String.format("%s.%s cannot be called in phase %s%s",
          node.getClass().getSimpleName(), op.getMethodName(), phase,
          finished ? " after compilation has finished" : ""));
    }
    if (op.isExactlyOnce()) {
      int index = registry.indexOf(node);
      if (!called.put(index, op)) {
        throw new AlreadyCalledException(String.format(
            "%s has already had %s called once in phase %s", node, op.getMethodName(), phase));
      }
    }
  }

  /**
   * Check whether an exactly-once operation has already run on a node.
   */
  public boolean hasBeenCalled(Node node, Operation op) {
    return registry.isRegistered(node) && called.containsEntry(registry.indexOf(node), op);
  }

  /**
   * Move on to the next phase, once the current one is complete.
   */
  public void advance() {
    Preconditions.checkState(!phase.isLast(), "Shot '%s' is already in its last phase", shotName);
    checkRequiredOperationsCalled(phase);
    Phase next = phase.next();
    log.debug("Shot '{}': {} -> {}", shotName, phase, next);
    phase = next;
  }

  /**
   * Complete the last phase.
   */
  public void finish() {
    Preconditions.checkState(phase.isLast(), "Shot '%s' cannot finish in phase %s", shotName, phase);
    Preconditions.checkState(!finished, "Shot '%s' has already finished", shotName);
    checkRequiredOperationsCalled(phase);
    log.debug("Shot '{}': finished {}", shotName, phase);
    finished = true;
  }

  private void checkRequiredOperationsCalled(Phase phase) {
    for (int i = 0; i < registry.size(); i++) {
      Node node = registry.get(i);
      for (Operation op : node.getRequiredOperations()) {
        if (op.getPhase() == phase && op.isExactlyOnce() && !called.containsEntry(i, op)) {
          // just report the first one we find
          throw new NotCalledException(String.format(
              "%s has not had %s called by the end of phase %s%n  created at %s",
              node, op.getMethodName(), phase, node.getCreationSite()));
        }
      }
    }
  }
}
