package org.labrad.timing;

import java.util.Set;

import org.labrad.timing.enums.Operation;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Anything that lives in a shot's tree: the shot itself, its devices and
 * their instructions.
 */
public abstract class Node {

  /**
   * The tree passes that every device, and the shot itself, must go through.
   */
  protected static final Set<Operation> TREE_PASSES = Sets.immutableEnumSet(
      Operation.ESTABLISH_COMMON_LIMITS,
      Operation.ESTABLISH_INITIAL_ATTRIBUTES,
      Operation.CHECK_INSTRUCTIONS_VALID);

  private final CreationSite creationSite;

  protected Node() {
    this.creationSite = CreationSite.capture();
  }

  public abstract Shot getShot();

  /**
   * Where in user code this node was created.
   */
  public CreationSite getCreationSite() {
    return creationSite;
  }

  /**
   * Get the exactly-once operations that must have run on this node
   * by the end of their phase.
   */
  public Set<Operation> getRequiredOperations() {
    return ImmutableSet.of();
  }

  /**
   * Check that the given operation may run on this node now.
   */
  protected void enforce(Operation op) {
    getShot().getPhaseController().enforce(this, op);
  }
}
