package org.labrad.timing.validation;

import org.labrad.timing.CreationSite;
import org.labrad.timing.Node;

/**
 * One problem found by the validator.
 */
public class Violation {
  private final Node node;
  private final String message;

  public Violation(Node node, String message) {
    this.node = node;
    this.message = message;
  }

  /**
   * The instruction (or device) at fault.
   */
  public Node getNode() {
    return node;
  }

  public String getMessage() {
    return message;
  }

  public CreationSite getCreationSite() {
    return node.getCreationSite();
  }

  @Override
  public String toString() {
    return String.format("%s %s%n    created at %s", node, message, getCreationSite());
  }
}
