package org.labrad.timing.validation;

import java.util.List;

import org.labrad.timing.Node;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Every violation found while validating a shot.  Checks keep going after
 * a violation is found, so that one compilation reports all of them.
 */
public class ValidationReport {
  private final List<Violation> violations = Lists.newArrayList();

  /**
   * Record a violation.
   * @param node the offending node
   * @param format message, following the node's description
   * @param args
   */
  public void add(Node node, String format, Object... args) {
    violations.add(new Violation(node, String.format(format, args)));
  }

  public boolean isEmpty() {
    return violations.isEmpty();
  }

  public int size() {
    return violations.size();
  }

  public List<Violation> getViolations() {
    return ImmutableList.copyOf(violations);
  }

  /**
   * Get the violations found for one node.
   */
  public List<Violation> getViolations(Node node) {
    List<Violation> found = Lists.newArrayList();
    for (Violation v : violations) {
      if (v.getNode() == node) {
        found.add(v);
      }
    }
    return found;
  }

  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%d problem%s found in shot:", violations.size(),
        violations.size() == 1 ? "" : "s"));
    for (Violation v : violations) {
      sb.append(String.format("%n  ")).append(v);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return format();
  }
}
