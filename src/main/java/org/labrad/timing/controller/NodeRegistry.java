package org.labrad.timing.controller;

import java.util.List;
import java.util.Map;

import org.labrad.timing.Node;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Every node attached to one shot, indexed in the order they were attached.
 * A node is only registered once it is part of the tree, so the registry
 * is exactly the set of nodes reachable from the shot.
 */
public class NodeRegistry {
  private final List<Node> nodes = Lists.newArrayList();
  private final Map<Node, Integer> indices = Maps.newIdentityHashMap();

  /**
   * Register a node and return its index.
   */
  public int register(Node node) {
    Preconditions.checkArgument(!indices.containsKey(node),
        "%s is already registered", node);
    int index = nodes.size();
    nodes.add(node);
    indices.put(node, index);
    return index;
  }

  public boolean isRegistered(Node node) {
    return indices.containsKey(node);
  }

  public int indexOf(Node node) {
    Integer index = indices.get(node);
    Preconditions.checkArgument(index != null, "%s is not part of this shot", node);
    return index;
  }

  public Node get(int index) {
    return nodes.get(index);
  }

  public List<Node> getNodes() {
    return ImmutableList.copyOf(nodes);
  }

  public int size() {
    return nodes.size();
  }
}
