package com.aiadvent.flowgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable node/edge accumulator for a single extraction. Nodes keep insertion order and the first
 * node stored under an id wins. Not thread-safe; each extraction owns its own instance.
 */
public final class FlowGraph {

  private static final Logger log = LoggerFactory.getLogger(FlowGraph.class);

  private final String fileName;
  private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
  private final List<FlowEdge> edges = new ArrayList<>();
  private int sequence;

  public FlowGraph(String fileName) {
    this.fileName = fileName != null ? fileName : "";
  }

  /** Next id of the form {@code prefix_n}; shares its counter with edge ids. */
  public String nextId(String prefix) {
    sequence++;
    return prefix + "_" + sequence;
  }

  /**
   * Adds a node and, when it has a parent, the matching {@code contains} edge.
   *
   * @return false if a node with the same id already exists; nothing is added in that case
   */
  public boolean addNode(
      String id, NodeCategory category, String label, String parentId, Integer line) {
    Objects.requireNonNull(id, "id");
    if (nodes.containsKey(id)) {
      log.debug("Attempted to add duplicate node: {}", id);
      return false;
    }
    FlowNode node = new FlowNode(id, category, label, parentId, line, fileName, false);
    nodes.put(id, node);
    log.debug("Node added: [{}] {} (ID: {})", category.id(), label, id);
    if (parentId != null) {
      addEdge(parentId, id, EdgeCategory.CONTAINS, FlowEdge.CONTAINS);
    }
    return true;
  }

  public FlowEdge addEdge(String source, String target, EdgeCategory category, String label) {
    String id = "e_" + source + "_" + target + "_" + sequence;
    FlowEdge edge = new FlowEdge(id, source, target, category, label);
    sequence++;
    edges.add(edge);
    log.debug("Edge added: {} --({}:{})--> {}", source, category.id(), label, target);
    return edge;
  }

  public FlowEdge addFlowEdge(String source, String target, String label) {
    return addEdge(source, target, EdgeCategory.FLOW, label);
  }

  public boolean contains(String id) {
    return id != null && nodes.containsKey(id);
  }

  public Optional<FlowNode> node(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
  }

  public List<FlowNode> nodes() {
    return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
  }

  public List<FlowEdge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  /**
   * Moves a node under a new parent. With {@code retargetContainment} the existing
   * {@code contains} edge from the old parent is pointed at the new one, keeping its id;
   * otherwise edges are left untouched and only {@code parentId} reflects the new owner.
   */
  public void reparent(String nodeId, String newParentId, boolean retargetContainment) {
    FlowNode node = nodes.get(nodeId);
    if (node == null) {
      return;
    }
    String previous = node.parentId();
    node.reparent(newParentId);
    if (!retargetContainment || previous == null) {
      return;
    }
    for (int i = 0; i < edges.size(); i++) {
      FlowEdge edge = edges.get(i);
      if (edge.category() == EdgeCategory.CONTAINS
          && previous.equals(edge.source())
          && nodeId.equals(edge.target())) {
        edges.set(
            i,
            new FlowEdge(edge.id(), newParentId, nodeId, EdgeCategory.CONTAINS, edge.label()));
        return;
      }
    }
  }

  /** Records {@code childId} in the parent's children list; duplicates are skipped. */
  public boolean linkChild(String parentId, String childId) {
    FlowNode parent = nodes.get(parentId);
    if (parent == null) {
      return false;
    }
    boolean added = parent.addChild(childId);
    if (!added) {
      log.debug("Skipping duplicate child {} for parent {}", childId, parentId);
    }
    return added;
  }
}
