package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.NodeKey;
import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-invocation state shared by the extraction stages: the graph being built, the id sequence
 * it owns and the bookkeeping that links syntax nodes to flow nodes. A context is created for one
 * source file and discarded afterwards; it is never shared between concurrent extractions.
 */
public final class ExtractionContext {

  private static final String DEFAULT_FILE_LABEL = "Code";

  private final FlowGraph graph;
  private final String fileId;
  private final SyntaxTaxonomy taxonomy;
  private final DetailLevel detailLevel;
  private final int maxDepth;
  private final Map<NodeKey, String> created = new HashMap<>();
  private final Set<NodeKey> processed = new HashSet<>();
  private Map<String, String> methodOwners = Map.of();
  private boolean depthCapReached;

  private ExtractionContext(
      FlowGraph graph,
      String fileId,
      SyntaxTaxonomy taxonomy,
      DetailLevel detailLevel,
      int maxDepth) {
    this.graph = graph;
    this.fileId = fileId;
    this.taxonomy = taxonomy;
    this.detailLevel = detailLevel;
    this.maxDepth = maxDepth;
  }

  /**
   * Opens a context and adds the file root node. The root id is {@code file_<name>} where the name
   * is the last path segment of {@code fileLabel}, or {@code Code} when no label is given.
   */
  public static ExtractionContext start(
      String fileLabel, SyntaxTaxonomy taxonomy, DetailLevel detailLevel, int maxDepth) {
    Objects.requireNonNull(taxonomy, "taxonomy");
    String name = rootLabel(fileLabel);
    FlowGraph graph = new FlowGraph(fileLabel);
    String fileId = "file_" + name;
    graph.addNode(fileId, NodeCategory.FILE, name, null, null);
    return new ExtractionContext(
        graph,
        fileId,
        taxonomy,
        detailLevel != null ? detailLevel : DetailLevel.FULL,
        Math.max(1, maxDepth));
  }

  static String rootLabel(String fileLabel) {
    if (fileLabel == null || fileLabel.isBlank()) {
      return DEFAULT_FILE_LABEL;
    }
    String name = fileLabel.substring(fileLabel.lastIndexOf('/') + 1);
    return name.isEmpty() ? DEFAULT_FILE_LABEL : name;
  }

  public FlowGraph graph() {
    return graph;
  }

  public String fileId() {
    return fileId;
  }

  public SyntaxTaxonomy taxonomy() {
    return taxonomy;
  }

  public DetailLevel detailLevel() {
    return detailLevel;
  }

  public int maxDepth() {
    return maxDepth;
  }

  public Map<String, String> methodOwners() {
    return methodOwners;
  }

  void methodOwners(Map<String, String> owners) {
    this.methodOwners = Map.copyOf(owners);
  }

  void recordCreated(SourceNode node, String flowNodeId) {
    created.put(node.key(), flowNodeId);
  }

  Optional<String> createdId(SourceNode node) {
    return Optional.ofNullable(created.get(node.key()));
  }

  /** Marks the node as visited; returns false if it already was. */
  boolean markProcessed(SourceNode node) {
    return processed.add(node.key());
  }

  boolean isProcessed(SourceNode node) {
    return processed.contains(node.key());
  }

  /** Returns true only the first time the depth cap is hit in this context. */
  boolean reportDepthCap() {
    if (depthCapReached) {
      return false;
    }
    depthCapReached = true;
    return true;
  }
}
