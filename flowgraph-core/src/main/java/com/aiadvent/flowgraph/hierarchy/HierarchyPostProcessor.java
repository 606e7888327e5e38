package com.aiadvent.flowgraph.hierarchy;

import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.graph.NodeCategory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Buckets the flow children of files, classes and functions into synthetic logic and data groups
 * and fills in every node's {@code children} list.
 */
@Component
public class HierarchyPostProcessor {

  private static final Logger log = LoggerFactory.getLogger(HierarchyPostProcessor.class);

  private final boolean rewireContainsEdges;

  public HierarchyPostProcessor(FlowGraphProperties properties) {
    this.rewireContainsEdges = properties.getHierarchy().isRewireContainsEdges();
  }

  public void process(FlowGraph graph) {
    Objects.requireNonNull(graph, "graph");
    Map<String, Buckets> buckets = classify(graph);
    buckets.forEach((containerId, bucket) -> group(graph, containerId, bucket));
    linkChildren(graph);
    log.debug("Hierarchy built: {} containers grouped", buckets.size());
  }

  private Map<String, Buckets> classify(FlowGraph graph) {
    Map<String, Buckets> buckets = new LinkedHashMap<>();
    for (FlowNode node : graph.nodes()) {
      String parentId = node.parentId();
      boolean underContainer =
          graph.node(parentId).map(parent -> parent.category().isContainer()).orElse(false);
      if (!underContainer) {
        continue;
      }
      Buckets bucket = buckets.computeIfAbsent(parentId, key -> new Buckets());
      if (node.category().isLogic()) {
        bucket.logic.add(node.id());
      } else if (node.category() == NodeCategory.DATA) {
        bucket.data.add(node.id());
      }
    }
    return buckets;
  }

  private void group(FlowGraph graph, String containerId, Buckets bucket) {
    if (!bucket.logic.isEmpty()) {
      String groupId = containerId + "_logic_group";
      graph.addNode(
          groupId,
          NodeCategory.LOGIC_GROUP,
          "Logic (" + bucket.logic.size() + ")",
          containerId,
          null);
      bucket.logic.forEach(id -> graph.reparent(id, groupId, rewireContainsEdges));
    }
    if (!bucket.data.isEmpty()) {
      String groupId = containerId + "_data_group";
      graph.addNode(
          groupId, NodeCategory.DATA_GROUP, "Data (" + bucket.data.size() + ")", containerId, null);
      bucket.data.forEach(id -> graph.reparent(id, groupId, rewireContainsEdges));
    }
  }

  private void linkChildren(FlowGraph graph) {
    for (FlowNode node : graph.nodes()) {
      if (node.parentId() != null) {
        graph.linkChild(node.parentId(), node.id());
      }
    }
  }

  private static final class Buckets {
    private final List<String> logic = new ArrayList<>();
    private final List<String> data = new ArrayList<>();
  }
}
