package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.graph.FlowNode;
import java.util.List;
import java.util.Map;

/**
 * Output of the structural walk.
 *
 * @param skeleton class and function nodes in creation order
 * @param methodOwners method name to the class that declares it
 */
public record StructureResult(List<FlowNode> skeleton, Map<String, String> methodOwners) {

  public StructureResult {
    skeleton = List.copyOf(skeleton);
    methodOwners = Map.copyOf(methodOwners);
  }
}
