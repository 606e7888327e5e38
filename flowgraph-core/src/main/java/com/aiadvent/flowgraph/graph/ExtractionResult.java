package com.aiadvent.flowgraph.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction: either the assembled graph or a typed error. A failed result never
 * carries a partial graph.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionResult(
    List<FlowNode> nodes,
    List<FlowEdge> edges,
    String error,
    @JsonIgnore ErrorKind errorKind) {

  public enum ErrorKind {
    GRAMMAR_UNAVAILABLE,
    PARSE_FAILURE
  }

  public static ExtractionResult success(FlowGraph graph) {
    Objects.requireNonNull(graph, "graph");
    return new ExtractionResult(List.copyOf(graph.nodes()), List.copyOf(graph.edges()), null, null);
  }

  public static ExtractionResult failure(ErrorKind kind, String message) {
    Objects.requireNonNull(kind, "kind");
    return new ExtractionResult(null, null, message != null ? message : kind.name(), kind);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return error == null;
  }
}
