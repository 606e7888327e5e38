package com.aiadvent.flowgraph.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FlowEdge(
    String id,
    String source,
    String target,
    @JsonProperty("type") EdgeCategory category,
    String label) {

  public static final String CONTAINS = "contains";
  public static final String TRUE = "true";
  public static final String FALSE = "false";
  public static final String NEXT = "next";
  public static final String MERGE = "merge";
  public static final String ITERATE = "iterate";
  public static final String BODY = "body";

  @JsonIgnore
  public boolean isFlow() {
    return category == EdgeCategory.FLOW;
  }
}
