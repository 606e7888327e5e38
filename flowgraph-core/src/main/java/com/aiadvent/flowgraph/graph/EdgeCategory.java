package com.aiadvent.flowgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EdgeCategory {
  CONTAINS,
  FLOW;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
