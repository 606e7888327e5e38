package com.aiadvent.flowgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NodeCategory {
  FILE,
  CLASS,
  FUNCTION,
  LOGIC,
  LOOP,
  BRANCH,
  CALL_STEP,
  DATA,
  LOGIC_GROUP,
  DATA_GROUP;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Structural containers whose direct flow children are bucketed into groups. */
  public boolean isContainer() {
    return this == FILE || this == CLASS || this == FUNCTION;
  }

  public boolean isLogic() {
    return this == CALL_STEP || this == LOGIC || this == LOOP || this == BRANCH;
  }
}
