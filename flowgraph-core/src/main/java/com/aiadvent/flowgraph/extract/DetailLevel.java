package com.aiadvent.flowgraph.extract;

/** How much of the flow graph an extraction materializes. */
public enum DetailLevel {
  /** Structure, control flow and data nodes. */
  FULL,
  /** Structure and control flow; assignments are not materialized. */
  MEDIUM,
  /** Classes and functions only. */
  SUMMARY;

  public boolean includesFlow() {
    return this != SUMMARY;
  }

  public boolean includesData() {
    return this == FULL;
  }
}
