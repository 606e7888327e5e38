package com.aiadvent.flowgraph.taxonomy;

/** Abstract construct categories shared by every grammar. */
public enum ConstructCategory {
  CLASS,
  FUNCTION,
  IF,
  ELIF,
  ELSE,
  FOR,
  WHILE,
  CALL,
  ASSIGNMENT;

  public boolean isLoop() {
    return this == FOR || this == WHILE;
  }

  public boolean isBranch() {
    return this == ELIF || this == ELSE;
  }
}
