package com.aiadvent.flowgraph.ast;

/** The parser could not produce a tree for the given source. */
public class SourceParseException extends RuntimeException {

  public SourceParseException(String message) {
    super(message);
  }

  public SourceParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
