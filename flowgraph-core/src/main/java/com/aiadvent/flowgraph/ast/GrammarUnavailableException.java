package com.aiadvent.flowgraph.ast;

/** Raised when a grammar key has no parser or taxonomy entry, or is disabled by configuration. */
public class GrammarUnavailableException extends RuntimeException {

  private final String grammarKey;

  public GrammarUnavailableException(String grammarKey, String message) {
    super(message);
    this.grammarKey = grammarKey;
  }

  public GrammarUnavailableException(String grammarKey, String message, Throwable cause) {
    super(message, cause);
    this.grammarKey = grammarKey;
  }

  public String getGrammarKey() {
    return grammarKey;
  }
}
