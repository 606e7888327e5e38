package com.aiadvent.flowgraph.ast;

import org.treesitter.TSTree;

/**
 * A parsed source file. Holds the native tree so it stays reachable while its nodes are walked.
 */
public final class SourceTree {

  private final SourceGrammar grammar;
  private final SourceNode root;
  private final boolean hasErrors;
  private final TSTree nativeTree;

  SourceTree(SourceGrammar grammar, SourceNode root, boolean hasErrors, TSTree nativeTree) {
    this.grammar = grammar;
    this.root = root;
    this.hasErrors = hasErrors;
    this.nativeTree = nativeTree;
  }

  public static SourceTree of(SourceGrammar grammar, SourceNode root) {
    return new SourceTree(grammar, root, false, null);
  }

  public SourceGrammar grammar() {
    return grammar;
  }

  public SourceNode root() {
    return root;
  }

  /** True when the parser recovered from syntax errors somewhere in the tree. */
  public boolean hasErrors() {
    return hasErrors;
  }
}
