package com.aiadvent.flowgraph.ast;

import java.util.List;
import java.util.Optional;

/**
 * Read-only handle on a node of a concrete syntax tree. Implementations never expose a way to
 * mutate the underlying tree.
 */
public interface SourceNode {

  /** Grammar-specific node type, e.g. {@code if_statement}. */
  String kind();

  /** 1-based line on which the node starts. */
  int startLine();

  Optional<SourceNode> field(String name);

  List<SourceNode> children();

  List<SourceNode> namedChildren();

  Optional<SourceNode> parent();

  String text();

  /** Identity of this node within its tree, stable across repeated lookups. */
  NodeKey key();
}
