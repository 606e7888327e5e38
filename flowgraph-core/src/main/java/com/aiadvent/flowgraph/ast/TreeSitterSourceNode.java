package com.aiadvent.flowgraph.ast;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.treesitter.TSNode;

/** {@link SourceNode} backed by a Tree-sitter node and the UTF-8 bytes it was parsed from. */
final class TreeSitterSourceNode implements SourceNode {

  private final TSNode node;
  private final byte[] source;

  TreeSitterSourceNode(TSNode node, byte[] source) {
    this.node = node;
    this.source = source;
  }

  @Override
  public String kind() {
    return node.getType();
  }

  @Override
  public int startLine() {
    return node.getStartPoint().getRow() + 1;
  }

  @Override
  public Optional<SourceNode> field(String name) {
    return wrap(node.getChildByFieldName(name));
  }

  @Override
  public List<SourceNode> children() {
    int count = node.getChildCount();
    List<SourceNode> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      wrap(node.getChild(i)).ifPresent(result::add);
    }
    return result;
  }

  @Override
  public List<SourceNode> namedChildren() {
    int count = node.getNamedChildCount();
    List<SourceNode> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      wrap(node.getNamedChild(i)).ifPresent(result::add);
    }
    return result;
  }

  @Override
  public Optional<SourceNode> parent() {
    return wrap(node.getParent());
  }

  @Override
  public String text() {
    int start = Math.max(0, Math.min(node.getStartByte(), source.length));
    int end = Math.max(start, Math.min(node.getEndByte(), source.length));
    return new String(source, start, end - start, StandardCharsets.UTF_8);
  }

  @Override
  public NodeKey key() {
    return new NodeKey(node.getType(), node.getStartByte(), node.getEndByte());
  }

  @Override
  public String toString() {
    return kind() + "@L" + startLine();
  }

  private Optional<SourceNode> wrap(TSNode candidate) {
    if (candidate == null || candidate.isNull()) {
      return Optional.empty();
    }
    return Optional.of(new TreeSitterSourceNode(candidate, source));
  }
}
