package com.aiadvent.flowgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the flow graph. Identity fields are fixed at creation; {@code parentId} and
 * {@code children} are rewritten by hierarchy grouping.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"id", "type", "label", "parentId", "lineno", "file", "is_library", "children"})
public final class FlowNode {

  private final String id;
  private final NodeCategory category;
  private final String label;
  private final Integer line;
  private final String file;
  private final boolean library;
  private String parentId;
  private final List<String> children = new ArrayList<>();

  public FlowNode(
      String id,
      NodeCategory category,
      String label,
      String parentId,
      Integer line,
      String file,
      boolean library) {
    this.id = Objects.requireNonNull(id, "id");
    this.category = Objects.requireNonNull(category, "category");
    this.label = label != null ? label : id;
    this.parentId = parentId;
    this.line = line;
    this.file = file != null ? file : "";
    this.library = library;
  }

  @JsonProperty("id")
  public String id() {
    return id;
  }

  @JsonProperty("type")
  public NodeCategory category() {
    return category;
  }

  @JsonProperty("label")
  public String label() {
    return label;
  }

  @JsonProperty("parentId")
  public String parentId() {
    return parentId;
  }

  void reparent(String newParentId) {
    this.parentId = newParentId;
  }

  @JsonProperty("lineno")
  public Integer line() {
    return line;
  }

  @JsonProperty("file")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public String file() {
    return file;
  }

  @JsonProperty("is_library")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public boolean isLibrary() {
    return library;
  }

  @JsonProperty("children")
  public List<String> children() {
    return Collections.unmodifiableList(children);
  }

  boolean addChild(String childId) {
    if (children.contains(childId)) {
      return false;
    }
    children.add(childId);
    return true;
  }

  @Override
  public String toString() {
    return "FlowNode[" + category.id() + " " + id + " parent=" + parentId + "]";
  }
}
