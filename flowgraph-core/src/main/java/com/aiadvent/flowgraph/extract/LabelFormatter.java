package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Builds {@code L{line}: ...} labels for flow nodes. Embedded source text is cut to the configured
 * length first and has its newlines flattened afterwards.
 */
@Component
public class LabelFormatter {

  private final FlowGraphProperties.Labels limits;

  public LabelFormatter(FlowGraphProperties properties) {
    this.limits = properties.getLabels();
  }

  public String ifLabel(SourceNode node) {
    return prefix(node) + "if (" + condition(node) + ")";
  }

  public String elifLabel(SourceNode node) {
    return prefix(node) + "elif (" + condition(node) + ")";
  }

  public String elseLabel(SourceNode node) {
    return prefix(node) + "else";
  }

  public String whileLabel(SourceNode node) {
    return prefix(node) + "while (" + condition(node) + ")";
  }

  /** {@code for x in xs} style: iteration target, then the iterable or the loop condition. */
  public String forLabel(SourceNode node) {
    Optional<SourceNode> item = node.field("left");
    Optional<SourceNode> iterable = node.field("right");
    if (item.isEmpty()) {
      item = node.field("initializer").or(() -> node.field("init"));
      iterable = node.field("condition");
    }
    String itemText = snippet(item, limits.getLoopMaxLength(), "");
    String iterableText = snippet(iterable, limits.getLoopMaxLength(), "");
    StringBuilder label = new StringBuilder(prefix(node)).append("for ").append(itemText);
    if (!iterableText.isEmpty()) {
      label.append(" in ").append(iterableText);
    }
    return label.toString();
  }

  public String assignmentLabel(SourceNode node) {
    return prefix(node)
        + snippet(node.field("left"), limits.getTargetMaxLength(), "?")
        + " = "
        + snippet(node.field("right"), limits.getValueMaxLength(), "?");
  }

  public String callLabel(SourceNode node) {
    return prefix(node)
        + snippet(node.field("function"), limits.getCalleeMaxLength(), "?")
        + snippet(node.field("arguments"), limits.getArgumentsMaxLength(), "()");
  }

  static String truncate(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    String cut = text;
    if (maxLength >= 0 && text.codePointCount(0, text.length()) > maxLength) {
      cut = text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
    return cut.replace('\n', ' ');
  }

  private String condition(SourceNode node) {
    return snippet(node.field("condition"), limits.getConditionMaxLength(), "?");
  }

  private static String prefix(SourceNode node) {
    return "L" + node.startLine() + ": ";
  }

  private static String snippet(Optional<SourceNode> node, int maxLength, String fallback) {
    return node.map(value -> truncate(value.text(), maxLength)).orElse(fallback);
  }
}
