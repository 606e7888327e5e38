package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.ast.SourceTree;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.taxonomy.ConstructCategory;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Materializes control-flow and data nodes for every recognized construct, then hands the tree
 * to {@link FlowEdgeWirer} to connect them. Stateless: all per-file state lives in the
 * {@link ExtractionContext}.
 */
@Component
public class FlowExtractor {

  private static final Logger log = LoggerFactory.getLogger(FlowExtractor.class);

  private final LabelFormatter labels;
  private final FlowEdgeWirer wirer;

  public FlowExtractor(LabelFormatter labels, FlowEdgeWirer wirer) {
    this.labels = labels;
    this.wirer = wirer;
  }

  public void extract(SourceTree tree, ExtractionContext context) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(context, "context");
    if (!context.detailLevel().includesFlow()) {
      log.debug("Flow extraction skipped for detail level {}", context.detailLevel());
      return;
    }
    FlowGraph graph = context.graph();
    int nodesBefore = graph.nodeCount();
    materialize(tree.root(), context, 0);
    int edgesBefore = graph.edgeCount();
    wirer.wire(tree.root(), context);
    log.debug(
        "Flow extracted (grammar={}): {} nodes, {} flow edges",
        context.taxonomy().grammar(),
        graph.nodeCount() - nodesBefore,
        graph.edgeCount() - edgesBefore);
  }

  void materialize(SourceNode node, ExtractionContext context, int depth) {
    if (context.isProcessed(node)) {
      return;
    }
    if (depth > context.maxDepth()) {
      if (context.reportDepthCap()) {
        log.warn(
            "Nesting exceeds {} levels at line {}; deeper constructs are skipped",
            context.maxDepth(),
            node.startLine());
      }
      return;
    }
    Optional<ConstructCategory> category = context.taxonomy().categoryFor(node.kind());
    if (category.isPresent()) {
      switch (category.get()) {
        case IF -> create(node, "if", NodeCategory.LOGIC, labels.ifLabel(node), context);
        case ELIF -> create(node, "elif", NodeCategory.BRANCH, labels.elifLabel(node), context);
        case ELSE -> create(node, "else", NodeCategory.BRANCH, labels.elseLabel(node), context);
        case FOR -> create(node, "for", NodeCategory.LOGIC, labels.forLabel(node), context);
        case WHILE -> create(node, "while", NodeCategory.LOGIC, labels.whileLabel(node), context);
        case ASSIGNMENT -> {
          if (context.detailLevel().includesData()) {
            create(node, "assign", NodeCategory.DATA, labels.assignmentLabel(node), context);
          } else {
            context.markProcessed(node);
          }
          return;
        }
        case CALL -> {
          create(node, "call", NodeCategory.CALL_STEP, labels.callLabel(node), context);
          return;
        }
        default -> {
          // classes and functions belong to the structural skeleton
        }
      }
    }
    for (SourceNode child : node.children()) {
      materialize(child, context, depth + 1);
    }
  }

  private void create(
      SourceNode node,
      String prefix,
      NodeCategory category,
      String label,
      ExtractionContext context) {
    context.markProcessed(node);
    String scope = ScopeResolver.resolve(node, context);
    String id = context.graph().nextId(prefix);
    if (!context.graph().addNode(id, category, label, scope, node.startLine())) {
      log.warn("Flow node {} collides with an existing node id; {} left unwired", id, label);
      return;
    }
    context.recordCreated(node, id);
  }
}
