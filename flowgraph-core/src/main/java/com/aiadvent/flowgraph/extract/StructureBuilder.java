package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.ast.SourceTree;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.taxonomy.ConstructCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the class/function skeleton that flow nodes are later attached to. Classes are keyed by
 * name, methods declared directly in a class body by {@code Class.method}, every other function by
 * its bare name.
 */
@Component
public class StructureBuilder {

  private static final Logger log = LoggerFactory.getLogger(StructureBuilder.class);

  public StructureResult build(SourceTree tree, ExtractionContext context) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(context, "context");
    Walk walk = new Walk(context);
    walk.visit(tree.root(), context.fileId(), 0);
    context.methodOwners(walk.methodOwners);
    log.debug(
        "Structure built: {} definitions, {} registered methods",
        walk.created.size(),
        walk.methodOwners.size());
    return new StructureResult(walk.created, walk.methodOwners);
  }

  private static final class Walk {
    private final ExtractionContext context;
    private final SyntaxTaxonomy taxonomy;
    private final FlowGraph graph;
    private final List<FlowNode> created = new ArrayList<>();
    private final Map<String, String> methodOwners = new LinkedHashMap<>();

    private Walk(ExtractionContext context) {
      this.context = context;
      this.taxonomy = context.taxonomy();
      this.graph = context.graph();
    }

    private void visit(SourceNode node, String scopeId, int depth) {
      if (depth > context.maxDepth()) {
        if (context.reportDepthCap()) {
          log.warn(
              "Nesting exceeds {} levels at line {}; deeper constructs are skipped",
              context.maxDepth(),
              node.startLine());
        }
        return;
      }
      String childScope = scopeId;
      Optional<ConstructCategory> category = taxonomy.categoryFor(node.kind());
      if (category.isPresent() && category.get() == ConstructCategory.CLASS) {
        childScope = visitClass(node, scopeId).orElse(scopeId);
      } else if (category.isPresent() && category.get() == ConstructCategory.FUNCTION) {
        childScope = visitFunction(node, scopeId).orElse(scopeId);
      }
      for (SourceNode child : node.children()) {
        visit(child, childScope, depth + 1);
      }
    }

    private Optional<String> visitClass(SourceNode node, String scopeId) {
      Optional<String> name = FunctionNames.className(node);
      if (name.isEmpty()) {
        log.debug("Skipping unnamed class at line {}", node.startLine());
        return Optional.empty();
      }
      String className = name.get();
      log.info("Found class '{}' at line {}", className, node.startLine());
      add(className, NodeCategory.CLASS, className, scopeId, node.startLine());
      node.field("body").ifPresent(body -> registerMethods(body, className));
      return name;
    }

    private void registerMethods(SourceNode body, String className) {
      for (SourceNode member : body.children()) {
        FunctionNames.decoratedFunction(member, taxonomy)
            .flatMap(function -> function.field("name"))
            .map(SourceNode::text)
            .filter(methodName -> !methodName.isBlank())
            .ifPresent(methodName -> methodOwners.put(methodName, className));
      }
    }

    private Optional<String> visitFunction(SourceNode node, String scopeId) {
      Optional<String> name = FunctionNames.functionName(node, taxonomy);
      if (name.isEmpty()) {
        log.debug("Skipping anonymous {} at line {}", node.kind(), node.startLine());
        return Optional.empty();
      }
      String functionName = name.get();
      String id =
          FunctionNames.owningClass(node, taxonomy)
              .map(owner -> owner + "." + functionName)
              .orElse(functionName);
      log.debug("Found function '{}' at line {}", id, node.startLine());
      add(id, NodeCategory.FUNCTION, functionName, scopeId, node.startLine());
      return Optional.of(id);
    }

    private void add(String id, NodeCategory category, String label, String parentId, int line) {
      if (graph.addNode(id, category, label, parentId, line)) {
        graph.node(id).ifPresent(created::add);
      }
    }
  }
}
