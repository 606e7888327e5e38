package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.taxonomy.ConstructCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import java.util.Optional;

/**
 * Finds the flow-graph parent of a syntax node: the nearest enclosing function that made it into
 * the skeleton, otherwise the file root. Lookups are not cached.
 */
final class ScopeResolver {

  private ScopeResolver() {}

  static String resolve(SourceNode node, ExtractionContext context) {
    SyntaxTaxonomy taxonomy = context.taxonomy();
    Optional<SourceNode> current = Optional.of(node);
    while (current.isPresent()) {
      SourceNode candidate = current.get();
      if (taxonomy.is(candidate.kind(), ConstructCategory.FUNCTION)) {
        Optional<String> scope = functionScope(candidate, context);
        if (scope.isPresent()) {
          return scope.get();
        }
      }
      if (taxonomy.isBoundary(candidate.kind())) {
        return context.fileId();
      }
      current = candidate.parent();
    }
    return context.fileId();
  }

  private static Optional<String> functionScope(SourceNode function, ExtractionContext context) {
    SyntaxTaxonomy taxonomy = context.taxonomy();
    Optional<String> name = FunctionNames.functionName(function, taxonomy);
    if (name.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> owner = FunctionNames.owningClass(function, taxonomy);
    if (owner.isPresent()) {
      return asFunction(owner.get() + "." + name.get(), context);
    }
    return asFunction(name.get(), context).or(() -> registeredMethod(name.get(), context));
  }

  // Methods whose class exposes no body field are only known through the owner table.
  private static Optional<String> registeredMethod(String name, ExtractionContext context) {
    return Optional.ofNullable(context.methodOwners().get(name))
        .flatMap(owner -> asFunction(owner + "." + name, context));
  }

  private static Optional<String> asFunction(String id, ExtractionContext context) {
    return context
        .graph()
        .node(id)
        .map(FlowNode::category)
        .filter(NodeCategory.FUNCTION::equals)
        .map(category -> id);
  }
}
