package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.graph.FlowEdge;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.taxonomy.ConstructCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Second extraction pass: connects the flow nodes created by {@link FlowExtractor} with labeled
 * flow edges. Every wiring step returns the exit set of the subtree it handled, i.e. the flow
 * nodes control may continue from; the enclosing container links that set to the next sibling.
 */
@Component
public class FlowEdgeWirer {

  /** Wires the whole tree and returns the exit set of its root. */
  public Set<String> wire(SourceNode root, ExtractionContext context) {
    return wire(root, context, 0);
  }

  private Set<String> wire(SourceNode node, ExtractionContext context, int depth) {
    if (depth > context.maxDepth()) {
      return Collections.emptySet();
    }
    Optional<String> ownId = context.createdId(node);
    Optional<ConstructCategory> category = context.taxonomy().categoryFor(node.kind());
    if (ownId.isEmpty() || category.isEmpty()) {
      return wireContainer(node, context, depth);
    }
    String id = ownId.get();
    ConstructCategory construct = category.get();
    if (construct == ConstructCategory.IF) {
      return wireIf(node, id, context, depth);
    }
    if (construct.isLoop()) {
      return wireLoop(node, id, context, depth);
    }
    if (construct.isBranch()) {
      return wireStandaloneBranch(node, id, context, depth);
    }
    return singleton(id);
  }

  private Set<String> wireContainer(SourceNode node, ExtractionContext context, int depth) {
    FlowGraph graph = context.graph();
    Set<String> pending = new LinkedHashSet<>();
    for (SourceNode child : node.children()) {
      Optional<String> entry = entryOf(child, context);
      if (entry.isPresent() && !pending.isEmpty()) {
        String label = pending.size() > 1 ? FlowEdge.MERGE : FlowEdge.NEXT;
        for (String exit : pending) {
          graph.addFlowEdge(exit, entry.get(), label);
        }
        pending = new LinkedHashSet<>();
      }
      Set<String> exits = wire(child, context, depth + 1);
      if (!exits.isEmpty()) {
        pending = new LinkedHashSet<>(exits);
      }
    }
    return pending;
  }

  private Set<String> wireIf(SourceNode node, String ifId, ExtractionContext context, int depth) {
    FlowGraph graph = context.graph();
    SyntaxTaxonomy taxonomy = context.taxonomy();
    Set<String> exits = new LinkedHashSet<>();

    Optional<SourceNode> consequence = node.field("consequence");
    if (consequence.isPresent()) {
      entryOf(consequence.get(), context)
          .ifPresent(entry -> graph.addFlowEdge(ifId, entry, FlowEdge.TRUE));
      exits.addAll(wire(consequence.get(), context, depth + 1));
    }

    String previousBranch = ifId;
    for (SourceNode child : node.children()) {
      Optional<String> branchId = context.createdId(child);
      if (branchId.isEmpty()) {
        continue;
      }
      if (taxonomy.is(child.kind(), ConstructCategory.ELIF)) {
        graph.addFlowEdge(previousBranch, branchId.get(), FlowEdge.FALSE);
        exits.addAll(wireBranchBody(child, branchId.get(), FlowEdge.TRUE, context, depth + 1));
        previousBranch = branchId.get();
      } else if (taxonomy.is(child.kind(), ConstructCategory.ELSE)) {
        graph.addFlowEdge(previousBranch, branchId.get(), FlowEdge.FALSE);
        exits.addAll(wireBranchBody(child, branchId.get(), FlowEdge.BODY, context, depth + 1));
        previousBranch = branchId.get();
      }
    }
    return exits.isEmpty() ? singleton(ifId) : exits;
  }

  // The loop header stands in for the continuation point; body exits do not leave the loop.
  private Set<String> wireLoop(
      SourceNode node, String loopId, ExtractionContext context, int depth) {
    FlowGraph graph = context.graph();
    Optional<SourceNode> body = node.field("body");
    if (body.isPresent()) {
      entryOf(body.get(), context)
          .ifPresent(entry -> graph.addFlowEdge(loopId, entry, FlowEdge.ITERATE));
      wire(body.get(), context, depth + 1);
    }
    Optional<SourceNode> alternative = node.field("alternative");
    if (alternative.isPresent()) {
      Optional<String> alternativeId = context.createdId(alternative.get());
      if (alternativeId.isPresent()) {
        graph.addFlowEdge(loopId, alternativeId.get(), FlowEdge.FALSE);
        wire(alternative.get(), context, depth + 1);
      }
    }
    return singleton(loopId);
  }

  /** An else/elif that is not part of an if chain, e.g. the else of a try statement. */
  private Set<String> wireStandaloneBranch(
      SourceNode node, String branchId, ExtractionContext context, int depth) {
    Set<String> exits = wireBranchBody(node, branchId, FlowEdge.BODY, context, depth + 1);
    return exits.isEmpty() ? singleton(branchId) : exits;
  }

  private Set<String> wireBranchBody(
      SourceNode branch, String branchId, String label, ExtractionContext context, int depth) {
    Optional<SourceNode> body = branchBody(branch, context.taxonomy());
    if (body.isEmpty()) {
      return Collections.emptySet();
    }
    entryOf(body.get(), context)
        .ifPresent(entry -> context.graph().addFlowEdge(branchId, entry, label));
    return wire(body.get(), context, depth);
  }

  private static Optional<SourceNode> branchBody(SourceNode branch, SyntaxTaxonomy taxonomy) {
    if (taxonomy.is(branch.kind(), ConstructCategory.ELIF)) {
      return branch.field("consequence");
    }
    Optional<SourceNode> body = branch.field("body");
    if (body.isPresent()) {
      return body;
    }
    List<SourceNode> named = branch.namedChildren();
    return named.isEmpty() ? Optional.empty() : Optional.of(named.get(0));
  }

  /**
   * The first flow node control enters when executing {@code node}: the node itself, or the first
   * materialized child reached by descending only through pass-through wrappers.
   */
  static Optional<String> entryOf(SourceNode node, ExtractionContext context) {
    Optional<String> own = context.createdId(node);
    if (own.isPresent()) {
      return own;
    }
    for (SourceNode child : node.children()) {
      Optional<String> childId = context.createdId(child);
      if (childId.isPresent()) {
        return childId;
      }
      if (context.taxonomy().isWrapper(child.kind())) {
        Optional<String> nested = entryOf(child, context);
        if (nested.isPresent()) {
          return nested;
        }
      }
    }
    return Optional.empty();
  }

  private static Set<String> singleton(String id) {
    Set<String> exits = new LinkedHashSet<>();
    exits.add(id);
    return exits;
  }
}
