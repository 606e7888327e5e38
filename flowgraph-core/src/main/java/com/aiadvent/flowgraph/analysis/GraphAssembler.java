package com.aiadvent.flowgraph.analysis;

import com.aiadvent.flowgraph.ast.SourceTree;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.extract.DetailLevel;
import com.aiadvent.flowgraph.extract.ExtractionContext;
import com.aiadvent.flowgraph.extract.FlowExtractor;
import com.aiadvent.flowgraph.extract.StructureBuilder;
import com.aiadvent.flowgraph.extract.StructureResult;
import com.aiadvent.flowgraph.graph.ExtractionResult;
import com.aiadvent.flowgraph.graph.FlowGraph;
import com.aiadvent.flowgraph.hierarchy.HierarchyPostProcessor;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the extraction stages over a parsed tree in order: structure, flow, hierarchy. The graph
 * they share is published as one node/edge collection.
 */
@Component
public class GraphAssembler {

  private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

  private final StructureBuilder structureBuilder;
  private final FlowExtractor flowExtractor;
  private final HierarchyPostProcessor hierarchyPostProcessor;
  private final FlowGraphProperties properties;

  public GraphAssembler(
      StructureBuilder structureBuilder,
      FlowExtractor flowExtractor,
      HierarchyPostProcessor hierarchyPostProcessor,
      FlowGraphProperties properties) {
    this.structureBuilder = structureBuilder;
    this.flowExtractor = flowExtractor;
    this.hierarchyPostProcessor = hierarchyPostProcessor;
    this.properties = properties;
  }

  public ExtractionResult assemble(
      SourceTree tree, String fileLabel, SyntaxTaxonomy taxonomy, DetailLevel detailLevel) {
    ExtractionContext context =
        ExtractionContext.start(
            fileLabel, taxonomy, detailLevel, properties.getExtraction().getMaxDepth());
    log.debug("Phase 1: building class/function structure for {}", context.fileId());
    StructureResult structure = structureBuilder.build(tree, context);
    log.debug("Phase 2: extracting control flow (grammar={})", taxonomy.grammar());
    flowExtractor.extract(tree, context);
    FlowGraph graph = context.graph();
    log.debug(
        "Post-processing: building hierarchy for {} nodes ({} definitions)",
        graph.nodeCount(),
        structure.skeleton().size());
    hierarchyPostProcessor.process(graph);
    return ExtractionResult.success(graph);
  }
}
