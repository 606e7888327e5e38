package com.aiadvent.flowgraph;

import com.aiadvent.flowgraph.analysis.FlowGraphService;
import com.aiadvent.flowgraph.analysis.GraphAssembler;
import com.aiadvent.flowgraph.ast.GrammarRegistry;
import com.aiadvent.flowgraph.ast.GrammarResolver;
import com.aiadvent.flowgraph.ast.SourceTreeParser;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.extract.FlowEdgeWirer;
import com.aiadvent.flowgraph.extract.FlowExtractor;
import com.aiadvent.flowgraph.extract.LabelFormatter;
import com.aiadvent.flowgraph.extract.StructureBuilder;
import com.aiadvent.flowgraph.graph.EdgeCategory;
import com.aiadvent.flowgraph.graph.ExtractionResult;
import com.aiadvent.flowgraph.graph.FlowEdge;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.hierarchy.HierarchyPostProcessor;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomyTable;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.stream.Collectors;

/** Wires the extraction pipeline by hand for unit tests, without a Spring context. */
public final class FlowGraphTestSupport {

  private FlowGraphTestSupport() {}

  public static Components components(FlowGraphProperties properties) {
    return components(properties, null);
  }

  public static Components components(FlowGraphProperties properties, MeterRegistry registry) {
    GrammarRegistry grammarRegistry = new GrammarRegistry(properties);
    GrammarResolver grammarResolver = new GrammarResolver(properties);
    SourceTreeParser parser = new SourceTreeParser(grammarRegistry);
    SyntaxTaxonomyTable taxonomyTable = new SyntaxTaxonomyTable();
    StructureBuilder structureBuilder = new StructureBuilder();
    FlowExtractor flowExtractor =
        new FlowExtractor(new LabelFormatter(properties), new FlowEdgeWirer());
    HierarchyPostProcessor hierarchy = new HierarchyPostProcessor(properties);
    GraphAssembler assembler =
        new GraphAssembler(structureBuilder, flowExtractor, hierarchy, properties);
    FlowGraphService service =
        new FlowGraphService(
            grammarRegistry,
            grammarResolver,
            parser,
            taxonomyTable,
            assembler,
            properties,
            registry);
    return new Components(
        grammarRegistry,
        parser,
        taxonomyTable,
        structureBuilder,
        flowExtractor,
        hierarchy,
        service);
  }

  public static FlowNode nodeByLabel(ExtractionResult result, String label) {
    return result.nodes().stream()
        .filter(node -> node.label().equals(label))
        .findFirst()
        .orElseThrow(
            () -> new AssertionError("No node labeled '" + label + "' in " + labels(result)));
  }

  public static List<FlowNode> nodesOf(ExtractionResult result, NodeCategory category) {
    return result.nodes().stream()
        .filter(node -> node.category() == category)
        .collect(Collectors.toList());
  }

  public static List<FlowEdge> flowEdges(ExtractionResult result) {
    return result.edges().stream()
        .filter(edge -> edge.category() == EdgeCategory.FLOW)
        .collect(Collectors.toList());
  }

  public static List<FlowEdge> flowEdgesInto(ExtractionResult result, String targetId) {
    return flowEdges(result).stream()
        .filter(edge -> edge.target().equals(targetId))
        .collect(Collectors.toList());
  }

  public static List<FlowEdge> flowEdgesFrom(ExtractionResult result, String sourceId) {
    return flowEdges(result).stream()
        .filter(edge -> edge.source().equals(sourceId))
        .collect(Collectors.toList());
  }

  public static List<String> labels(ExtractionResult result) {
    return result.nodes().stream().map(FlowNode::label).collect(Collectors.toList());
  }

  public record Components(
      GrammarRegistry grammarRegistry,
      SourceTreeParser parser,
      SyntaxTaxonomyTable taxonomyTable,
      StructureBuilder structureBuilder,
      FlowExtractor flowExtractor,
      HierarchyPostProcessor hierarchyPostProcessor,
      FlowGraphService service) {}
}
