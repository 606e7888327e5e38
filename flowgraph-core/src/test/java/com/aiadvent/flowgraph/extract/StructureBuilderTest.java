package com.aiadvent.flowgraph.extract;

import static com.aiadvent.flowgraph.extract.FakeSourceNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.aiadvent.flowgraph.FlowGraphTestSupport;
import com.aiadvent.flowgraph.ast.SourceGrammar;
import com.aiadvent.flowgraph.ast.SourceTree;
import com.aiadvent.flowgraph.ast.SourceTreeParser;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.graph.EdgeCategory;
import com.aiadvent.flowgraph.graph.FlowEdge;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomyTable;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StructureBuilderTest {

  private SourceTreeParser parser;
  private SyntaxTaxonomyTable taxonomyTable;
  private StructureBuilder builder;
  private FlowExtractor flowExtractor;

  @BeforeEach
  void setUp() {
    FlowGraphTestSupport.Components components =
        FlowGraphTestSupport.components(new FlowGraphProperties());
    parser = components.parser();
    taxonomyTable = components.taxonomyTable();
    builder = components.structureBuilder();
    flowExtractor = components.flowExtractor();
  }

  @Test
  void qualifiesDirectMethodsOnly() {
    String source =
        """
        class Cart:
            def add(self, item):
                def validate(value):
                    return value
                return validate(item)

        def checkout(cart):
            pass
        """;
    ExtractionContext context = context("cart.py", "python");

    StructureResult result = builder.build(parse(source, SourceGrammar.PYTHON), context);

    assertThat(result.skeleton())
        .extracting(FlowNode::id, FlowNode::label, FlowNode::parentId, FlowNode::line)
        .containsExactly(
            tuple("Cart", "Cart", "file_cart.py", 1),
            tuple("Cart.add", "add", "Cart", 2),
            tuple("validate", "validate", "Cart.add", 3),
            tuple("checkout", "checkout", "file_cart.py", 7));
    assertThat(result.methodOwners()).containsExactly(Map.entry("add", "Cart"));
    assertThat(context.graph().edges())
        .extracting(FlowEdge::source, FlowEdge::target, FlowEdge::category)
        .containsExactly(
            tuple("file_cart.py", "Cart", EdgeCategory.CONTAINS),
            tuple("Cart", "Cart.add", EdgeCategory.CONTAINS),
            tuple("Cart.add", "validate", EdgeCategory.CONTAINS),
            tuple("file_cart.py", "checkout", EdgeCategory.CONTAINS));
  }

  @Test
  void namesAnonymousFunctionsAfterTheirBinding() {
    String source =
        """
        const onClick = function () {};
        exports.render = () => null;
        [1, 2].map((x) => x * 2);
        """;
    ExtractionContext context = context("app.js", "javascript");

    StructureResult result = builder.build(parse(source, SourceGrammar.JAVASCRIPT), context);

    assertThat(result.skeleton())
        .extracting(FlowNode::id)
        .containsExactly("onClick", "exports.render");
  }

  @Test
  void unnamedClassKeepsWalkingWithoutQualifyingMembers() {
    String source = "const Widget = class {\n  paint() {}\n};\n";
    ExtractionContext context = context("widget.js", "javascript");

    StructureResult result = builder.build(parse(source, SourceGrammar.JAVASCRIPT), context);

    assertThat(result.skeleton())
        .extracting(FlowNode::id, FlowNode::parentId)
        .containsExactly(tuple("paint", "file_widget.js"));
    assertThat(result.methodOwners()).isEmpty();
  }

  @Test
  void classWithoutBodyRegistersNoMethods() {
    FakeSourceNode module = node("module", 1, "");
    FakeSourceNode broken = node("class_definition", 1, "class Broken");
    broken.field("name", node("identifier", 1, "Broken"));
    FakeSourceNode helper = node("function_definition", 2, "def helper(): pass");
    helper.field("name", node("identifier", 2, "helper"));
    broken.child(helper);
    module.child(broken);
    ExtractionContext context = context("broken.py", "python");

    StructureResult result =
        builder.build(SourceTree.of(SourceGrammar.PYTHON, module), context);

    assertThat(result.skeleton())
        .extracting(FlowNode::id, FlowNode::parentId)
        .containsExactly(tuple("Broken", "file_broken.py"), tuple("helper", "Broken"));
    assertThat(result.methodOwners()).isEmpty();
  }

  @Test
  void duplicateDefinitionsKeepTheFirstNode() {
    String source = "def run():\n    pass\n\ndef run():\n    return 1\n";
    ExtractionContext context = context("dup.py", "python");

    StructureResult result = builder.build(parse(source, SourceGrammar.PYTHON), context);

    assertThat(result.skeleton()).extracting(FlowNode::line).containsExactly(1);
    assertThat(context.graph().edges()).hasSize(1);
  }

  @Test
  void everyParentedNodeHasOneContainsEdgeBeforeGrouping() {
    String source =
        """
        class Job:
            def execute(self, steps):
                for step in steps:
                    if step.enabled:
                        result = step.run()
                    else:
                        skip(step)
                return finish()
        """;
    ExtractionContext context = context("job.py", "python");
    SourceTree tree = parse(source, SourceGrammar.PYTHON);

    builder.build(tree, context);
    flowExtractor.extract(tree, context);

    for (FlowNode node : context.graph().nodes()) {
      if (node.parentId() == null) {
        continue;
      }
      assertThat(context.graph().edges())
          .filteredOn(edge -> edge.category() == EdgeCategory.CONTAINS)
          .filteredOn(edge -> edge.target().equals(node.id()))
          .extracting(FlowEdge::source)
          .containsExactly(node.parentId());
    }
  }

  private ExtractionContext context(String fileLabel, String grammar) {
    SyntaxTaxonomy taxonomy = taxonomyTable.taxonomy(grammar).orElseThrow();
    return ExtractionContext.start(fileLabel, taxonomy, DetailLevel.FULL, 2000);
  }

  private SourceTree parse(String source, SourceGrammar grammar) {
    return parser.parse(source, grammar);
  }
}
