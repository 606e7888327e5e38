package com.aiadvent.flowgraph.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.aiadvent.flowgraph.FlowGraphTestSupport;
import com.aiadvent.flowgraph.ast.GrammarRegistry;
import com.aiadvent.flowgraph.ast.GrammarResolver;
import com.aiadvent.flowgraph.ast.SourceGrammar;
import com.aiadvent.flowgraph.ast.SourceParseException;
import com.aiadvent.flowgraph.ast.SourceTreeParser;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.extract.DetailLevel;
import com.aiadvent.flowgraph.graph.ExtractionResult;
import com.aiadvent.flowgraph.graph.ExtractionResult.ErrorKind;
import com.aiadvent.flowgraph.graph.FlowNode;
import com.aiadvent.flowgraph.graph.NodeCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomyTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowGraphServiceTest {

  @TempDir Path tempDir;

  private FlowGraphProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private FlowGraphService service;

  @BeforeEach
  void setUp() {
    properties = new FlowGraphProperties();
    meterRegistry = new SimpleMeterRegistry();
    service = FlowGraphTestSupport.components(properties, meterRegistry).service();
  }

  @Test
  void unknownGrammarYieldsErrorWithoutGraph() {
    ExtractionResult result = service.analyze("IDENTIFICATION DIVISION.", "legacy.cbl", "cobol");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ErrorKind.GRAMMAR_UNAVAILABLE);
    assertThat(result.error()).isEqualTo("Unsupported language: cobol");
    assertThat(result.nodes()).isNull();
    assertThat(result.edges()).isNull();
    assertThat(meterRegistry.counter("flowgraph_extraction_failures_total").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("flowgraph_extractions_total").count()).isZero();
  }

  @Test
  void disabledGrammarIsUnavailable() {
    properties.setLanguages(List.of("python"));

    ExtractionResult result = service.analyze("let a = 1;", "a.js", "javascript");

    assertThat(result.errorKind()).isEqualTo(ErrorKind.GRAMMAR_UNAVAILABLE);
  }

  @Test
  void parserFaultYieldsParseFailure() {
    SourceTreeParser parser = mock(SourceTreeParser.class);
    when(parser.parse(anyString(), any(SourceGrammar.class)))
        .thenThrow(new SourceParseException("Parsing Error: parser returned no tree"));
    FlowGraphService faulty =
        new FlowGraphService(
            new GrammarRegistry(properties),
            new GrammarResolver(properties),
            parser,
            new SyntaxTaxonomyTable(),
            mock(GraphAssembler.class),
            properties,
            meterRegistry);

    ExtractionResult result = faulty.analyze("print(1)", "x.py", "python");

    assertThat(result.errorKind()).isEqualTo(ErrorKind.PARSE_FAILURE);
    assertThat(result.error()).startsWith("Parsing Error:");
    assertThat(result.nodes()).isNull();
  }

  @Test
  void successfulRunRecordsMetrics() {
    ExtractionResult result = service.analyze("print('hi')\n", "hello.py", "python");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.error()).isNull();
    assertThat(meterRegistry.counter("flowgraph_extractions_total").count()).isEqualTo(1.0);
    assertThat(meterRegistry.timer("flowgraph_extraction_duration").count()).isEqualTo(1L);
  }

  @Test
  void blankLabelUsesCodeRoot() {
    ExtractionResult result = service.analyze("x = 1\n", null, "python");

    assertThat(result.nodes().get(0).id()).isEqualTo("file_Code");
    assertThat(result.nodes().get(0).label()).isEqualTo("Code");
    assertThat(result.nodes().get(0).category()).isEqualTo(NodeCategory.FILE);
  }

  @Test
  void syntaxErrorsAreAnalyzedAsIs() {
    ExtractionResult result = service.analyze("run()\ndef broken(:\n", "bad.py", "python");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.nodes()).extracting(FlowNode::label).contains("L1: run()");
  }

  @Test
  void analyzesFileByExtension() throws Exception {
    Path file = tempDir.resolve("tasks.ts");
    Files.writeString(
        file,
        "function plan(n: number) {\n  while (n > 0) {\n    n = n - 1;\n  }\n}\n",
        StandardCharsets.UTF_8);

    ExtractionResult result = service.analyzeFile(file);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.nodes().get(0).id()).isEqualTo("file_tasks.ts");
    assertThat(result.nodes().get(0).file()).isEqualTo(file.toString());
    assertThat(result.nodes())
        .extracting(FlowNode::label)
        .contains("plan", "L2: while ((n > 0))", "L3: n = n - 1");
  }

  @Test
  void fileDetailLevelIsHonoured() throws Exception {
    Path file = tempDir.resolve("module.py");
    Files.writeString(file, "def run():\n    go()\n", StandardCharsets.UTF_8);

    ExtractionResult result = service.analyzeFile(file, DetailLevel.SUMMARY);

    assertThat(result.nodes())
        .extracting(FlowNode::id)
        .containsExactly("file_module.py", "run");
  }

  @Test
  void unsupportedExtensionIsUnavailable() throws Exception {
    Path file = tempDir.resolve("notes.txt");
    Files.writeString(file, "hello", StandardCharsets.UTF_8);

    ExtractionResult result = service.analyzeFile(file);

    assertThat(result.errorKind()).isEqualTo(ErrorKind.GRAMMAR_UNAVAILABLE);
    assertThat(result.error()).contains("notes.txt");
  }

  @Test
  void unreadableFileIsParseFailure() {
    ExtractionResult result = service.analyzeFile(tempDir.resolve("missing.py"));

    assertThat(result.errorKind()).isEqualTo(ErrorKind.PARSE_FAILURE);
    assertThat(meterRegistry.counter("flowgraph_extraction_failures_total").count()).isEqualTo(1.0);
  }
}
