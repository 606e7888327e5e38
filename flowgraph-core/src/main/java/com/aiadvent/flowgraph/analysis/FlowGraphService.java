package com.aiadvent.flowgraph.analysis;

import com.aiadvent.flowgraph.ast.GrammarRegistry;
import com.aiadvent.flowgraph.ast.GrammarResolver;
import com.aiadvent.flowgraph.ast.GrammarUnavailableException;
import com.aiadvent.flowgraph.ast.SourceGrammar;
import com.aiadvent.flowgraph.ast.SourceParseException;
import com.aiadvent.flowgraph.ast.SourceTree;
import com.aiadvent.flowgraph.ast.SourceTreeParser;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.extract.DetailLevel;
import com.aiadvent.flowgraph.graph.ExtractionResult;
import com.aiadvent.flowgraph.graph.ExtractionResult.ErrorKind;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomyTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for flow-graph extraction. Grammar and parser failures come back as failed
 * {@link ExtractionResult}s rather than exceptions.
 */
@Service
public class FlowGraphService {

  private static final Logger log = LoggerFactory.getLogger(FlowGraphService.class);

  private final GrammarRegistry grammarRegistry;
  private final GrammarResolver grammarResolver;
  private final SourceTreeParser parser;
  private final SyntaxTaxonomyTable taxonomyTable;
  private final GraphAssembler assembler;
  private final FlowGraphProperties properties;
  private final MeterRegistry meterRegistry;
  private final Timer extractionTimer;
  private final Counter extractionCounter;
  private final Counter failureCounter;

  public FlowGraphService(
      GrammarRegistry grammarRegistry,
      GrammarResolver grammarResolver,
      SourceTreeParser parser,
      SyntaxTaxonomyTable taxonomyTable,
      GraphAssembler assembler,
      FlowGraphProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.grammarRegistry = Objects.requireNonNull(grammarRegistry, "grammarRegistry");
    this.grammarResolver = Objects.requireNonNull(grammarResolver, "grammarResolver");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.taxonomyTable = Objects.requireNonNull(taxonomyTable, "taxonomyTable");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.properties = Objects.requireNonNull(properties, "properties");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.meterRegistry = registry;
    this.extractionTimer = registry.timer("flowgraph_extraction_duration");
    this.extractionCounter = registry.counter("flowgraph_extractions_total");
    this.failureCounter = registry.counter("flowgraph_extraction_failures_total");
  }

  public ExtractionResult analyze(String source, String fileLabel, String grammarKey) {
    return analyze(source, fileLabel, grammarKey, properties.getExtraction().getDetailLevel());
  }

  public ExtractionResult analyze(
      String source, String fileLabel, String grammarKey, DetailLevel detailLevel) {
    Objects.requireNonNull(source, "source");
    DetailLevel level = detailLevel != null ? detailLevel : DetailLevel.FULL;
    String displayName = StringUtils.hasText(fileLabel) ? fileLabel : "snippet";
    log.info("Analyzing code from {} (language: {}, detail: {})", displayName, grammarKey, level);
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      SourceGrammar grammar = grammarRegistry.grammar(grammarKey);
      SyntaxTaxonomy taxonomy =
          taxonomyTable
              .taxonomy(grammar.id())
              .orElseThrow(
                  () ->
                      new GrammarUnavailableException(
                          grammar.id(), "No syntax taxonomy for language: " + grammar.id()));
      SourceTree tree = parser.parse(source, grammar);
      if (tree.hasErrors()) {
        log.warn("{} contains syntax errors; analyzing the recovered tree", displayName);
      }
      ExtractionResult result = assembler.assemble(tree, fileLabel, taxonomy, level);
      extractionCounter.increment();
      log.info(
          "Parsing complete for {}: {} nodes, {} edges",
          displayName,
          result.nodes().size(),
          result.edges().size());
      return result;
    } catch (GrammarUnavailableException ex) {
      return fail(ErrorKind.GRAMMAR_UNAVAILABLE, ex.getMessage(), displayName);
    } catch (SourceParseException ex) {
      return fail(ErrorKind.PARSE_FAILURE, ex.getMessage(), displayName);
    } finally {
      sample.stop(extractionTimer);
    }
  }

  public ExtractionResult analyzeFile(Path file) {
    return analyzeFile(file, properties.getExtraction().getDetailLevel());
  }

  /** Reads a UTF-8 source file and picks its grammar from the file extension. */
  public ExtractionResult analyzeFile(Path file, DetailLevel detailLevel) {
    Objects.requireNonNull(file, "file");
    String fileLabel = file.toString();
    String fileName = file.getFileName() != null ? file.getFileName().toString() : fileLabel;
    Optional<String> grammarKey = grammarResolver.resolve(fileName);
    if (grammarKey.isEmpty()) {
      return fail(
          ErrorKind.GRAMMAR_UNAVAILABLE, "Unsupported file type: " + fileName, fileLabel);
    }
    String source;
    try {
      source = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      return fail(
          ErrorKind.PARSE_FAILURE, "Cannot read " + fileLabel + ": " + ex.getMessage(), fileLabel);
    }
    return analyze(source, fileLabel, grammarKey.get(), detailLevel);
  }

  private ExtractionResult fail(ErrorKind kind, String message, String displayName) {
    failureCounter.increment();
    log.warn("Flow graph extraction failed for {} ({}): {}", displayName, kind, message);
    return ExtractionResult.failure(kind, message);
  }
}
