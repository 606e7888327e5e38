package com.aiadvent.flowgraph.ast;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.treesitter.TSException;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Parses source text into a {@link SourceTree}. A fresh native parser is created per call, so a
 * single instance can serve concurrent callers.
 */
@Component
public class SourceTreeParser {

  private static final Logger log = LoggerFactory.getLogger(SourceTreeParser.class);

  private final GrammarRegistry grammarRegistry;

  public SourceTreeParser(GrammarRegistry grammarRegistry) {
    this.grammarRegistry = grammarRegistry;
  }

  /**
   * Parses {@code content} with the given grammar. Trees produced by error recovery are returned
   * as-is; only hard parser faults are reported.
   *
   * @throws SourceParseException if no tree could be produced
   */
  public SourceTree parse(String content, SourceGrammar grammar) {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(grammar, "grammar");
    TSLanguage language = grammarRegistry.language(grammar);
    TSParser parser = new TSParser();
    try {
      if (!parser.setLanguage(language)) {
        throw new SourceParseException(
            "Parsing Error: grammar '"
                + grammar.id()
                + "' is incompatible with the parser runtime");
      }
      TSTree tree = parser.parseString(null, content);
      if (tree == null) {
        throw new SourceParseException("Parsing Error: parser returned no tree");
      }
      TSNode rootNode = tree.getRootNode();
      if (rootNode == null || rootNode.isNull()) {
        throw new SourceParseException("Parsing Error: parser returned an empty tree");
      }
      byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
      boolean hasErrors = rootNode.hasError();
      log.debug(
          "Tree-sitter AST generated (grammar={}, bytes={}, errors={})",
          grammar.id(),
          bytes.length,
          hasErrors);
      return new SourceTree(grammar, new TreeSitterSourceNode(rootNode, bytes), hasErrors, tree);
    } catch (TSException ex) {
      log.error("Tree-sitter parsing failed for grammar {}: {}", grammar.id(), ex.getMessage());
      throw new SourceParseException("Parsing Error: " + ex.getMessage(), ex);
    }
  }
}
