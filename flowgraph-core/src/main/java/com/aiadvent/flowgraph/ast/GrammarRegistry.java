package com.aiadvent.flowgraph.ast;

import com.aiadvent.flowgraph.config.FlowGraphProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;

/**
 * Lazily loads Tree-sitter languages for the enabled grammar set and caches them per grammar.
 */
@Component
public class GrammarRegistry {

  private static final Logger log = LoggerFactory.getLogger(GrammarRegistry.class);

  private final FlowGraphProperties properties;
  private final Map<SourceGrammar, TSLanguage> loaded = new ConcurrentHashMap<>();

  public GrammarRegistry(FlowGraphProperties properties) {
    this.properties = properties;
  }

  /**
   * Resolves a grammar key to an enabled grammar.
   *
   * @throws GrammarUnavailableException if the key is unknown or not enabled
   */
  public SourceGrammar grammar(String grammarKey) {
    SourceGrammar grammar =
        SourceGrammar.fromId(grammarKey)
            .orElseThrow(
                () ->
                    new GrammarUnavailableException(
                        grammarKey, "Unsupported language: " + grammarKey));
    if (!properties.isLanguageEnabled(grammar.id())) {
      log.debug("Grammar {} is not enabled", grammar.id());
      throw new GrammarUnavailableException(
          grammarKey, "Language '" + grammar.id() + "' is not enabled");
    }
    return grammar;
  }

  public TSLanguage language(SourceGrammar grammar) {
    return loaded.computeIfAbsent(grammar, this::load);
  }

  public boolean isLoaded(SourceGrammar grammar) {
    return loaded.containsKey(grammar);
  }

  private TSLanguage load(SourceGrammar grammar) {
    log.info("Loading Tree-sitter grammar for {}", grammar.id());
    try {
      TSLanguage language = grammar.newLanguage();
      log.info("Successfully loaded {} grammar", grammar.id());
      return language;
    } catch (LinkageError | RuntimeException ex) {
      log.warn("Failed to load Tree-sitter grammar {}: {}", grammar.id(), ex.getMessage());
      throw new GrammarUnavailableException(
          grammar.id(),
          "Language '" + grammar.id() + "' could not be loaded: " + ex.getMessage(),
          ex);
    }
  }
}
