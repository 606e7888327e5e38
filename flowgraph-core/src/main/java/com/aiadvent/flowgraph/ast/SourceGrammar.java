package com.aiadvent.flowgraph.ast;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

/**
 * Maps grammar keys to the Tree-sitter language bindings shipped as Maven artifacts.
 */
public enum SourceGrammar {
  PYTHON("python", TreeSitterPython::new),
  JAVASCRIPT("javascript", TreeSitterJavascript::new),
  TYPESCRIPT("typescript", TreeSitterTypescript::new);

  private static final Map<String, SourceGrammar> INDEX =
      Stream.of(values())
          .collect(Collectors.toUnmodifiableMap(SourceGrammar::id, grammar -> grammar));

  private final String id;
  private final Supplier<TSLanguage> languageFactory;

  SourceGrammar(String id, Supplier<TSLanguage> languageFactory) {
    this.id = id;
    this.languageFactory = languageFactory;
  }

  public String id() {
    return id;
  }

  TSLanguage newLanguage() {
    return languageFactory.get();
  }

  public static Optional<SourceGrammar> fromId(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String key = value.trim().toLowerCase(Locale.ROOT);
    return Optional.ofNullable(INDEX.get(key));
  }
}
