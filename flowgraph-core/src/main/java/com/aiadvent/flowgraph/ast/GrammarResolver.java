package com.aiadvent.flowgraph.ast;

import com.aiadvent.flowgraph.config.FlowGraphProperties;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps file names to grammar keys by extension. Names without an extension fall back to the
 * configured default grammar; unknown extensions resolve to nothing.
 */
@Component
public class GrammarResolver {

  private final FlowGraphProperties properties;

  public GrammarResolver(FlowGraphProperties properties) {
    this.properties = properties;
  }

  public Optional<String> resolve(String fileName) {
    String baseName = baseName(fileName);
    int dot = baseName.lastIndexOf('.');
    if (dot < 0 || dot == baseName.length() - 1) {
      return Optional.ofNullable(properties.getDefaultGrammar()).filter(StringUtils::hasText);
    }
    String extension = baseName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : properties.getExtensions().entrySet()) {
      if (entry.getKey().equalsIgnoreCase(extension)) {
        return Optional.ofNullable(entry.getValue()).filter(StringUtils::hasText);
      }
    }
    return Optional.empty();
  }

  static String baseName(String fileName) {
    if (!StringUtils.hasText(fileName)) {
      return "";
    }
    String normalized = fileName.replace('\\', '/');
    return normalized.substring(normalized.lastIndexOf('/') + 1);
  }
}
