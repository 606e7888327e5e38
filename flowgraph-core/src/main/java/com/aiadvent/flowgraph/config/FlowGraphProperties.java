package com.aiadvent.flowgraph.config;

import com.aiadvent.flowgraph.extract.DetailLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "flowgraph")
public class FlowGraphProperties {

  private List<String> languages = new ArrayList<>(List.of("python", "javascript", "typescript"));
  private String defaultGrammar = "python";
  private Map<String, String> extensions = new LinkedHashMap<>(defaultExtensions());
  private final Extraction extraction = new Extraction();
  private final Labels labels = new Labels();
  private final Hierarchy hierarchy = new Hierarchy();

  public List<String> getLanguages() {
    return languages;
  }

  public void setLanguages(List<String> languages) {
    this.languages = languages != null ? new ArrayList<>(languages) : new ArrayList<>();
  }

  public boolean isLanguageEnabled(String languageId) {
    if (!StringUtils.hasText(languageId)) {
      return false;
    }
    String key = languageId.trim().toLowerCase(Locale.ROOT);
    return languages.stream().anyMatch(entry -> entry.equalsIgnoreCase(key));
  }

  public String getDefaultGrammar() {
    return defaultGrammar;
  }

  public void setDefaultGrammar(String defaultGrammar) {
    this.defaultGrammar = defaultGrammar;
  }

  public Map<String, String> getExtensions() {
    return extensions;
  }

  public void setExtensions(Map<String, String> extensions) {
    this.extensions = extensions != null ? new LinkedHashMap<>(extensions) : new LinkedHashMap<>();
  }

  public Extraction getExtraction() {
    return extraction;
  }

  public Labels getLabels() {
    return labels;
  }

  public Hierarchy getHierarchy() {
    return hierarchy;
  }

  private static Map<String, String> defaultExtensions() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("py", "python");
    defaults.put("js", "javascript");
    defaults.put("jsx", "javascript");
    defaults.put("mjs", "javascript");
    defaults.put("cjs", "javascript");
    defaults.put("ts", "typescript");
    return defaults;
  }

  public static class Extraction {
    private DetailLevel detailLevel = DetailLevel.FULL;
    private int maxDepth = 2000;

    public DetailLevel getDetailLevel() {
      return detailLevel;
    }

    public void setDetailLevel(DetailLevel detailLevel) {
      this.detailLevel = detailLevel != null ? detailLevel : DetailLevel.FULL;
    }

    public int getMaxDepth() {
      return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
      this.maxDepth = Math.max(1, maxDepth);
    }
  }

  /** Truncation limits applied to source text embedded in node labels. */
  public static class Labels {
    private int conditionMaxLength = 60;
    private int loopMaxLength = 50;
    private int targetMaxLength = 30;
    private int valueMaxLength = 40;
    private int calleeMaxLength = 30;
    private int argumentsMaxLength = 40;

    public int getConditionMaxLength() {
      return conditionMaxLength;
    }

    public void setConditionMaxLength(int conditionMaxLength) {
      this.conditionMaxLength = conditionMaxLength;
    }

    public int getLoopMaxLength() {
      return loopMaxLength;
    }

    public void setLoopMaxLength(int loopMaxLength) {
      this.loopMaxLength = loopMaxLength;
    }

    public int getTargetMaxLength() {
      return targetMaxLength;
    }

    public void setTargetMaxLength(int targetMaxLength) {
      this.targetMaxLength = targetMaxLength;
    }

    public int getValueMaxLength() {
      return valueMaxLength;
    }

    public void setValueMaxLength(int valueMaxLength) {
      this.valueMaxLength = valueMaxLength;
    }

    public int getCalleeMaxLength() {
      return calleeMaxLength;
    }

    public void setCalleeMaxLength(int calleeMaxLength) {
      this.calleeMaxLength = calleeMaxLength;
    }

    public int getArgumentsMaxLength() {
      return argumentsMaxLength;
    }

    public void setArgumentsMaxLength(int argumentsMaxLength) {
      this.argumentsMaxLength = argumentsMaxLength;
    }
  }

  public static class Hierarchy {
    private boolean rewireContainsEdges = false;

    public boolean isRewireContainsEdges() {
      return rewireContainsEdges;
    }

    public void setRewireContainsEdges(boolean rewireContainsEdges) {
      this.rewireContainsEdges = rewireContainsEdges;
    }
  }
}
