package com.aiadvent.flowgraph.taxonomy;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Node-kind mapping for one grammar.
 *
 * @param grammar grammar key, e.g. {@code python}
 * @param categories concrete node kind to construct category
 * @param wrapperKinds kinds descended through when looking for the entry node of a statement
 * @param boundaryKinds file-level kinds that terminate a scope lookup
 * @param decoratorFields fields of wrapper nodes that hold the decorated definition
 * @param nameBindings parent kind to the field naming an anonymous function assigned to it
 */
public record SyntaxTaxonomy(
    String grammar,
    Map<String, ConstructCategory> categories,
    Set<String> wrapperKinds,
    Set<String> boundaryKinds,
    List<String> decoratorFields,
    Map<String, String> nameBindings) {

  public SyntaxTaxonomy {
    categories = Map.copyOf(categories);
    wrapperKinds = Set.copyOf(wrapperKinds);
    boundaryKinds = Set.copyOf(boundaryKinds);
    decoratorFields = List.copyOf(decoratorFields);
    nameBindings = Map.copyOf(nameBindings);
  }

  public Optional<ConstructCategory> categoryFor(String kind) {
    if (kind == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(categories.get(kind));
  }

  public boolean is(String kind, ConstructCategory category) {
    return kind != null && categories.get(kind) == category;
  }

  public boolean isWrapper(String kind) {
    return wrapperKinds.contains(kind);
  }

  public boolean isBoundary(String kind) {
    return boundaryKinds.contains(kind);
  }

  static Builder builder(String grammar) {
    return new Builder(grammar);
  }

  static final class Builder {
    private final String grammar;
    private final Map<ConstructCategory, List<String>> kinds =
        new EnumMap<>(ConstructCategory.class);
    private Set<String> wrapperKinds = Set.of();
    private Set<String> boundaryKinds = Set.of();
    private List<String> decoratorFields = List.of();
    private Map<String, String> nameBindings = Map.of();

    private Builder(String grammar) {
      this.grammar = grammar;
    }

    Builder kinds(ConstructCategory category, String... nodeKinds) {
      kinds.put(category, List.of(nodeKinds));
      return this;
    }

    Builder wrappers(String... nodeKinds) {
      this.wrapperKinds = Set.of(nodeKinds);
      return this;
    }

    Builder boundaries(String... nodeKinds) {
      this.boundaryKinds = Set.of(nodeKinds);
      return this;
    }

    Builder decoratorFields(String... fields) {
      this.decoratorFields = List.of(fields);
      return this;
    }

    Builder nameBinding(String parentKind, String field) {
      Map<String, String> copy = new LinkedHashMap<>(nameBindings);
      copy.put(parentKind, field);
      this.nameBindings = copy;
      return this;
    }

    SyntaxTaxonomy build() {
      Map<String, ConstructCategory> categories = new LinkedHashMap<>();
      kinds.forEach(
          (category, nodeKinds) ->
              nodeKinds.forEach(kind -> categories.putIfAbsent(kind, category)));
      return new SyntaxTaxonomy(
          grammar, categories, wrapperKinds, boundaryKinds, decoratorFields, nameBindings);
    }
  }
}
