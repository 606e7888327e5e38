package com.aiadvent.flowgraph.extract;

import com.aiadvent.flowgraph.ast.SourceNode;
import com.aiadvent.flowgraph.taxonomy.ConstructCategory;
import com.aiadvent.flowgraph.taxonomy.SyntaxTaxonomy;
import java.util.Optional;

/** Name lookups for class and function definitions, shared by the structure and flow passes. */
final class FunctionNames {

  private FunctionNames() {}

  static Optional<String> className(SourceNode classNode) {
    return classNode.field("name").map(SourceNode::text).filter(name -> !name.isBlank());
  }

  /**
   * The declared name of a function, or for anonymous functions the target they are bound to
   * (e.g. {@code const handler = () => {}}).
   */
  static Optional<String> functionName(SourceNode function, SyntaxTaxonomy taxonomy) {
    Optional<String> declared =
        function.field("name").map(SourceNode::text).filter(name -> !name.isBlank());
    if (declared.isPresent()) {
      return declared;
    }
    Optional<SourceNode> parent = function.parent();
    if (parent.isEmpty()) {
      return Optional.empty();
    }
    String bindingField = taxonomy.nameBindings().get(parent.get().kind());
    if (bindingField == null) {
      return Optional.empty();
    }
    return parent
        .get()
        .field(bindingField)
        .filter(target -> !target.key().equals(function.key()))
        .map(SourceNode::text)
        .filter(name -> !name.isBlank());
  }

  /**
   * Name of the class whose body directly declares {@code function}, looking through a decorator
   * wrapper. Functions nested deeper (inside methods, blocks, expressions) have no owning class.
   */
  static Optional<String> owningClass(SourceNode function, SyntaxTaxonomy taxonomy) {
    Optional<SourceNode> container = function.parent();
    if (container.isPresent() && wraps(container.get(), function, taxonomy)) {
      container = container.get().parent();
    }
    if (container.isEmpty()) {
      return Optional.empty();
    }
    SourceNode body = container.get();
    return body.parent()
        .filter(candidate -> taxonomy.is(candidate.kind(), ConstructCategory.CLASS))
        .filter(
            classNode ->
                classNode.field("body").map(b -> b.key().equals(body.key())).orElse(false))
        .flatMap(FunctionNames::className);
  }

  /** Unwraps a decorated class member to the function it decorates, if any. */
  static Optional<SourceNode> decoratedFunction(SourceNode member, SyntaxTaxonomy taxonomy) {
    if (taxonomy.is(member.kind(), ConstructCategory.FUNCTION)) {
      return Optional.of(member);
    }
    for (String field : taxonomy.decoratorFields()) {
      Optional<SourceNode> definition = member.field(field);
      if (definition.isPresent()
          && taxonomy.is(definition.get().kind(), ConstructCategory.FUNCTION)) {
        return definition;
      }
    }
    return Optional.empty();
  }

  private static boolean wraps(SourceNode wrapper, SourceNode function, SyntaxTaxonomy taxonomy) {
    for (String field : taxonomy.decoratorFields()) {
      Optional<SourceNode> definition = wrapper.field(field);
      if (definition.isPresent() && definition.get().key().equals(function.key())) {
        return true;
      }
    }
    return false;
  }
}
