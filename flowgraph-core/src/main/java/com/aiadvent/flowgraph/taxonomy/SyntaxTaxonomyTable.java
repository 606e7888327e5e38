package com.aiadvent.flowgraph.taxonomy;

import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.ASSIGNMENT;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.CALL;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.CLASS;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.ELIF;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.ELSE;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.FOR;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.FUNCTION;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.IF;
import static com.aiadvent.flowgraph.taxonomy.ConstructCategory.WHILE;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Static node-kind taxonomy for every supported grammar. To support a new grammar, add an entry
 * here and a matching {@code SourceGrammar} constant; traversal code does not change.
 */
@Component
public class SyntaxTaxonomyTable {

  private static final Map<String, SyntaxTaxonomy> TABLE =
      Stream.of(python(), javascript(), typescript())
          .collect(Collectors.toUnmodifiableMap(SyntaxTaxonomy::grammar, taxonomy -> taxonomy));

  public Optional<SyntaxTaxonomy> taxonomy(String grammar) {
    if (grammar == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(TABLE.get(grammar.trim().toLowerCase(Locale.ROOT)));
  }

  public Optional<ConstructCategory> categoryFor(String grammar, String kind) {
    return taxonomy(grammar).flatMap(taxonomy -> taxonomy.categoryFor(kind));
  }

  public Set<String> grammars() {
    return TABLE.keySet();
  }

  private static SyntaxTaxonomy python() {
    return SyntaxTaxonomy.builder("python")
        .kinds(CLASS, "class_definition")
        .kinds(FUNCTION, "function_definition")
        .kinds(IF, "if_statement")
        .kinds(ELIF, "elif_clause")
        .kinds(ELSE, "else_clause")
        .kinds(FOR, "for_statement")
        .kinds(WHILE, "while_statement")
        .kinds(CALL, "call")
        .kinds(ASSIGNMENT, "assignment")
        .wrappers("expression_statement", "module")
        .boundaries("module")
        .decoratorFields("definition")
        .build();
  }

  private static SyntaxTaxonomy javascript() {
    return SyntaxTaxonomy.builder("javascript")
        .kinds(CLASS, "class_declaration", "class")
        .kinds(
            FUNCTION,
            "function_declaration",
            "generator_function_declaration",
            "function_expression",
            "arrow_function",
            "method_definition")
        .kinds(IF, "if_statement")
        .kinds(ELSE, "else_clause")
        .kinds(FOR, "for_statement", "for_in_statement")
        .kinds(WHILE, "while_statement", "do_statement")
        .kinds(CALL, "call_expression")
        .kinds(ASSIGNMENT, "assignment_expression")
        .wrappers("expression_statement", "program")
        .boundaries("program")
        .nameBinding("variable_declarator", "name")
        .nameBinding("assignment_expression", "left")
        .build();
  }

  private static SyntaxTaxonomy typescript() {
    return SyntaxTaxonomy.builder("typescript")
        .kinds(CLASS, "class_declaration", "abstract_class_declaration", "class")
        .kinds(
            FUNCTION,
            "function_declaration",
            "generator_function_declaration",
            "function_expression",
            "arrow_function",
            "method_definition")
        .kinds(IF, "if_statement")
        .kinds(ELSE, "else_clause")
        .kinds(FOR, "for_statement", "for_in_statement")
        .kinds(WHILE, "while_statement", "do_statement")
        .kinds(CALL, "call_expression")
        .kinds(ASSIGNMENT, "assignment_expression")
        .wrappers("expression_statement", "program")
        .boundaries("program")
        .nameBinding("variable_declarator", "name")
        .nameBinding("assignment_expression", "left")
        .build();
  }
}
