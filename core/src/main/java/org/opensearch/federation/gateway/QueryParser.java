/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.Document;
import graphql.language.EnumValue;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.opensearch.federation.exception.QueryParseException;
import org.opensearch.federation.executor.FederationDocuments;
import org.opensearch.federation.schema.FederatedType;
import org.opensearch.federation.schema.TypeKind;
import org.opensearch.federation.schema.TypeReference;
import org.opensearch.federation.schema.TypeRegistry;

/**
 * Turns client query text into a {@link ParsedQuery}.
 *
 * <p>Sub-requests are self-contained documents, so everything that refers to other parts of the
 * client document is resolved here: fragment spreads become inline fragments, variable references
 * become literals and fields or fragments excluded by {@code @skip}/{@code @include} are dropped.
 * Variable values are converted along their declared types, so enum values become enum literals
 * also inside input objects.
 */
public class QueryParser {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Parses a query.
   *
   * @param query GraphQL document text
   * @param operationName operation to run, may be null when the document has one operation
   * @param variables variable values, may be null
   * @param registry registry used to recognize enum-typed variables, may be null
   * @throws QueryParseException if the text is invalid, the operation cannot be determined or a
   *     required variable is missing
   */
  public ParsedQuery parse(
      String query, String operationName, Map<String, Object> variables, TypeRegistry registry) {
    if (Strings.isNullOrEmpty(query)) {
      throw new QueryParseException("query is empty");
    }
    Document document;
    try {
      document = Parser.parse(query);
    } catch (InvalidSyntaxException e) {
      throw new QueryParseException("invalid query: " + e.getMessage(), e);
    }

    OperationDefinition operation = selectOperation(document, operationName);
    if (operation.getOperation() == OperationDefinition.Operation.SUBSCRIPTION) {
      throw new QueryParseException("subscriptions are not supported");
    }
    Map<String, FragmentDefinition> fragments =
        document.getDefinitionsOfType(FragmentDefinition.class).stream()
            .collect(
                Collectors.toMap(
                    FragmentDefinition::getName,
                    Function.identity(),
                    (first, second) -> {
                      throw new QueryParseException(
                          "fragment " + first.getName() + " is defined more than once");
                    }));

    Map<String, Object> values = variables == null ? Map.of() : variables;
    Resolver resolver = new Resolver(fragments, bindVariables(operation, values, registry));
    return new ParsedQuery(
        operation.getOperation(),
        operation.getName(),
        resolver.resolve(operation.getSelectionSet(), new HashSet<>()));
  }

  private static OperationDefinition selectOperation(Document document, String operationName) {
    List<OperationDefinition> operations =
        document.getDefinitionsOfType(OperationDefinition.class);
    if (operations.isEmpty()) {
      throw new QueryParseException("document contains no operation");
    }
    if (Strings.isNullOrEmpty(operationName)) {
      if (operations.size() > 1) {
        throw new QueryParseException(
            "document contains several operations, an operation name is required");
      }
      return operations.get(0);
    }
    return operations.stream()
        .filter(operation -> operationName.equals(operation.getName()))
        .findFirst()
        .orElseThrow(() -> new QueryParseException("unknown operation " + operationName));
  }

  /** Returns the literal bound to every variable that has a value or a default. */
  private static Map<String, Value<?>> bindVariables(
      OperationDefinition operation, Map<String, Object> variables, TypeRegistry registry) {
    Map<String, Value<?>> bound = new LinkedHashMap<>();
    for (VariableDefinition definition : operation.getVariableDefinitions()) {
      String name = definition.getName();
      if (variables.containsKey(name)) {
        JsonNode json = OBJECT_MAPPER.valueToTree(variables.get(name));
        if (json.isNull() && definition.getType() instanceof NonNullType) {
          throw new QueryParseException("variable $" + name + " must not be null");
        }
        bound.put(name, toLiteral(json, definition.getType(), registry));
      } else if (definition.getDefaultValue() != null) {
        bound.put(name, definition.getDefaultValue());
      } else if (definition.getType() instanceof NonNullType) {
        throw new QueryParseException("missing value for required variable $" + name);
      }
    }
    return bound;
  }

  private static Value<?> toLiteral(JsonNode json, Type<?> type, TypeRegistry registry) {
    return toLiteral(json, typeReference(type), registry);
  }

  /**
   * Converts a variable value into a literal of the declared type. Enum values become enum
   * literals, also when nested in input objects or lists.
   */
  private static Value<?> toLiteral(JsonNode json, TypeReference type, TypeRegistry registry) {
    switch (type.wrapper()) {
      case NON_NULL:
        return toLiteral(json, type.ofType(), registry);
      case LIST:
        if (!json.isArray()) {
          // A single value is accepted where a list is expected.
          return toLiteral(json, type.ofType(), registry);
        }
        List<Value> values = new ArrayList<>();
        json.forEach(element -> values.add(toLiteral(element, type.ofType(), registry)));
        return ArrayValue.newArrayValue().values(values).build();
      default:
        break;
    }
    FederatedType named = registry == null ? null : registry.getType(type.name()).orElse(null);
    if (named == null || json.isNull()) {
      return FederationDocuments.toValue(json);
    }
    if (named.getKind() == TypeKind.ENUM && json.isTextual()) {
      return new EnumValue(json.textValue());
    }
    if (named.getKind() == TypeKind.INPUT_OBJECT && json.isObject()) {
      ObjectValue.Builder builder = ObjectValue.newObjectValue();
      Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        Value<?> value =
            named
                .getField(field.getKey())
                .<Value<?>>map(definition -> toLiteral(field.getValue(), definition.type(), registry))
                .orElseGet(() -> FederationDocuments.toValue(field.getValue()));
        builder.objectField(new ObjectField(field.getKey(), value));
      }
      return builder.build();
    }
    return FederationDocuments.toValue(json);
  }

  private static TypeReference typeReference(Type<?> type) {
    if (type instanceof NonNullType) {
      return TypeReference.nonNull(typeReference(((NonNullType) type).getType()));
    }
    if (type instanceof ListType) {
      return TypeReference.listOf(typeReference(((ListType) type).getType()));
    }
    return TypeReference.named(((TypeName) type).getName());
  }

  /** Rewrites selection sets of one operation. */
  private static final class Resolver {

    private final Map<String, FragmentDefinition> fragments;

    private final Map<String, Value<?>> variables;

    private Resolver(Map<String, FragmentDefinition> fragments, Map<String, Value<?>> variables) {
      this.fragments = fragments;
      this.variables = new HashMap<>(variables);
    }

    private SelectionSet resolve(SelectionSet selectionSet, Set<String> visiting) {
      List<Selection> resolved = new ArrayList<>();
      for (Selection<?> selection : selectionSet.getSelections()) {
        if (selection instanceof Field) {
          Field field = (Field) selection;
          if (included(field.getDirectives())) {
            resolved.add(resolveField(field, visiting));
          }
        } else if (selection instanceof InlineFragment) {
          InlineFragment fragment = (InlineFragment) selection;
          if (included(fragment.getDirectives())) {
            resolved.add(
                InlineFragment.newInlineFragment()
                    .typeCondition(fragment.getTypeCondition())
                    .selectionSet(resolve(fragment.getSelectionSet(), visiting))
                    .build());
          }
        } else if (selection instanceof FragmentSpread) {
          FragmentSpread spread = (FragmentSpread) selection;
          if (included(spread.getDirectives())) {
            resolved.add(inline(spread, visiting));
          }
        }
      }
      return new SelectionSet(resolved);
    }

    private Field resolveField(Field field, Set<String> visiting) {
      List<Argument> arguments = new ArrayList<>();
      for (Argument argument : field.getArguments()) {
        Value<?> value = argument.getValue();
        if (value instanceof VariableReference
            && !variables.containsKey(((VariableReference) value).getName())) {
          // An unbound optional variable leaves the argument unset.
          continue;
        }
        arguments.add(new Argument(argument.getName(), substitute(value)));
      }
      SelectionSet selectionSet =
          field.getSelectionSet() == null ? null : resolve(field.getSelectionSet(), visiting);
      return field.transform(
          builder ->
              builder.arguments(arguments).directives(List.of()).selectionSet(selectionSet));
    }

    private InlineFragment inline(FragmentSpread spread, Set<String> visiting) {
      FragmentDefinition definition = fragments.get(spread.getName());
      if (definition == null) {
        throw new QueryParseException("unknown fragment " + spread.getName());
      }
      if (!visiting.add(spread.getName())) {
        throw new QueryParseException("fragment " + spread.getName() + " spreads itself");
      }
      SelectionSet selectionSet = resolve(definition.getSelectionSet(), visiting);
      visiting.remove(spread.getName());
      return InlineFragment.newInlineFragment()
          .typeCondition(definition.getTypeCondition())
          .selectionSet(selectionSet)
          .build();
    }

    private boolean included(List<Directive> directives) {
      for (Directive directive : directives) {
        if ("skip".equals(directive.getName()) && condition(directive)) {
          return false;
        }
        if ("include".equals(directive.getName()) && !condition(directive)) {
          return false;
        }
      }
      return true;
    }

    private boolean condition(Directive directive) {
      Argument argument = directive.getArgument("if");
      Value<?> value = argument == null ? null : substitute(argument.getValue());
      if (!(value instanceof BooleanValue)) {
        throw new QueryParseException(
            "@" + directive.getName() + " requires a boolean 'if' argument");
      }
      return ((BooleanValue) value).isValue();
    }

    private Value<?> substitute(Value<?> value) {
      if (value instanceof VariableReference) {
        Value<?> bound = variables.get(((VariableReference) value).getName());
        return bound == null ? NullValue.newNullValue().build() : bound;
      }
      if (value instanceof ArrayValue) {
        List<Value> values = new ArrayList<>();
        ((ArrayValue) value).getValues().forEach(element -> values.add(substitute(element)));
        return ArrayValue.newArrayValue().values(values).build();
      }
      if (value instanceof ObjectValue) {
        ObjectValue.Builder builder = ObjectValue.newObjectValue();
        for (ObjectField field : ((ObjectValue) value).getObjectFields()) {
          builder.objectField(new ObjectField(field.getName(), substitute(field.getValue())));
        }
        return builder.build();
      }
      return value;
    }
  }
}
