/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.databind.JsonNode;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.BooleanValue;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FloatValue;
import graphql.language.IntValue;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;
import graphql.language.StringValue;
import graphql.language.Value;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;
import org.opensearch.federation.planner.Plan;
import org.opensearch.federation.schema.FederationNames;

/** Builds the documents sent to backend services for root and keyed plans. */
@UtilityClass
public class FederationDocuments {

  /** Returns {@code <operation> { selectionSet }}. */
  public static Document operation(OperationDefinition.Operation operation, Plan plan) {
    return document(operation, plan.getSelectionSet());
  }

  /**
   * Returns {@code { _federation { <Type>(keys: [...]) { selectionSet } } }}: one lookup that
   * resolves the plan's selection set for every key, answered as a list aligned with the keys.
   */
  public static Document entities(Plan plan, List<JsonNode> keys) {
    List<Value> keyValues = new ArrayList<>(keys.size());
    keys.forEach(key -> keyValues.add(toValue(key)));
    Field lookup =
        Field.newField(plan.getType())
            .arguments(
                List.of(
                    new Argument(
                        FederationNames.KEYS_ARGUMENT,
                        ArrayValue.newArrayValue().values(keyValues).build())))
            .selectionSet(plan.getSelectionSet())
            .build();
    Field entry =
        Field.newField(FederationNames.ENTRY_FIELD)
            .selectionSet(new SelectionSet(List.of(lookup)))
            .build();
    return document(OperationDefinition.Operation.QUERY, new SelectionSet(List.of(entry)));
  }

  /** Converts a JSON value into a GraphQL literal. */
  public static Value<?> toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullValue.newNullValue().build();
    }
    if (node.isObject()) {
      ObjectValue.Builder builder = ObjectValue.newObjectValue();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        builder.objectField(new ObjectField(field.getKey(), toValue(field.getValue())));
      }
      return builder.build();
    }
    if (node.isArray()) {
      List<Value> values = new ArrayList<>(node.size());
      node.forEach(element -> values.add(toValue(element)));
      return ArrayValue.newArrayValue().values(values).build();
    }
    if (node.isBoolean()) {
      return new BooleanValue(node.booleanValue());
    }
    if (node.isIntegralNumber()) {
      return new IntValue(node.bigIntegerValue());
    }
    if (node.isNumber()) {
      return new FloatValue(node.decimalValue());
    }
    return new StringValue(node.asText());
  }

  private static Document document(
      OperationDefinition.Operation operation, SelectionSet selectionSet) {
    return Document.newDocument()
        .definition(
            OperationDefinition.newOperationDefinition()
                .operation(operation)
                .selectionSet(selectionSet)
                .build())
        .build();
  }
}
