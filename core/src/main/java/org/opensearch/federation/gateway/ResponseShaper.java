/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import org.opensearch.federation.schema.FederationNames;

/**
 * Projects the merged result tree onto the client's selection set. Keys come out in query order
 * under their aliases, data missing because a plan failed becomes null, and fields only the
 * planner asked for (the injected {@code __typename}) are dropped.
 *
 * <p>Works on the flattened selection set: object selections hold fields only and abstract
 * selections hold one inline fragment per concrete type.
 */
public class ResponseShaper {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Shapes the data of one operation.
   *
   * @param selectionSet flattened root selection set
   * @param rootTypeName root type, reported for a root {@code __typename}
   * @param data merged result tree
   */
  public ObjectNode shape(SelectionSet selectionSet, String rootTypeName, ObjectNode data) {
    return shapeObject(selectionSet, data, rootTypeName);
  }

  private JsonNode shapeValue(SelectionSet selectionSet, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return NullNode.getInstance();
    }
    if (selectionSet == null) {
      return value;
    }
    if (value.isArray()) {
      ArrayNode array = OBJECT_MAPPER.createArrayNode();
      value.forEach(element -> array.add(shapeValue(selectionSet, element)));
      return array;
    }
    if (!value.isObject()) {
      return NullNode.getInstance();
    }
    return shapeObject(selectionSet, value, null);
  }

  private ObjectNode shapeObject(SelectionSet selectionSet, JsonNode value, String typeName) {
    if (isAbstract(selectionSet)) {
      String runtimeType = value.path(FederationNames.TYPENAME).asText(null);
      for (Selection<?> selection : selectionSet.getSelections()) {
        InlineFragment branch = (InlineFragment) selection;
        if (branch.getTypeCondition().getName().equals(runtimeType)) {
          return shapeObject(branch.getSelectionSet(), value, runtimeType);
        }
      }
      return OBJECT_MAPPER.createObjectNode();
    }

    ObjectNode shaped = OBJECT_MAPPER.createObjectNode();
    for (Selection<?> selection : selectionSet.getSelections()) {
      Field field = (Field) selection;
      String key = field.getResultKey();
      if (FederationNames.TYPENAME.equals(field.getName())) {
        JsonNode typename = value.get(key);
        if ((typename == null || typename.isNull()) && typeName != null) {
          typename = TextNode.valueOf(typeName);
        }
        shaped.set(key, typename == null ? NullNode.getInstance() : typename);
      } else {
        shaped.set(key, shapeValue(field.getSelectionSet(), value.get(key)));
      }
    }
    return shaped;
  }

  private static boolean isAbstract(SelectionSet selectionSet) {
    return !selectionSet.getSelections().isEmpty()
        && selectionSet.getSelections().get(0) instanceof InlineFragment;
  }
}
