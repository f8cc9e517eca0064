/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema.introspection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/** The {@code __schema} object of a standard GraphQL introspection result. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class IntrospectionSchema {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private NamedRef queryType;

  private NamedRef mutationType;

  private List<IntrospectionType> types = new ArrayList<>();

  /**
   * Reads an introspection result. Accepts the {@code __schema} object itself, an object holding it
   * under {@code __schema}, or a full response holding it under {@code data.__schema}.
   *
   * @param json introspection payload
   * @return the schema
   * @throws IllegalArgumentException if the payload has no recognizable schema
   */
  public static IntrospectionSchema fromJson(JsonNode json) {
    JsonNode node = json;
    if (node != null && node.has("data")) {
      node = node.get("data");
    }
    if (node != null && node.has("__schema")) {
      node = node.get("__schema");
    }
    if (node == null || !node.isObject() || !node.has("types")) {
      throw new IllegalArgumentException("Introspection result does not contain a schema");
    }
    try {
      return OBJECT_MAPPER.treeToValue(node, IntrospectionSchema.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed introspection result: " + e.getMessage(), e);
    }
  }

  /** Returns the query type name, defaulting to {@code Query}. */
  public String getQueryTypeName() {
    return queryType == null || queryType.getName() == null ? "Query" : queryType.getName();
  }

  public String getMutationTypeName() {
    return mutationType == null ? null : mutationType.getName();
  }

  /** Reference to a type by name only. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class NamedRef {
    private String name;
  }
}
