/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema.introspection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;
import org.opensearch.federation.schema.TypeReference;

/** Recursive {@code kind / name / ofType} reference used by introspection for field types. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class IntrospectionTypeRef {

  private String kind;

  private String name;

  private IntrospectionTypeRef ofType;

  /**
   * Converts the reference into the registry representation.
   *
   * @throws IllegalArgumentException if a wrapper has no inner type
   */
  public TypeReference toTypeReference() {
    if ("NON_NULL".equals(kind) || "LIST".equals(kind)) {
      if (ofType == null) {
        throw new IllegalArgumentException(kind + " type reference without ofType");
      }
      TypeReference inner = ofType.toTypeReference();
      return "LIST".equals(kind) ? TypeReference.listOf(inner) : TypeReference.nonNull(inner);
    }
    if (name == null) {
      throw new IllegalArgumentException("Named type reference of kind " + kind + " has no name");
    }
    return TypeReference.named(name);
  }
}
