/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema.introspection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.opensearch.federation.schema.TypeKind;

/** One entry of {@code __schema.types}. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class IntrospectionType {

  private TypeKind kind;

  private String name;

  private List<IntrospectionField> fields = new ArrayList<>();

  private List<IntrospectionField> inputFields = new ArrayList<>();

  private List<IntrospectionSchema.NamedRef> possibleTypes = new ArrayList<>();

  /** Null lists in the payload are normalized to empty ones. */
  public List<IntrospectionField> getFields() {
    return fields == null ? List.of() : fields;
  }

  public List<IntrospectionField> getInputFields() {
    return inputFields == null ? List.of() : inputFields;
  }

  public List<IntrospectionSchema.NamedRef> getPossibleTypes() {
    return possibleTypes == null ? List.of() : possibleTypes;
  }

  /** Introspection meta types such as {@code __Schema} are never merged. */
  public boolean isIntrospectionType() {
    return name != null && name.startsWith("__");
  }
}
