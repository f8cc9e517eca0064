/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.base.Preconditions;

/**
 * Reference to a type as declared on a field: a named type, possibly wrapped in list and non-null
 * modifiers.
 */
public record TypeReference(Wrapper wrapper, String name, TypeReference ofType) {

  /** Modifier applied by this reference. */
  public enum Wrapper {
    NAMED,
    LIST,
    NON_NULL
  }

  public TypeReference {
    Preconditions.checkArgument(
        wrapper == Wrapper.NAMED ? name != null : ofType != null,
        "Malformed type reference: wrapper=%s name=%s",
        wrapper,
        name);
  }

  public static TypeReference named(String name) {
    return new TypeReference(Wrapper.NAMED, name, null);
  }

  public static TypeReference listOf(TypeReference ofType) {
    return new TypeReference(Wrapper.LIST, null, ofType);
  }

  public static TypeReference nonNull(TypeReference ofType) {
    return new TypeReference(Wrapper.NON_NULL, null, ofType);
  }

  /** Returns the name of the innermost named type. */
  public String namedType() {
    TypeReference current = this;
    while (current.wrapper != Wrapper.NAMED) {
      current = current.ofType;
    }
    return current.name;
  }

  @Override
  public String toString() {
    switch (wrapper) {
      case LIST:
        return "[" + ofType + "]";
      case NON_NULL:
        return ofType + "!";
      default:
        return name;
    }
  }
}
