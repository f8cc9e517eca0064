/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

/** Kinds of named types in the merged schema. */
public enum TypeKind {
  SCALAR,
  OBJECT,
  INTERFACE,
  UNION,
  ENUM,
  INPUT_OBJECT;

  /** Returns true for kinds whose runtime value is one of several concrete object types. */
  public boolean isAbstract() {
    return this == INTERFACE || this == UNION;
  }

  /** Returns true for kinds that carry a selection set. */
  public boolean isComposite() {
    return this == OBJECT || isAbstract();
  }
}
