/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

/**
 * One hop locating a child plan's target objects inside its parent plan's result.
 *
 * @param kind {@link Kind#FIELD} descends into the value under a response key (every element when
 *     the value is a list); {@link Kind#TYPE_CONDITION} keeps only objects whose {@code __typename}
 *     equals the name and does not move the location
 * @param name response key or concrete type name
 */
public record PathStep(Kind kind, String name) {

  public enum Kind {
    FIELD,
    TYPE_CONDITION
  }

  public static PathStep field(String responseKey) {
    return new PathStep(Kind.FIELD, responseKey);
  }

  public static PathStep typeCondition(String typeName) {
    return new PathStep(Kind.TYPE_CONDITION, typeName);
  }

  @Override
  public String toString() {
    return kind == Kind.FIELD ? name : "... on " + name;
  }
}
