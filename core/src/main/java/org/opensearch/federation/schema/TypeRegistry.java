/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.collect.ImmutableMap;
import graphql.language.OperationDefinition;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.federation.exception.PlanningException;

/**
 * Immutable snapshot of the merged type system. A new registry is built on every successful schema
 * sync and replaces the previous one as a whole; in-flight queries keep the snapshot they started
 * with.
 */
@Getter
@RequiredArgsConstructor
@ToString(of = {"version", "queryTypeName", "mutationTypeName"})
@EqualsAndHashCode
public class TypeRegistry {

  private final long version;

  private final String queryTypeName;

  /** Null when no service exposes mutations. */
  private final String mutationTypeName;

  private final ImmutableMap<String, FederatedType> types;

  public Optional<FederatedType> getType(String typeName) {
    return Optional.ofNullable(types.get(typeName));
  }

  /** Returns the named type or fails planning if the merged schema does not declare it. */
  public FederatedType requireType(String typeName) {
    return getType(typeName)
        .orElseThrow(() -> new PlanningException("unknown type " + typeName));
  }

  /** Returns the root type an operation of the given kind is evaluated against. */
  public FederatedType getRootType(OperationDefinition.Operation operation) {
    switch (operation) {
      case QUERY:
        return requireType(queryTypeName);
      case MUTATION:
        if (mutationTypeName == null) {
          throw new PlanningException("schema does not support mutations");
        }
        return requireType(mutationTypeName);
      default:
        throw new PlanningException("unsupported operation " + operation);
    }
  }
}
