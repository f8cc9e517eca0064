/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A named type of the merged schema together with its federation capabilities.
 *
 * <p>{@code keyProducers} are the services that return a federation key for instances of this
 * type (they expose {@link FederationNames#KEY_MARKER} on it). {@code keyConsumers} are the
 * services that can resolve an instance again from such a key (they list the type under their
 * {@link FederationNames#ENTRY_FIELD} root field). A plan may only hand an object over from
 * service A to service B when A produces and B consumes the key.
 */
@Getter
@Builder
@ToString(of = {"name", "kind"})
@EqualsAndHashCode
public class FederatedType {

  @NonNull private final String name;

  @NonNull private final TypeKind kind;

  @Builder.Default private final ImmutableMap<String, FieldDefinition> fields = ImmutableMap.of();

  @Builder.Default
  private final ImmutableSortedSet<String> possibleTypes = ImmutableSortedSet.of();

  @Builder.Default
  private final ImmutableSortedSet<String> keyProducers = ImmutableSortedSet.of();

  @Builder.Default
  private final ImmutableSortedSet<String> keyConsumers = ImmutableSortedSet.of();

  public Optional<FieldDefinition> getField(String fieldName) {
    return Optional.ofNullable(fields.get(fieldName));
  }

  public boolean canHandOver(String fromService, String toService) {
    return keyProducers.contains(fromService) && keyConsumers.contains(toService);
  }
}
