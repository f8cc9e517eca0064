/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.exception.SyncException;
import org.opensearch.federation.schema.introspection.IntrospectionField;
import org.opensearch.federation.schema.introspection.IntrospectionSchema;
import org.opensearch.federation.schema.introspection.IntrospectionType;

/**
 * Merges the introspection results of all services into one {@link TypeRegistry}.
 *
 * <p>Types with the same name are unioned: fields, union members and federation capabilities of
 * every service are collected on one merged type. Two services disagreeing on the kind of a type
 * or on the type of a field is a conflict and fails the conversion. Every field gets exactly one
 * owner: the {@link ServiceSelector} override when it returns one, otherwise the first declaring
 * service in name order.
 */
@RequiredArgsConstructor
public class SchemaConverter {

  private static final Logger LOG = LogManager.getLogger(SchemaConverter.class);

  private final ServiceSelector serviceSelector;

  /**
   * Converts per-service introspection results into a registry.
   *
   * @param schemas introspection schema keyed by service name
   * @param version version stamped on the resulting registry
   * @return the merged registry
   * @throws SyncException on conflicting declarations
   */
  public TypeRegistry convert(Map<String, IntrospectionSchema> schemas, long version)
      throws SyncException {
    Preconditions.checkArgument(!schemas.isEmpty(), "At least one service schema is required");

    Map<String, TypeAccumulator> merged = new LinkedHashMap<>();
    String queryTypeName = null;
    String mutationTypeName = null;

    // Services are merged in name order so field and type order is stable across syncs.
    for (Map.Entry<String, IntrospectionSchema> entry : new TreeMap<>(schemas).entrySet()) {
      String service = entry.getKey();
      IntrospectionSchema schema = entry.getValue();

      queryTypeName = agree("query type", queryTypeName, schema.getQueryTypeName(), service);
      if (schema.getMutationTypeName() != null) {
        mutationTypeName =
            agree("mutation type", mutationTypeName, schema.getMutationTypeName(), service);
      }

      String entryTypeName = findEntryTypeName(schema).orElse(null);
      for (IntrospectionType type : schema.getTypes()) {
        if (type.isIntrospectionType()) {
          continue;
        }
        if (type.getName().equals(entryTypeName)) {
          for (IntrospectionField lookup : type.getFields()) {
            accumulator(merged, lookup.getName(), TypeKind.OBJECT, service, false)
                .keyConsumers
                .add(service);
          }
          continue;
        }
        mergeType(merged, type, service, type.getName().equals(schema.getQueryTypeName()));
      }
    }

    if (!merged.containsKey(queryTypeName)) {
      throw new SyncException("No service declares the query type " + queryTypeName);
    }

    ImmutableMap.Builder<String, FederatedType> types = ImmutableMap.builder();
    for (TypeAccumulator accumulator : merged.values()) {
      if (!accumulator.declared) {
        LOG.warn("Type {} has a federation lookup but no declaration, ignoring", accumulator.name);
        continue;
      }
      types.put(accumulator.name, accumulator.build());
    }
    TypeRegistry registry =
        new TypeRegistry(version, queryTypeName, mutationTypeName, types.build());
    LOG.debug("Converted {} service schemas into registry {}", schemas.size(), registry);
    return registry;
  }

  private void mergeType(
      Map<String, TypeAccumulator> merged, IntrospectionType type, String service, boolean isQuery)
      throws SyncException {
    TypeAccumulator accumulator =
        accumulator(merged, type.getName(), type.getKind(), service, true);

    // Input objects list their fields under inputFields.
    for (IntrospectionField field : Iterables.concat(type.getFields(), type.getInputFields())) {
      if (FederationNames.KEY_MARKER.equals(field.getName())) {
        accumulator.keyProducers.add(service);
        continue;
      }
      if (isQuery && FederationNames.ENTRY_FIELD.equals(field.getName())) {
        continue;
      }
      TypeReference fieldType;
      try {
        Preconditions.checkArgument(field.getType() != null, "missing type");
        fieldType = field.getType().toTypeReference();
      } catch (IllegalArgumentException e) {
        throw new SyncException(
            String.format(
                "Service %s declares field %s.%s with a malformed type",
                service, type.getName(), field.getName()),
            e);
      }
      FieldAccumulator existing = accumulator.fields.get(field.getName());
      if (existing == null) {
        existing = new FieldAccumulator(fieldType);
        accumulator.fields.put(field.getName(), existing);
      } else if (!existing.type.equals(fieldType)) {
        throw new SyncException(
            String.format(
                "Conflicting types for field %s.%s: %s in %s, %s in %s",
                type.getName(),
                field.getName(),
                existing.type,
                existing.services.first(),
                fieldType,
                service));
      }
      existing.services.add(service);
    }
    type.getPossibleTypes().forEach(possible -> accumulator.possibleTypes.add(possible.getName()));
  }

  private TypeAccumulator accumulator(
      Map<String, TypeAccumulator> merged,
      String name,
      TypeKind kind,
      String service,
      boolean declaring)
      throws SyncException {
    TypeAccumulator accumulator = merged.computeIfAbsent(name, n -> new TypeAccumulator(n, kind));
    if (!declaring) {
      return accumulator;
    }
    if (accumulator.declared && accumulator.kind != kind) {
      throw new SyncException(
          String.format(
              "Conflicting kinds for type %s: %s and %s (in %s)",
              name, accumulator.kind, kind, service));
    }
    accumulator.kind = kind;
    accumulator.declared = true;
    return accumulator;
  }

  private static Optional<String> findEntryTypeName(IntrospectionSchema schema) {
    return schema.getTypes().stream()
        .filter(type -> type.getName().equals(schema.getQueryTypeName()))
        .flatMap(type -> type.getFields().stream())
        .filter(field -> FederationNames.ENTRY_FIELD.equals(field.getName()))
        .map(field -> field.getType().toTypeReference().namedType())
        .findFirst();
  }

  private static String agree(String what, String current, String candidate, String service)
      throws SyncException {
    if (current != null && !current.equals(candidate)) {
      throw new SyncException(
          String.format(
              "Service %s names its %s %s, other services use %s",
              service, what, candidate, current));
    }
    return candidate;
  }

  private final class TypeAccumulator {
    private final String name;
    private TypeKind kind;
    private boolean declared;
    private final Map<String, FieldAccumulator> fields = new LinkedHashMap<>();
    private final Set<String> possibleTypes = new TreeSet<>();
    private final Set<String> keyProducers = new TreeSet<>();
    private final Set<String> keyConsumers = new TreeSet<>();

    private TypeAccumulator(String name, TypeKind kind) {
      this.name = name;
      this.kind = kind;
    }

    private FederatedType build() {
      ImmutableMap.Builder<String, FieldDefinition> definitions = ImmutableMap.builder();
      for (Map.Entry<String, FieldAccumulator> entry : fields.entrySet()) {
        FieldAccumulator field = entry.getValue();
        ImmutableSortedSet<String> services = ImmutableSortedSet.copyOf(field.services);
        String owner = selectOwner(name, entry.getKey(), services);
        definitions.put(
            entry.getKey(), new FieldDefinition(entry.getKey(), field.type, services, owner));
      }
      return FederatedType.builder()
          .name(name)
          .kind(kind)
          .fields(definitions.build())
          .possibleTypes(ImmutableSortedSet.copyOf(possibleTypes))
          .keyProducers(ImmutableSortedSet.copyOf(keyProducers))
          .keyConsumers(ImmutableSortedSet.copyOf(keyConsumers))
          .build();
    }
  }

  private String selectOwner(
      String typeName, String fieldName, ImmutableSortedSet<String> services) {
    String selected = serviceSelector.selectService(typeName, fieldName);
    if (Strings.isNullOrEmpty(selected)) {
      return services.first();
    }
    if (!services.contains(selected)) {
      LOG.warn(
          "Service selector routes {}.{} to {} which does not declare it (declared by {})",
          typeName,
          fieldName,
          selected,
          services);
    }
    return selected;
  }

  private static final class FieldAccumulator {
    private final TypeReference type;
    private final TreeSet<String> services = new TreeSet<>();

    private FieldAccumulator(TypeReference type) {
      this.type = Objects.requireNonNull(type);
    }
  }
}
