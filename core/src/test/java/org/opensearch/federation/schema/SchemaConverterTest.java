/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.federation.SchemaFixtures.introspect;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.SchemaFixtures;
import org.opensearch.federation.exception.SyncException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SchemaConverterTest {

  private final SchemaConverter converter = new SchemaConverter(ServiceSelector.none());

  @Test
  void should_merge_fields_of_same_type_across_services() {
    TypeRegistry registry = SchemaFixtures.kitchenSink();

    FederatedType foo = registry.requireType("Foo");
    assertEquals(
        Set.of("name", "s1hmm", "s1nest", "s2ok", "s2bar", "s2nest"), foo.getFields().keySet());
    assertEquals(
        ImmutableSortedSet.of("schema1", "schema2"), foo.getField("name").get().services());
    assertEquals("schema2", foo.getField("s2ok").get().owner());
    assertEquals(TypeKind.UNION, registry.requireType("FooOrBar").getKind());
    assertEquals(
        ImmutableSortedSet.of("Bar", "Foo"), registry.requireType("FooOrBar").getPossibleTypes());
  }

  @Test
  void should_pick_first_service_in_name_order_as_default_owner() {
    TypeRegistry registry = SchemaFixtures.kitchenSink();

    assertEquals("schema1", registry.requireType("Foo").getField("name").get().owner());
    assertEquals("schema1", registry.requireType("Bar").getField("id").get().owner());
  }

  @Test
  void should_let_selector_override_owner_even_for_undeclaring_service() {
    TypeRegistry registry =
        SchemaFixtures.registry(
            (type, field) -> "Query".equals(type) && "s2root".equals(field) ? "schema1" : null,
            Map.of("schema1", SchemaFixtures.SCHEMA1, "schema2", SchemaFixtures.SCHEMA2));

    FieldDefinition s2root = registry.requireType("Query").getField("s2root").get();
    assertEquals("schema1", s2root.owner());
    assertFalse(s2root.isResolvableBy("schema1"));
  }

  @Test
  void should_record_key_producers_and_consumers() {
    TypeRegistry registry = SchemaFixtures.kitchenSink();

    FederatedType foo = registry.requireType("Foo");
    assertEquals(ImmutableSortedSet.of("schema1", "schema2"), foo.getKeyProducers());
    assertEquals(ImmutableSortedSet.of("schema2"), foo.getKeyConsumers());
    assertTrue(foo.canHandOver("schema1", "schema2"));
    assertFalse(foo.canHandOver("schema2", "schema1"));

    FederatedType bar = registry.requireType("Bar");
    assertEquals(ImmutableSortedSet.of("schema1"), bar.getKeyConsumers());
  }

  @Test
  void should_hide_reserved_fields_and_entry_type() {
    TypeRegistry registry = SchemaFixtures.kitchenSink();

    assertTrue(registry.requireType("Query").getField("_federation").isEmpty());
    assertTrue(registry.requireType("Foo").getField("_federationKey").isEmpty());
    assertTrue(registry.getType("Federation").isEmpty());
    assertTrue(registry.getType("__Schema").isEmpty());
  }

  @Test
  void should_read_root_type_names() {
    TypeRegistry registry =
        SchemaFixtures.registry(
            Map.of(
                "a", "type Query { x: Int }",
                "b", "type Query { y: Int } type Mutation { setY(y: Int): Int }"));

    assertEquals("Query", registry.getQueryTypeName());
    assertEquals("Mutation", registry.getMutationTypeName());
    assertEquals(1L, registry.getVersion());
  }

  @Test
  void should_fail_on_conflicting_field_types() {
    SyncException exception =
        assertThrows(
            SyncException.class,
            () ->
                converter.convert(
                    Map.of(
                        "a", introspect("type Query { x: Int }"),
                        "b", introspect("type Query { x: String }")),
                    1L));
    assertEquals(
        "Conflicting types for field Query.x: Int in a, String in b", exception.getMessage());
  }

  @Test
  void should_fail_on_conflicting_type_kinds() {
    SyncException exception =
        assertThrows(
            SyncException.class,
            () ->
                converter.convert(
                    Map.of(
                        "a", introspect("type Query { x: T } type T { y: Int }"),
                        "b", introspect("type Query { z: T } enum T { ONE }")),
                    1L));
    assertEquals("Conflicting kinds for type T: OBJECT and ENUM (in b)", exception.getMessage());
  }

  @Test
  void should_keep_wrapped_field_types() {
    TypeRegistry registry =
        SchemaFixtures.registry(Map.of("a", "type Query { xs: [Int!]! }"));

    TypeReference type = registry.requireType("Query").getField("xs").get().type();
    assertEquals("[Int!]!", type.toString());
    assertEquals("Int", type.namedType());
    assertNull(registry.getMutationTypeName());
  }

  @Test
  void should_record_input_object_fields() {
    TypeRegistry registry =
        SchemaFixtures.registry(
            Map.of(
                "a",
                "type Query { items(filter: Filter): Int }"
                    + " input Filter { color: Color! tags: [String] } enum Color { RED }"));

    FederatedType filter = registry.requireType("Filter");
    assertEquals(TypeKind.INPUT_OBJECT, filter.getKind());
    assertEquals(Set.of("color", "tags"), filter.getFields().keySet());
    assertEquals("Color!", filter.getField("color").get().type().toString());
  }
}
