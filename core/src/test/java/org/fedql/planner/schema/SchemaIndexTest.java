/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.fedql.planner.SchemaFixtures;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.exception.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SchemaIndexTest {

  private SchemaIndex index;

  @BeforeEach
  void setUp() {
    index = SchemaFixtures.shopIndex();
  }

  @Test
  void owners_are_returned_in_declared_order() {
    assertEquals(List.of("products", "reviews", "inventory"), index.ownersOf("Product", "upc"));
    assertEquals(List.of("inventory", "products"), index.ownersOf("Product", "dimensions"));
  }

  @Test
  void unknown_or_ownerless_fields_have_no_owners() {
    assertTrue(index.ownersOf("User", "legacyId").isEmpty());
    assertTrue(index.ownersOf("User", "nickname").isEmpty());
    assertTrue(index.ownersOf("Unknown", "id").isEmpty());
  }

  @Test
  void duplicate_owners_are_collapsed() {
    SchemaIndex deduplicated =
        SchemaIndex.build(
            SchemaDescription.builder()
                .type(
                    TypeDescription.builder()
                        .name("Query")
                        .field(FieldDescription.of("me", "accounts", "accounts"))
                        .build())
                .build());

    assertEquals(List.of("accounts"), deduplicated.ownersOf("Query", "me"));
  }

  @Test
  void entity_keys_and_requirements_are_indexed() {
    assertEquals(List.of("id"), index.entityKeyOf("User"));
    assertEquals(List.of("upc"), index.entityKeyOf("Product"));
    assertTrue(index.entityKeyOf("Review").isEmpty());
    assertEquals(List.of("price", "weight"), index.requiresOf("Product", "shippingEstimate"));
    assertTrue(index.requiresOf("Product", "inStock").isEmpty());
  }

  @Test
  void declaring_sources_are_derived_from_field_owners() {
    assertEquals(Set.of("products", "reviews", "inventory"), index.sourcesOf("Product"));
    assertEquals(List.of("accounts", "reviews"), List.copyOf(index.sourcesOf("User")));
    assertTrue(index.hasType("Review"));
    assertFalse(index.hasType("Order"));
  }

  @Test
  void shared_keyless_type_is_a_value_type() {
    assertTrue(index.isValueType("Dimensions"));
    assertFalse(index.isValueType("Product"));
    assertFalse(index.isValueType("Review"));
  }

  @Test
  void default_root_types_are_exempt_from_entity_keys() {
    assertTrue(index.isRootType("Query"));
    assertTrue(index.isRootType("Mutation"));
    assertFalse(index.isRootType("User"));
  }

  @Test
  void declared_root_types_replace_the_defaults() {
    SchemaDescription description = SchemaFixtures.keylessSplit();
    description.setRootTypes(List.of("Query", "Location"));

    SchemaIndex custom = SchemaIndex.build(description);

    assertTrue(custom.isRootType("Location"));
    assertFalse(custom.isRootType("Mutation"));
  }

  @Test
  void reentry_points_are_indexed_per_source() {
    Optional<Reentry> inventory = index.reentryOf("Product", "inventory");

    assertTrue(inventory.isPresent());
    assertEquals("productBySku", inventory.get().getField());
    assertEquals(Optional.of("sku"), inventory.get().argumentFor("upc"));
    assertEquals(Optional.empty(), inventory.get().argumentFor("name"));
    assertEquals(
        Optional.of("upc"), index.reentryOf("Product", "reviews").get().argumentFor("upc"));
    assertTrue(index.reentryOf("User", "reviews").isEmpty());
  }

  @Test
  void keyless_split_type_fails_when_entity_keys_are_required() {
    SchemaException exception =
        assertThrows(
            SchemaException.class, () -> SchemaIndex.build(SchemaFixtures.keylessSplit()));

    assertEquals("Location", exception.getTypeName());
    assertNull(exception.getResponsePath());
  }

  @Test
  void keyless_split_type_is_accepted_when_entity_keys_are_optional() {
    SchemaIndex lenient =
        SchemaIndex.build(
            SchemaFixtures.keylessSplit(),
            PlannerSettings.builder().requireEntityKeys(false).build());

    assertTrue(lenient.entityKeyOf("Location").isEmpty());
    assertFalse(lenient.isValueType("Location"));
  }

  @Test
  void duplicate_type_is_rejected() {
    SchemaDescription description =
        SchemaDescription.builder()
            .type(TypeDescription.builder().name("User").build())
            .type(TypeDescription.builder().name("User").build())
            .build();

    assertThrows(SchemaException.class, () -> SchemaIndex.build(description));
  }

  @Test
  void blank_type_name_is_rejected() {
    SchemaDescription description =
        SchemaDescription.builder().type(TypeDescription.builder().name("").build()).build();

    assertThrows(SchemaException.class, () -> SchemaIndex.build(description));
  }

  @Test
  void duplicate_field_is_rejected() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .field(FieldDescription.of("id", "accounts"))
            .field(FieldDescription.of("id", "accounts")));
  }

  @Test
  void owner_must_declare_the_type() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .source("accounts")
            .key("id")
            .field(FieldDescription.of("id", "accounts"))
            .field(FieldDescription.of("reviews", "reviews")));
  }

  @Test
  void entity_key_must_be_a_field_of_the_type() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .key("uuid")
            .field(FieldDescription.of("id", "accounts")));
  }

  @Test
  void required_field_must_be_a_field_of_the_type() {
    assertSchemaError(
        TypeDescription.builder()
            .name("Product")
            .key("upc")
            .field(FieldDescription.of("upc", "products", "inventory"))
            .field(
                FieldDescription.builder()
                    .name("shippingEstimate")
                    .owner("inventory")
                    .require("volume")
                    .build()));
  }

  @Test
  void reentry_source_must_declare_the_type() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .key("id")
            .field(FieldDescription.of("id", "accounts", "reviews"))
            .reentryPoint("inventory", ReentryDescription.builder().field("user").build()));
  }

  @Test
  void reentry_may_only_map_forwarded_fields() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .key("id")
            .field(FieldDescription.of("id", "accounts", "reviews"))
            .field(FieldDescription.of("name", "accounts"))
            .reentryPoint(
                "reviews",
                ReentryDescription.builder().field("user").argument("name", "userName").build()));
  }

  @Test
  void provided_fields_and_base_sources_are_indexed() {
    assertEquals(List.of("name"), index.providesOf("Review", "product"));
    assertTrue(index.providesOf("Review", "author").isEmpty());
    assertEquals(Optional.of("products"), index.baseSourceOf("Product"));
    assertEquals(Optional.of("accounts"), index.baseSourceOf("User"));
    assertEquals(Optional.empty(), index.baseSourceOf("Unknown"));
  }

  @Test
  void declared_base_source_must_declare_the_type() {
    assertSchemaError(
        TypeDescription.builder()
            .name("User")
            .key("id")
            .baseSource("inventory")
            .field(FieldDescription.of("id", "accounts", "reviews")));
  }

  @Test
  void blank_provided_field_is_rejected() {
    assertSchemaError(
        TypeDescription.builder()
            .name("Review")
            .field(FieldDescription.builder().name("author").owner("reviews").provide("").build()));
  }

  @Test
  void empty_reentry_point_is_a_schema_error() {
    String json =
        "{\"types\": [{\"name\": \"User\", \"keys\": [\"id\"], \"fields\": ["
            + "{\"name\": \"id\", \"owners\": [\"accounts\", \"reviews\"]}],"
            + "\"reentryPoints\": {\"reviews\": null}}]}";
    SchemaDescription description =
        SchemaDescription.fromInputStream(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

    SchemaException exception =
        assertThrows(SchemaException.class, () -> SchemaIndex.build(description));
    assertEquals("User", exception.getTypeName());
  }

  @Test
  void schema_is_read_from_json() {
    String json =
        "{\"types\": [{\"name\": \"User\", \"keys\": [\"id\"], \"fields\": ["
            + "{\"name\": \"id\", \"owners\": [\"accounts\", \"reviews\"]},"
            + "{\"name\": \"reviews\", \"owners\": [\"reviews\"], \"deprecated\": true,"
            + " \"provides\": [\"body\"]}], \"baseSource\": \"reviews\","
            + "\"reentryPoints\": {\"reviews\": {\"field\": \"userById\","
            + " \"arguments\": {\"id\": \"userId\"}}}}]}";
    InputStream inputStream = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));

    SchemaIndex fromJson = SchemaIndex.build(SchemaDescription.fromInputStream(inputStream));

    assertEquals(List.of("reviews"), fromJson.ownersOf("User", "reviews"));
    assertEquals(List.of("id"), fromJson.entityKeyOf("User"));
    assertEquals(List.of("body"), fromJson.providesOf("User", "reviews"));
    assertEquals(Optional.of("reviews"), fromJson.baseSourceOf("User"));
    assertEquals(
        Optional.of("userId"), fromJson.reentryOf("User", "reviews").get().argumentFor("id"));
  }

  @Test
  void malformed_json_is_a_schema_error() {
    InputStream inputStream =
        new ByteArrayInputStream("{\"types\": [".getBytes(StandardCharsets.UTF_8));

    assertThrows(SchemaException.class, () -> SchemaDescription.fromInputStream(inputStream));
  }

  private static void assertSchemaError(TypeDescription.TypeDescriptionBuilder type) {
    SchemaDescription description = SchemaDescription.builder().type(type.build()).build();
    SchemaException exception =
        assertThrows(SchemaException.class, () -> SchemaIndex.build(description));
    assertEquals(type.build().getName(), exception.getTypeName());
  }
}
