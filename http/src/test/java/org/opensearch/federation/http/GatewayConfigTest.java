/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.gateway.FederationSettings;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GatewayConfigTest {

  @Test
  void should_read_configuration_file() throws Exception {
    GatewayConfig config;
    try (InputStream inputStream = getClass().getResourceAsStream("/gateway.json")) {
      config = GatewayConfig.fromInputStream(inputStream);
    }

    assertEquals(2, config.getServices().size());
    assertEquals("posts", config.getServices().get(1).getName());
    assertEquals("http://localhost:4002/graphql", config.getServices().get(1).getUrl());
    FederationSettings settings = config.toSettings();
    assertEquals(Duration.ofSeconds(10), settings.getSchemaSyncInterval());
    assertEquals(Duration.ofMillis(2500), settings.getQueryTimeout());
    assertEquals(
        FederationSettings.DEFAULT_INTROSPECTION_TIMEOUT, settings.getIntrospectionTimeout());
  }

  @Test
  void should_default_optional_settings() {
    GatewayConfig config =
        read("{\"services\": [{\"name\": \"users\", \"url\": \"http://localhost/graphql\"}]}");

    FederationSettings settings = config.toSettings();
    assertEquals(FederationSettings.DEFAULT_SCHEMA_SYNC_INTERVAL, settings.getSchemaSyncInterval());
    assertFalse(settings.hasQueryTimeout());
  }

  @Test
  void should_reject_malformed_json() {
    IllegalArgumentException exception =
        assertThrows(IllegalArgumentException.class, () -> read("{\"services\": ["));
    assertTrue(exception.getMessage().startsWith("Malformed gateway configuration"));
  }

  @Test
  void should_reject_invalid_services() {
    assertEquals(
        "At least one service must be configured",
        assertThrows(IllegalArgumentException.class, () -> read("{\"services\": []}"))
            .getMessage());
    assertEquals(
        "Duplicate service name users",
        assertThrows(
                IllegalArgumentException.class,
                () ->
                    read(
                        "{\"services\": [{\"name\": \"users\", \"url\": \"http://a/\"},"
                            + " {\"name\": \"users\", \"url\": \"http://b/\"}]}"))
            .getMessage());
    assertEquals(
        "Invalid URL ftp://a/ for service users",
        assertThrows(
                IllegalArgumentException.class,
                () -> read("{\"services\": [{\"name\": \"users\", \"url\": \"ftp://a/\"}]}"))
            .getMessage());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            read(
                "{\"services\": [{\"name\": \"users\", \"url\": \"http://a/\"}],"
                    + " \"queryTimeoutMillis\": -1}"));
  }

  private static GatewayConfig read(String json) {
    return GatewayConfig.fromInputStream(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }
}
