/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import okhttp3.HttpUrl;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.gateway.FederationSettings;

/**
 * File based gateway configuration.
 *
 * <pre>
 * {
 *   "services": [{"name": "users", "url": "http://localhost:4001/graphql"}],
 *   "schemaSyncIntervalSeconds": 30,
 *   "queryTimeoutMillis": 5000
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class GatewayConfig {

  private static final Logger LOG = LogManager.getLogger();

  private List<ServiceEndpoint> services = new ArrayList<>();

  private long schemaSyncIntervalSeconds =
      FederationSettings.DEFAULT_SCHEMA_SYNC_INTERVAL.getSeconds();

  private long introspectionTimeoutMillis =
      FederationSettings.DEFAULT_INTROSPECTION_TIMEOUT.toMillis();

  /** Zero disables the query deadline. */
  private long queryTimeoutMillis;

  /**
   * Reads and validates a configuration.
   *
   * @param inputStream JSON document
   * @return the configuration
   * @throws IllegalArgumentException if the document is malformed or invalid
   */
  public static GatewayConfig fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    GatewayConfig config;
    try {
      config = objectMapper.readValue(inputStream, GatewayConfig.class);
    } catch (IOException e) {
      LOG.error("Gateway configuration is malformed.");
      throw new IllegalArgumentException(
          "Malformed gateway configuration: " + e.getMessage(), e);
    }
    config.validate();
    return config;
  }

  /** Checks service names are present and unique and every URL is an http(s) URL. */
  public void validate() {
    Preconditions.checkArgument(
        services != null && !services.isEmpty(), "At least one service must be configured");
    Set<String> names = new HashSet<>();
    for (ServiceEndpoint service : services) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(service.getName()), "Service name must not be empty");
      Preconditions.checkArgument(
          names.add(service.getName()), "Duplicate service name %s", service.getName());
      Preconditions.checkArgument(
          HttpUrl.parse(Strings.nullToEmpty(service.getUrl())) != null,
          "Invalid URL %s for service %s",
          service.getUrl(),
          service.getName());
    }
    Preconditions.checkArgument(
        schemaSyncIntervalSeconds > 0, "schemaSyncIntervalSeconds must be positive");
    Preconditions.checkArgument(
        introspectionTimeoutMillis > 0, "introspectionTimeoutMillis must be positive");
    Preconditions.checkArgument(queryTimeoutMillis >= 0, "queryTimeoutMillis must not be negative");
  }

  public FederationSettings toSettings() {
    return FederationSettings.builder()
        .schemaSyncInterval(Duration.ofSeconds(schemaSyncIntervalSeconds))
        .introspectionTimeout(Duration.ofMillis(introspectionTimeoutMillis))
        .queryTimeout(queryTimeoutMillis == 0 ? null : Duration.ofMillis(queryTimeoutMillis))
        .build();
  }
}
