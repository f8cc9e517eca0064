/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import graphql.introspection.IntrospectionQuery;
import graphql.language.Document;
import graphql.parser.Parser;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.Setter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.exception.SyncException;
import org.opensearch.federation.executor.ExecutionClient;
import org.opensearch.federation.executor.ExecutionRequest;
import org.opensearch.federation.planner.Planner;
import org.opensearch.federation.schema.SchemaConverter;
import org.opensearch.federation.schema.ServiceSelector;
import org.opensearch.federation.schema.TypeRegistry;
import org.opensearch.federation.schema.introspection.IntrospectionSchema;

/**
 * Syncer that sends the standard introspection query to every configured service and merges the
 * answers with {@link SchemaConverter}. Every successful fetch stamps the registry with the next
 * version number.
 */
public class IntrospectionSchemaSyncer implements SchemaSyncer {

  private static final Logger LOG = LogManager.getLogger(IntrospectionSchemaSyncer.class);

  private static final Document INTROSPECTION_DOCUMENT =
      Parser.parse(IntrospectionQuery.INTROSPECTION_QUERY);

  private final ExecutionClient client;

  @Getter private final ImmutableSortedSet<String> services;

  private final long timeoutMillis;

  private final AtomicLong version = new AtomicLong();

  /** Ownership overrides applied from the next fetch on. */
  @Getter @Setter private volatile ServiceSelector serviceSelector = ServiceSelector.none();

  public IntrospectionSchemaSyncer(
      ExecutionClient client, Collection<String> services, long timeoutMillis) {
    Preconditions.checkArgument(!services.isEmpty(), "At least one service is required");
    Preconditions.checkArgument(timeoutMillis > 0, "Timeout must be positive");
    this.client = client;
    this.services = ImmutableSortedSet.copyOf(services);
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public Planner fetchPlanner() throws SyncException {
    Map<String, CompletableFuture<JsonNode>> pending = new LinkedHashMap<>();
    for (String service : services) {
      pending.put(
          service,
          client.execute(
              new ExecutionRequest(service, "Query", INTROSPECTION_DOCUMENT, Map.of())));
    }

    // One deadline for the whole round, the services answer concurrently.
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    Map<String, IntrospectionSchema> schemas = new LinkedHashMap<>();
    try {
      for (Map.Entry<String, CompletableFuture<JsonNode>> entry : pending.entrySet()) {
        long remainingNanos = Math.max(0L, deadline - System.nanoTime());
        schemas.put(entry.getKey(), await(entry.getKey(), entry.getValue(), remainingNanos));
      }
    } catch (SyncException e) {
      pending.values().forEach(future -> future.cancel(true));
      throw e;
    }

    TypeRegistry registry =
        new SchemaConverter(serviceSelector).convert(schemas, version.incrementAndGet());
    LOG.debug("Fetched schemas of {} into registry version {}", services, registry.getVersion());
    return new Planner(registry);
  }

  private IntrospectionSchema await(
      String service, CompletableFuture<JsonNode> future, long timeoutNanos)
      throws SyncException {
    try {
      return IntrospectionSchema.fromJson(future.get(timeoutNanos, TimeUnit.NANOSECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SyncException("Interrupted while introspecting service " + service, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new SyncException(
          String.format("Failed to introspect service %s: %s", service, cause.getMessage()),
          cause);
    } catch (TimeoutException e) {
      throw new SyncException("Timed out introspecting service " + service, e);
    } catch (IllegalArgumentException e) {
      throw new SyncException(
          String.format("Service %s returned an invalid schema: %s", service, e.getMessage()), e);
    }
  }
}
