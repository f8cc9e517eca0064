/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import java.io.Closeable;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.opensearch.federation.exception.SyncException;
import org.opensearch.federation.executor.PlanExecutor;
import org.opensearch.federation.gateway.FederationGateway;
import org.opensearch.federation.gateway.FederationSettings;
import org.opensearch.federation.schema.ServiceSelector;
import org.opensearch.federation.sync.IntrospectionSchemaSyncer;
import org.opensearch.federation.sync.SchemaSyncService;

/** Wires a gateway that reaches its services over HTTP and keeps their schemas in sync. */
@Log4j2
public class FederationGatewayBootstrap implements Closeable {

  private final OkHttpClient okHttpClient;

  @Getter private final IntrospectionSchemaSyncer syncer;

  @Getter private final SchemaSyncService syncService;

  @Getter private final FederationGateway gateway;

  private FederationGatewayBootstrap(
      OkHttpClient okHttpClient,
      IntrospectionSchemaSyncer syncer,
      SchemaSyncService syncService,
      FederationGateway gateway) {
    this.okHttpClient = okHttpClient;
    this.syncer = syncer;
    this.syncService = syncService;
    this.gateway = gateway;
  }

  public static FederationGatewayBootstrap start(GatewayConfig config) throws SyncException {
    return start(config, new OkHttpClient(), ServiceSelector.none());
  }

  /**
   * Builds the gateway and runs the first schema sync.
   *
   * @param config validated configuration
   * @param okHttpClient HTTP client shared by all sub-requests
   * @param serviceSelector ownership overrides
   * @return the running gateway
   * @throws SyncException if the first schema sync fails
   */
  public static FederationGatewayBootstrap start(
      GatewayConfig config, OkHttpClient okHttpClient, ServiceSelector serviceSelector)
      throws SyncException {
    config.validate();
    FederationSettings settings = config.toSettings();
    HttpExecutionClient client =
        HttpExecutionClient.fromEndpoints(okHttpClient, config.getServices());

    IntrospectionSchemaSyncer syncer =
        new IntrospectionSchemaSyncer(
            client,
            config.getServices().stream()
                .map(ServiceEndpoint::getName)
                .collect(Collectors.toList()),
            settings.getIntrospectionTimeout().toMillis());
    syncer.setServiceSelector(serviceSelector);
    SchemaSyncService syncService =
        new SchemaSyncService(syncer, settings::getSchemaSyncInterval);
    try {
      syncService.start();
    } catch (SyncException | RuntimeException e) {
      syncService.close();
      throw e;
    }

    FederationGateway gateway =
        new FederationGateway(syncService, new PlanExecutor(client), settings);
    log.info("Federation gateway started for services {}", syncer.getServices());
    return new FederationGatewayBootstrap(okHttpClient, syncer, syncService, gateway);
  }

  @Override
  public void close() {
    syncService.close();
    okHttpClient.dispatcher().executorService().shutdown();
    okHttpClient.connectionPool().evictAll();
  }
}
