/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.common.ResponseListener;
import org.opensearch.federation.executor.PlanExecutor;
import org.opensearch.federation.executor.QueryContext;
import org.opensearch.federation.planner.Planner;
import org.opensearch.federation.planner.QueryPlan;
import org.opensearch.federation.sync.PlannerSupplier;

/**
 * Entry point for client queries: parse, plan against the currently published schema, execute
 * and shape the response.
 *
 * <p>Parse and planning failures are thrown by the calling thread before any sub-request is sent.
 * Backend failures never fail the returned future; they are reported in {@link
 * QueryResponse#errors()}. The future fails only when the query is cancelled or times out.
 */
@Log4j2
@RequiredArgsConstructor
public class FederationGateway {

  private final PlannerSupplier plannerSupplier;

  private final PlanExecutor executor;

  @Getter private final FederationSettings settings;

  private final QueryParser parser = new QueryParser();

  private final ResponseShaper shaper = new ResponseShaper();

  public CompletableFuture<QueryResponse> execute(String query) {
    return execute(query, null, Map.of());
  }

  public CompletableFuture<QueryResponse> execute(
      String query, String operationName, Map<String, Object> variables) {
    return execute(query, operationName, variables, new QueryContext());
  }

  /**
   * Executes a query under a caller supplied context, which allows the caller to cancel it.
   *
   * @param query GraphQL document text
   * @param operationName operation to run, may be null when the document has one operation
   * @param variables variable values, may be null
   * @param context query context
   * @return future of the response
   */
  public CompletableFuture<QueryResponse> execute(
      String query, String operationName, Map<String, Object> variables, QueryContext context) {
    // One planner for the whole query, also when a sync publishes a new one meanwhile.
    Planner planner = plannerSupplier.getPlanner();
    ParsedQuery parsed = parser.parse(query, operationName, variables, planner.getRegistry());
    QueryPlan plan = planner.plan(parsed.operation(), parsed.selectionSet());
    log.debug(
        "Query {} planned against registry version {}: {}",
        context.getQueryId(),
        planner.getRegistry().getVersion(),
        plan.roots());

    CompletableFuture<QueryResponse> response =
        executor
            .execute(plan, context)
            .thenApply(
                result ->
                    new QueryResponse(
                        shaper.shape(plan.selectionSet(), plan.rootType(), result.data()),
                        result.errors()));
    if (settings.hasQueryTimeout()) {
      long timeoutMillis = settings.getQueryTimeout().toMillis();
      CompletableFuture.delayedExecutor(timeoutMillis, TimeUnit.MILLISECONDS)
          .execute(
              () -> {
                if (!response.isDone()) {
                  context.cancel("query timed out after " + timeoutMillis + "ms");
                }
              });
    }
    return response;
  }

  /**
   * Executes a query and reports the outcome to {@code listener}, including parse and planning
   * failures.
   */
  public void execute(
      String query,
      String operationName,
      Map<String, Object> variables,
      ResponseListener<QueryResponse> listener) {
    CompletableFuture<QueryResponse> response;
    try {
      response = execute(query, operationName, variables);
    } catch (RuntimeException e) {
      log.debug("Query rejected: {}", e.getMessage());
      listener.onFailure(e);
      return;
    }
    response.whenComplete(
        (result, error) -> {
          if (error == null) {
            listener.onResponse(result);
          } else {
            Throwable cause = error instanceof CompletionException ? error.getCause() : error;
            listener.onFailure(
                cause instanceof Exception ? (Exception) cause : new RuntimeException(cause));
          }
        });
  }
}
