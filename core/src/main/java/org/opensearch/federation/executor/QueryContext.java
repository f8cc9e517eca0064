/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runtime state of one query execution. Tracks in-flight sub-requests and provides cancellation
 * of the whole plan forest.
 */
public class QueryContext {

  private static final Logger LOG = LogManager.getLogger(QueryContext.class);

  @Getter private final String queryId;

  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

  private final AtomicReference<String> cancelReason = new AtomicReference<>();

  private final CompletableFuture<String> cancellation = new CompletableFuture<>();

  public QueryContext() {
    this(UUID.randomUUID().toString());
  }

  public QueryContext(String queryId) {
    this.queryId = queryId;
  }

  /**
   * Registers a sub-request so that it is aborted when the query is cancelled. A request registered
   * after cancellation is aborted immediately.
   */
  public <T> CompletableFuture<T> track(CompletableFuture<T> future) {
    inFlight.add(future);
    future.whenComplete((result, error) -> inFlight.remove(future));
    if (isCancelled()) {
      future.cancel(true);
    }
    return future;
  }

  /** Cancels the query and aborts every in-flight sub-request. */
  public void cancel() {
    cancel("query was cancelled");
  }

  public void cancel(String reason) {
    if (cancelReason.compareAndSet(null, reason)) {
      LOG.debug(
          "Cancelling query {} with {} in-flight requests: {}", queryId, inFlight.size(), reason);
      inFlight.forEach(future -> future.cancel(true));
      cancellation.complete(reason);
    }
  }

  public boolean isCancelled() {
    return cancelReason.get() != null;
  }

  /** Returns the cancellation reason, or null if the query was not cancelled. */
  public String getCancelReason() {
    return cancelReason.get();
  }

  /** Completes with the cancellation reason once {@link #cancel} is called. */
  public CompletableFuture<String> whenCancelled() {
    return cancellation;
  }

  int inFlightCount() {
    return inFlight.size();
  }
}
