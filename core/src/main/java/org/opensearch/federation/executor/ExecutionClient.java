/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response capability used to reach backend services. Implementations own transport,
 * encoding and retries.
 */
@FunctionalInterface
public interface ExecutionClient {

  /**
   * Sends one sub-request.
   *
   * @param request the service, document and variables to execute
   * @return future of the response {@code data} object; fails with {@link
   *     org.opensearch.federation.exception.BackendException} when the backend cannot answer or
   *     reports errors. Cancelling the future should abort the underlying call.
   */
  CompletableFuture<JsonNode> execute(ExecutionRequest request);
}
