/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** The query context was cancelled (explicitly or by timeout) before execution completed. */
public class QueryCancelledException extends FederationException {

  public QueryCancelledException(String message) {
    super(message);
  }
}
