/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/** Thrown when the query text cannot be turned into an executable selection set. */
public class QueryParseException extends FederationException {

  public QueryParseException(String message) {
    super(message);
  }

  public QueryParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
