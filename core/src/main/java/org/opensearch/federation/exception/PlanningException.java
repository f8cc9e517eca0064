/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/**
 * Thrown when a query cannot be decomposed into per-service plans: a selected field is unknown to
 * the merged schema, or two services cannot be bridged because a federation key is missing. No
 * partial plan is ever returned alongside this exception.
 */
public class PlanningException extends FederationException {

  public PlanningException(String message) {
    super(message);
  }
}
