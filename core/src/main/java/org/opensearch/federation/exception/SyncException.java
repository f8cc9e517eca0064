/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

/**
 * Introspection fetch or registry conversion failed. Callers of {@code fetchPlanner} decide whether
 * the previously published planner stays in effect.
 */
public class SyncException extends Exception {

  public SyncException(String message) {
    super(message);
  }

  public SyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
