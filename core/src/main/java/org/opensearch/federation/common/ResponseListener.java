/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common;

/**
 * Callback receiving the outcome of an asynchronous gateway call. Invoked on whichever thread
 * completed the last sub-request, never on the caller's thread unless the call failed before
 * dispatch.
 *
 * @param <R> response type
 */
public interface ResponseListener<R> {

  void onResponse(R response);

  /** Called once with the failure; {@link #onResponse} is then never called. */
  void onFailure(Exception e);
}
