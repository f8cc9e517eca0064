/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.exception;

import lombok.Getter;

/** A sub-request to one backend service failed or returned an unusable result. */
@Getter
public class BackendException extends FederationException {

  private final String service;

  public BackendException(String service, String message) {
    super(message);
    this.service = service;
  }

  public BackendException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
  }
}
