/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Merged result of a plan forest. {@code data} holds whatever was assembled, also when some plans
 * failed; their errors are listed in {@code errors}.
 */
public record ExecutionResult(ObjectNode data, List<FederationError> errors) {

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
