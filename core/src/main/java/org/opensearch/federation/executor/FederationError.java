/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import java.util.List;

/**
 * Error attached to the location a failed plan should have populated.
 *
 * @param message what went wrong
 * @param service service whose sub-request failed
 * @param path response keys from the query root to the plan's target objects
 */
public record FederationError(String message, String service, List<String> path) {}
