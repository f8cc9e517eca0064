/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.sync;

import org.opensearch.federation.exception.SyncException;
import org.opensearch.federation.planner.Planner;

/** Builds a planner from the current schemas of the backend services. */
@FunctionalInterface
public interface SchemaSyncer {

  /**
   * Fetches every service schema and builds a planner over the merged registry.
   *
   * @return a planner bound to a fresh registry snapshot
   * @throws SyncException if a service cannot be introspected or the schemas conflict
   */
  Planner fetchPlanner() throws SyncException;
}
