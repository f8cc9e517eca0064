/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.sync;

import org.opensearch.federation.planner.Planner;

/** Source of the currently published planner. */
@FunctionalInterface
public interface PlannerSupplier {

  Planner getPlanner();
}
