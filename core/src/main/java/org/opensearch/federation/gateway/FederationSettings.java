/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Runtime settings of a gateway. */
@Value
@Builder
public class FederationSettings {

  public static final Duration DEFAULT_SCHEMA_SYNC_INTERVAL = Duration.ofSeconds(30);

  public static final Duration DEFAULT_INTROSPECTION_TIMEOUT = Duration.ofSeconds(10);

  /** Delay between two schema syncs. */
  @Builder.Default Duration schemaSyncInterval = DEFAULT_SCHEMA_SYNC_INTERVAL;

  /** Upper bound for one introspection sub-request. */
  @Builder.Default Duration introspectionTimeout = DEFAULT_INTROSPECTION_TIMEOUT;

  /** Query execution deadline. Null or zero disables the deadline. */
  Duration queryTimeout;

  public static FederationSettings defaults() {
    return FederationSettings.builder().build();
  }

  public boolean hasQueryTimeout() {
    return queryTimeout != null && !queryTimeout.isZero() && !queryTimeout.isNegative();
  }
}
