/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import lombok.experimental.UtilityClass;

/** Reserved names shared by the planner, the executor and the backend services. */
@UtilityClass
public class FederationNames {

  /**
   * Field injected into a plan's selection set when a child plan needs to re-enter the selected
   * object from another service. Never visible to clients.
   */
  public static final String KEY_MARKER = "_federationKey";

  /** Root query field under which a service exposes one key-based lookup per type. */
  public static final String ENTRY_FIELD = "_federation";

  /** Argument of the per-type lookup fields carrying the batched federation keys. */
  public static final String KEYS_ARGUMENT = "keys";

  public static final String TYPENAME = "__typename";

  /** Returns true for names a client may never select directly. */
  public static boolean isReserved(String fieldName) {
    return KEY_MARKER.equals(fieldName) || ENTRY_FIELD.equals(fieldName);
  }
}
