/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

/**
 * Ownership policy consulted while the type registry is built. Given a (type, field) pair declared
 * by several services it names the service that resolves the field; {@code null} or an empty string
 * means no override.
 */
@FunctionalInterface
public interface ServiceSelector {

  String selectService(String typeName, String fieldName);

  /** Selector that never overrides the default owner. */
  static ServiceSelector none() {
    return (typeName, fieldName) -> null;
  }
}
