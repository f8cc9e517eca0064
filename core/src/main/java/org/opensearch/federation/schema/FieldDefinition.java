/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.schema;

import com.google.common.collect.ImmutableSortedSet;

/**
 * A field of the merged schema.
 *
 * @param name field name
 * @param type declared result type, identical across all declaring services
 * @param services every service whose schema declares the field
 * @param owner the service the planner routes the field to when the current plan's service cannot
 *     resolve it; fixed when the registry is built
 */
public record FieldDefinition(
    String name, TypeReference type, ImmutableSortedSet<String> services, String owner) {

  public boolean isResolvableBy(String service) {
    return service != null && services.contains(service);
  }
}
