/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;

/**
 * A client operation ready for planning: fragment spreads are inlined, variables are substituted
 * and {@code @skip}/{@code @include} are applied.
 *
 * @param operation query or mutation
 * @param operationName name of the selected operation, null for anonymous operations
 * @param selectionSet self-contained root selection set
 */
public record ParsedQuery(
    OperationDefinition.Operation operation, String operationName, SelectionSet selectionSet) {}
