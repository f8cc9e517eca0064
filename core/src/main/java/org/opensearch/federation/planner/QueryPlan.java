/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;
import java.util.List;

/**
 * Planner output for one operation.
 *
 * @param operation operation kind; mutations execute their root plans one after the other
 * @param rootType name of the root type the operation was planned against
 * @param selectionSet the client's selection set after flattening, used to shape the response
 * @param roots the plan forest, one root plan per service needed at the top level
 */
public record QueryPlan(
    OperationDefinition.Operation operation,
    String rootType,
    SelectionSet selectionSet,
    List<Plan> roots) {}
