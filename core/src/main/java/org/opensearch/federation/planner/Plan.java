/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import com.google.common.collect.ImmutableList;
import graphql.language.AstPrinter;
import graphql.language.SelectionSet;
import java.util.List;
import java.util.Objects;
import lombok.Getter;

/**
 * One unit of work for exactly one backend service: a selection set evaluated against {@code type}
 * by {@code service}. The result is spliced into the parent plan's result at {@code pathSteps}
 * (empty for root plans). Plans in {@code after} depend on the federation keys this plan returns
 * and run strictly after it.
 *
 * <p>Plans are immutable. Equality is structural; selection sets are compared by their printed
 * form because graphql-java AST nodes do not implement deep equality.
 */
@Getter
public class Plan {

  private final String service;

  private final String type;

  private final SelectionSet selectionSet;

  private final List<PathStep> pathSteps;

  private final List<Plan> after;

  public Plan(
      String service,
      String type,
      SelectionSet selectionSet,
      List<PathStep> pathSteps,
      List<Plan> after) {
    this.service = Objects.requireNonNull(service, "service");
    this.type = Objects.requireNonNull(type, "type");
    this.selectionSet = Objects.requireNonNull(selectionSet, "selectionSet");
    this.pathSteps = ImmutableList.copyOf(pathSteps);
    this.after = ImmutableList.copyOf(after);
  }

  /** Returns a copy of this plan whose path starts with {@code step}. */
  public Plan withPathPrefix(PathStep step) {
    return new Plan(
        service,
        type,
        selectionSet,
        ImmutableList.<PathStep>builder().add(step).addAll(pathSteps).build(),
        after);
  }

  public boolean isRoot() {
    return pathSteps.isEmpty();
  }

  /** Returns the number of plans in the tree rooted at this plan. */
  public int size() {
    return 1 + after.stream().mapToInt(Plan::size).sum();
  }

  /** Returns the selection set in compact GraphQL syntax. */
  public String printSelectionSet() {
    return AstPrinter.printAstCompact(selectionSet);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Plan)) {
      return false;
    }
    Plan other = (Plan) o;
    return service.equals(other.service)
        && type.equals(other.type)
        && pathSteps.equals(other.pathSteps)
        && printSelectionSet().equals(other.printSelectionSet())
        && after.equals(other.after);
  }

  @Override
  public int hashCode() {
    return Objects.hash(service, type, pathSteps, printSelectionSet(), after);
  }

  @Override
  public String toString() {
    return "Plan{"
        + "service='"
        + service
        + "', type='"
        + type
        + "', path="
        + pathSteps
        + ", selectionSet="
        + printSelectionSet()
        + ", after="
        + after
        + '}';
  }
}
