/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import org.opensearch.federation.exception.PlanningException;
import org.opensearch.federation.schema.FederatedType;
import org.opensearch.federation.schema.FederationNames;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.TypeRegistry;

/**
 * Decomposes a selection set written against the merged schema into a forest of per-service
 * {@link Plan}s.
 *
 * <p>For every object reached by the query the fields are split into the ones the current plan's
 * service can resolve (kept in the plan) and the ones it cannot (grouped by owning service and
 * planned as child plans against the same object). A plan with children asks its service for the
 * object's federation key through {@link FederationNames#KEY_MARKER}. On abstract types every
 * concrete branch is planned on its own and child plans are located through a type condition step.
 *
 * <p>The planner is pure: it performs no I/O and the same (registry, query) pair always yields
 * equal forests. A planner is bound to one immutable {@link TypeRegistry} snapshot.
 */
public class Planner {

  @Getter private final TypeRegistry registry;

  private final SelectionFlattener flattener;

  public Planner(TypeRegistry registry) {
    this.registry = registry;
    this.flattener = new SelectionFlattener(registry);
  }

  /**
   * Plans a query operation.
   *
   * @param selectionSet validated selection set rooted at the query type
   * @return root plans, one per service needed at the top level, in service name order
   * @throws PlanningException if a field has no owner or two services cannot be bridged
   */
  public List<Plan> plan(SelectionSet selectionSet) {
    return plan(OperationDefinition.Operation.QUERY, selectionSet).roots();
  }

  /**
   * Plans an operation of the given kind.
   *
   * @param operation query or mutation
   * @param selectionSet validated selection set rooted at the operation's root type
   * @return the plan forest together with the flattened selection set
   */
  public QueryPlan plan(OperationDefinition.Operation operation, SelectionSet selectionSet) {
    FederatedType rootType = registry.getRootType(operation);
    SelectionSet flattened = flattener.flatten(selectionSet, rootType);
    if (operation == OperationDefinition.Operation.MUTATION) {
      return new QueryPlan(
          operation, rootType.getName(), flattened, planMutation(rootType, flattened));
    }
    // The root is served by no service: every field is handed to its owner.
    Branch root = planObject(rootType, flattened, null);
    return new QueryPlan(operation, rootType.getName(), flattened, root.after());
  }

  /**
   * Mutation fields execute in query order, so root fields are grouped into runs of consecutive
   * fields with the same owner instead of one group per service.
   */
  private List<Plan> planMutation(FederatedType rootType, SelectionSet flattened) {
    List<Plan> roots = new ArrayList<>();
    List<Selection> run = new ArrayList<>();
    String runOwner = null;
    for (Selection<?> selection : flattened.getSelections()) {
      Field field = (Field) selection;
      if (FederationNames.TYPENAME.equals(field.getName())) {
        continue;
      }
      String owner = requireField(rootType, field).owner();
      if (runOwner != null && !runOwner.equals(owner)) {
        roots.add(servicePlan(rootType, run, runOwner));
        run = new ArrayList<>();
      }
      runOwner = owner;
      run.add(field);
    }
    if (!run.isEmpty()) {
      roots.add(servicePlan(rootType, run, runOwner));
    }
    return roots;
  }

  private Plan servicePlan(FederatedType type, List<Selection> fields, String owner) {
    Branch branch = planObject(type, new SelectionSet(fields), owner);
    return new Plan(owner, type.getName(), branch.selectionSet(), List.of(), branch.after());
  }

  private static FieldDefinition requireField(FederatedType type, Field field) {
    return type.getField(field.getName())
        .orElseThrow(
            () ->
                new PlanningException(
                    String.format(
                        "unknown field %s on type %s", field.getName(), type.getName())));
  }

  private Branch planComposite(FederatedType type, SelectionSet selectionSet, String service) {
    if (type.getKind().isAbstract()) {
      return planAbstract(type, selectionSet, service);
    }
    return planObject(type, selectionSet, service);
  }

  private Branch planObject(FederatedType type, SelectionSet selectionSet, String service) {
    List<Selection> local = new ArrayList<>();
    List<Plan> after = new ArrayList<>();
    Map<String, List<Selection>> deferred = new TreeMap<>();

    for (Selection<?> selection : selectionSet.getSelections()) {
      Field field = (Field) selection;
      if (FederationNames.TYPENAME.equals(field.getName())) {
        if (service != null) {
          local.add(field);
        }
        continue;
      }
      FieldDefinition definition = requireField(type, field);
      if (service != null
          && (definition.isResolvableBy(service) || definition.owner().equals(service))) {
        local.add(planLocalField(field, definition, service, after));
      } else {
        deferred.computeIfAbsent(definition.owner(), owner -> new ArrayList<>()).add(field);
      }
    }

    if (!deferred.isEmpty()) {
      if (service != null) {
        for (String target : deferred.keySet()) {
          if (!type.canHandOver(service, target)) {
            throw new PlanningException(
                String.format(
                    "missing federation key: type %s cannot be handed over from %s to %s",
                    type.getName(), service, target));
          }
        }
        local.add(new Field(FederationNames.KEY_MARKER));
      }
      for (Map.Entry<String, List<Selection>> entry : deferred.entrySet()) {
        after.add(servicePlan(type, entry.getValue(), entry.getKey()));
      }
    }
    return new Branch(new SelectionSet(local), after);
  }

  private Selection<?> planLocalField(
      Field field, FieldDefinition definition, String service, List<Plan> after) {
    if (field.getSelectionSet() == null) {
      return field;
    }
    FederatedType fieldType = registry.requireType(definition.type().namedType());
    Branch branch = planComposite(fieldType, field.getSelectionSet(), service);
    PathStep step = PathStep.field(field.getResultKey());
    branch.after().forEach(child -> after.add(child.withPathPrefix(step)));
    return field.transform(builder -> builder.selectionSet(branch.selectionSet()));
  }

  private Branch planAbstract(FederatedType type, SelectionSet selectionSet, String service) {
    List<Selection> selections = new ArrayList<>();
    List<Plan> after = new ArrayList<>();
    // Child plans and the response shaper both dispatch on the runtime type.
    selections.add(new Field(FederationNames.TYPENAME));

    for (Selection<?> selection : selectionSet.getSelections()) {
      InlineFragment fragment = (InlineFragment) selection;
      String typeName = fragment.getTypeCondition().getName();
      Branch branch =
          planObject(registry.requireType(typeName), fragment.getSelectionSet(), service);
      PathStep step = PathStep.typeCondition(typeName);
      branch.after().forEach(child -> after.add(child.withPathPrefix(step)));
      selections.add(fragment.transform(builder -> builder.selectionSet(branch.selectionSet())));
    }
    return new Branch(new SelectionSet(selections), after);
  }

  /** Selection set kept by the current plan plus the child plans it spawned. */
  private record Branch(SelectionSet selectionSet, List<Plan> after) {}
}
