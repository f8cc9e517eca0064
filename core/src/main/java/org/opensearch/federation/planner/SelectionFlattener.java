/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner;

import graphql.language.Field;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.opensearch.federation.exception.PlanningException;
import org.opensearch.federation.schema.FederatedType;
import org.opensearch.federation.schema.FederationNames;
import org.opensearch.federation.schema.FieldDefinition;
import org.opensearch.federation.schema.TypeRegistry;

/**
 * Rewrites a selection set into the canonical shape the planner works on.
 *
 * <ul>
 *   <li>On object types the result holds fields only: inline fragments that apply to the type are
 *       merged into their parent, and fields sharing a response key are merged into one field whose
 *       sub-selections are merged recursively.
 *   <li>On abstract types the result holds one inline fragment per concrete possible type that has
 *       any selection, in type name order. Selections made directly on the abstract type are copied
 *       into every branch.
 * </ul>
 *
 * <p>Fragment spreads must have been inlined by the query front end.
 */
@RequiredArgsConstructor
public class SelectionFlattener {

  private final TypeRegistry registry;

  public SelectionSet flatten(SelectionSet selectionSet, FederatedType type) {
    if (type.getKind().isAbstract()) {
      return flattenAbstract(selectionSet, type);
    }
    return flattenObject(selectionSet, type);
  }

  private SelectionSet flattenAbstract(SelectionSet selectionSet, FederatedType type) {
    List<Selection> branches = new ArrayList<>();
    for (String possibleType : type.getPossibleTypes()) {
      FederatedType concrete = registry.requireType(possibleType);
      Map<String, List<Field>> byKey = new LinkedHashMap<>();
      collect(selectionSet, concrete, byKey);
      if (byKey.isEmpty()) {
        continue;
      }
      branches.add(
          InlineFragment.newInlineFragment()
              .typeCondition(new TypeName(possibleType))
              .selectionSet(mergeFields(byKey, concrete))
              .build());
    }
    return new SelectionSet(branches);
  }

  private SelectionSet flattenObject(SelectionSet selectionSet, FederatedType type) {
    Map<String, List<Field>> byKey = new LinkedHashMap<>();
    collect(selectionSet, type, byKey);
    return mergeFields(byKey, type);
  }

  private void collect(
      SelectionSet selectionSet, FederatedType concrete, Map<String, List<Field>> byKey) {
    for (Selection<?> selection : selectionSet.getSelections()) {
      if (selection instanceof Field) {
        Field field = (Field) selection;
        byKey.computeIfAbsent(field.getResultKey(), key -> new ArrayList<>()).add(field);
      } else if (selection instanceof InlineFragment) {
        InlineFragment fragment = (InlineFragment) selection;
        if (appliesTo(fragment.getTypeCondition(), concrete)) {
          collect(fragment.getSelectionSet(), concrete, byKey);
        }
      } else if (selection instanceof FragmentSpread) {
        throw new PlanningException(
            "fragment spread " + ((FragmentSpread) selection).getName() + " was not inlined");
      } else {
        throw new PlanningException("unsupported selection " + selection);
      }
    }
  }

  private boolean appliesTo(TypeName typeCondition, FederatedType concrete) {
    if (typeCondition == null || typeCondition.getName().equals(concrete.getName())) {
      return true;
    }
    FederatedType conditionType = registry.requireType(typeCondition.getName());
    return conditionType.getKind().isAbstract()
        && conditionType.getPossibleTypes().contains(concrete.getName());
  }

  private SelectionSet mergeFields(Map<String, List<Field>> byKey, FederatedType type) {
    List<Selection> merged = new ArrayList<>();
    for (Map.Entry<String, List<Field>> entry : byKey.entrySet()) {
      List<Field> fields = entry.getValue();
      Field first = fields.get(0);
      if (FederationNames.isReserved(first.getName())) {
        throw new PlanningException(
            String.format("field %s on type %s is reserved", first.getName(), type.getName()));
      }
      if (FederationNames.isReserved(entry.getKey())) {
        throw new PlanningException(
            String.format(
                "response key %s on type %s is reserved", entry.getKey(), type.getName()));
      }
      List<Selection> subSelections = new ArrayList<>();
      for (Field field : fields) {
        if (!field.getName().equals(first.getName())) {
          throw new PlanningException(
              String.format(
                  "response key %s selects both %s and %s on type %s",
                  entry.getKey(), first.getName(), field.getName(), type.getName()));
        }
        if (field.getSelectionSet() != null) {
          subSelections.addAll(field.getSelectionSet().getSelections());
        }
      }

      if (FederationNames.TYPENAME.equals(first.getName())) {
        merged.add(first);
        continue;
      }
      FieldDefinition definition =
          type.getField(first.getName())
              .orElseThrow(
                  () ->
                      new PlanningException(
                          String.format(
                              "unknown field %s on type %s", first.getName(), type.getName())));
      if (subSelections.isEmpty()) {
        merged.add(first);
        continue;
      }
      FederatedType fieldType = registry.requireType(definition.type().namedType());
      if (!fieldType.getKind().isComposite()) {
        throw new PlanningException(
            String.format(
                "field %s on type %s returns %s and cannot have a selection set",
                first.getName(), type.getName(), fieldType.getName()));
      }
      SelectionSet flattened = flatten(new SelectionSet(subSelections), fieldType);
      merged.add(first.transform(builder -> builder.selectionSet(flattened)));
    }
    return new SelectionSet(merged);
  }
}
