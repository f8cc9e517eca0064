/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.opensearch.federation.planner.PathStep;
import org.opensearch.federation.schema.FederationNames;

/** Locates the objects a child plan targets inside its parent's result. */
@UtilityClass
public class PathWalker {

  /**
   * Walks {@code steps} from {@code root}. Lists are expanded at every level, nulls are skipped and
   * type condition steps drop objects of another runtime type.
   *
   * @param root parent result, an object or a list of objects
   * @param steps path relative to the parent result
   * @return matched objects in result order
   */
  public static List<ObjectNode> locate(JsonNode root, List<PathStep> steps) {
    List<JsonNode> current = new ArrayList<>();
    expand(root, current);
    for (PathStep step : steps) {
      List<JsonNode> next = new ArrayList<>();
      for (JsonNode node : current) {
        if (!node.isObject()) {
          continue;
        }
        if (step.kind() == PathStep.Kind.FIELD) {
          expand(node.get(step.name()), next);
        } else if (step.name().equals(node.path(FederationNames.TYPENAME).asText(null))) {
          next.add(node);
        }
      }
      current = next;
    }
    List<ObjectNode> targets = new ArrayList<>(current.size());
    for (JsonNode node : current) {
      if (node.isObject()) {
        targets.add((ObjectNode) node);
      }
    }
    return targets;
  }

  private static void expand(JsonNode node, List<JsonNode> into) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return;
    }
    if (node.isArray()) {
      node.forEach(element -> expand(element, into));
    } else {
      into.add(node);
    }
  }
}
