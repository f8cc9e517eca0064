/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import graphql.language.Document;
import graphql.language.OperationDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.exception.QueryCancelledException;
import org.opensearch.federation.planner.PathStep;
import org.opensearch.federation.planner.Plan;
import org.opensearch.federation.planner.QueryPlan;
import org.opensearch.federation.schema.FederationNames;

/**
 * Executes a plan forest against the backend services and merges the sub-results into one tree.
 *
 * <ol>
 *   <li>Every root plan is sent as is; root plans run concurrently (one after the other for
 *       mutations).
 *   <li>When a plan's result arrives, each child plan's path is walked to find its target objects
 *       and their federation keys. The child is sent once with all keys and its result list is
 *       spliced into the targets position by position.
 *   <li>Children of the same parent run concurrently; a child always waits for its parent.
 *   <li>A failed plan records a {@link FederationError} at its path and skips its descendants.
 *       Siblings and the data the parent already returned are unaffected.
 *   <li>Federation key markers are removed from the merged tree before it is returned.
 * </ol>
 *
 * <p>Cancelling the {@link QueryContext} aborts every in-flight sub-request and completes the
 * returned future with a {@link QueryCancelledException}.
 */
@RequiredArgsConstructor
public class PlanExecutor {

  private static final Logger LOG = LogManager.getLogger(PlanExecutor.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final ExecutionClient client;

  /**
   * Executes a query plan forest.
   *
   * @param forest root plans
   * @param context query context governing cancellation
   * @return future of the merged result; fails only when the query is cancelled
   */
  public CompletableFuture<ExecutionResult> execute(List<Plan> forest, QueryContext context) {
    return execute(OperationDefinition.Operation.QUERY, forest, context);
  }

  /** Executes the forest of a planned operation. */
  public CompletableFuture<ExecutionResult> execute(QueryPlan plan, QueryContext context) {
    return execute(plan.operation(), plan.roots(), context);
  }

  private CompletableFuture<ExecutionResult> execute(
      OperationDefinition.Operation operation, List<Plan> forest, QueryContext context) {
    ExecutionState state = new ExecutionState(operation, context);

    CompletableFuture<Void> roots;
    if (operation == OperationDefinition.Operation.MUTATION) {
      roots = CompletableFuture.completedFuture(null);
      for (Plan root : forest) {
        roots = roots.thenCompose(ignored -> executeRoot(root, state));
      }
    } else {
      roots =
          CompletableFuture.allOf(
              forest.stream()
                  .map(root -> executeRoot(root, state))
                  .toArray(CompletableFuture[]::new));
    }

    CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
    context
        .whenCancelled()
        .thenAccept(reason -> result.completeExceptionally(new QueryCancelledException(reason)));
    roots.whenComplete(
        (ignored, error) -> {
          if (context.isCancelled()) {
            result.completeExceptionally(
                new QueryCancelledException(context.getCancelReason()));
          } else if (error != null) {
            result.completeExceptionally(unwrap(error));
          } else {
            synchronized (state.lock) {
              stripMarkers(state.data);
            }
            result.complete(new ExecutionResult(state.data, state.errors()));
          }
        });
    return result;
  }

  private CompletableFuture<Void> executeRoot(Plan root, ExecutionState state) {
    Document document = FederationDocuments.operation(state.operation, root);
    return send(root, document, root.getPathSteps(), state)
        .thenCompose(
            response -> {
              if (response == null) {
                return CompletableFuture.completedFuture(null);
              }
              synchronized (state.lock) {
                splice(state.data, response);
              }
              return executeChildren(root, response, root.getPathSteps(), state);
            });
  }

  private CompletableFuture<Void> executeChildren(
      Plan parent, JsonNode parentResult, List<PathStep> parentPath, ExecutionState state) {
    if (parent.getAfter().isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.allOf(
        parent.getAfter().stream()
            .map(child -> executeChild(child, parentResult, parentPath, state))
            .toArray(CompletableFuture[]::new));
  }

  private CompletableFuture<Void> executeChild(
      Plan child, JsonNode parentResult, List<PathStep> parentPath, ExecutionState state) {
    List<PathStep> path =
        ImmutableList.<PathStep>builder().addAll(parentPath).addAll(child.getPathSteps()).build();

    List<ObjectNode> targets = new ArrayList<>();
    List<JsonNode> keys = new ArrayList<>();
    int missingKeys = 0;
    synchronized (state.lock) {
      for (ObjectNode target : PathWalker.locate(parentResult, child.getPathSteps())) {
        JsonNode key = target.get(FederationNames.KEY_MARKER);
        if (key == null || key.isNull()) {
          missingKeys++;
        } else {
          targets.add(target);
          keys.add(key);
        }
      }
    }
    if (missingKeys > 0) {
      state.addError(
          child,
          path,
          String.format(
              "%d object(s) of type %s were returned without a federation key",
              missingKeys, child.getType()));
    }
    if (targets.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }

    Document document = FederationDocuments.entities(child, keys);
    return send(child, document, path, state)
        .thenCompose(
            response -> {
              if (response == null) {
                return CompletableFuture.completedFuture(null);
              }
              JsonNode entities =
                  response.path(FederationNames.ENTRY_FIELD).path(child.getType());
              if (!entities.isArray() || entities.size() != targets.size()) {
                state.addError(
                    child,
                    path,
                    String.format(
                        "malformed result: expected %d %s objects but got %s",
                        targets.size(),
                        child.getType(),
                        entities.isArray() ? entities.size() : entities.getNodeType()));
                return CompletableFuture.completedFuture(null);
              }
              synchronized (state.lock) {
                for (int i = 0; i < targets.size(); i++) {
                  if (entities.get(i).isObject()) {
                    splice(targets.get(i), (ObjectNode) entities.get(i));
                  }
                }
              }
              return executeChildren(child, entities, path, state);
            });
  }

  /** Sends a plan's request. Completes with null when it failed and the error was recorded. */
  private CompletableFuture<ObjectNode> send(
      Plan plan, Document document, List<PathStep> path, ExecutionState state) {
    if (state.context.isCancelled()) {
      return CompletableFuture.completedFuture(null);
    }
    ExecutionRequest request =
        new ExecutionRequest(plan.getService(), plan.getType(), document, Map.of());
    LOG.debug(
        "Query {} sending {} plan on {} at {}",
        state.context.getQueryId(),
        plan.getService(),
        plan.getType(),
        path);

    CompletableFuture<JsonNode> future;
    try {
      future = state.context.track(client.execute(request));
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future.handle(
        (response, error) -> {
          if (error != null) {
            if (!state.context.isCancelled()) {
              Throwable cause = unwrap(error);
              LOG.warn(
                  "Query {} failed on service {} at {}: {}",
                  state.context.getQueryId(),
                  plan.getService(),
                  path,
                  cause.getMessage());
              state.addError(plan, path, cause.getMessage());
            }
            return null;
          }
          if (response == null || !response.isObject()) {
            state.addError(plan, path, "malformed result: expected an object");
            return null;
          }
          return (ObjectNode) response;
        });
  }

  /** Copies the fields of {@code source} into {@code target}, keeping the target's own key. */
  private static void splice(ObjectNode target, ObjectNode source) {
    Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!FederationNames.KEY_MARKER.equals(field.getKey())) {
        target.set(field.getKey(), field.getValue());
      }
    }
  }

  private static void stripMarkers(JsonNode node) {
    if (node.isObject()) {
      ((ObjectNode) node).remove(FederationNames.KEY_MARKER);
    }
    if (node.isContainerNode()) {
      node.forEach(PlanExecutor::stripMarkers);
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof CancellationException && current.getMessage() == null) {
      return new CancellationException("request was cancelled");
    }
    return current;
  }

  /** Mutable state shared by all plans of one execution. */
  private static final class ExecutionState {
    private final OperationDefinition.Operation operation;
    private final QueryContext context;
    private final ObjectNode data = OBJECT_MAPPER.createObjectNode();
    private final List<FederationError> errors = Collections.synchronizedList(new ArrayList<>());
    private final Object lock = new Object();

    private ExecutionState(OperationDefinition.Operation operation, QueryContext context) {
      this.operation = operation;
      this.context = context;
    }

    private void addError(Plan plan, List<PathStep> path, String message) {
      List<String> responsePath = new ArrayList<>();
      for (PathStep step : path) {
        if (step.kind() == PathStep.Kind.FIELD) {
          responsePath.add(step.name());
        }
      }
      errors.add(new FederationError(message, plan.getService(), List.copyOf(responsePath)));
    }

    private List<FederationError> errors() {
      synchronized (errors) {
        return List.copyOf(errors);
      }
    }
  }
}
