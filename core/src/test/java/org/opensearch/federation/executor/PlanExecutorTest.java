/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.opensearch.federation.SchemaFixtures.selectionSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.language.ArrayValue;
import graphql.language.Field;
import graphql.language.IntValue;
import graphql.language.OperationDefinition;
import graphql.language.StringValue;
import graphql.language.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.federation.exception.BackendException;
import org.opensearch.federation.exception.QueryCancelledException;
import org.opensearch.federation.planner.PathStep;
import org.opensearch.federation.planner.Plan;
import org.opensearch.federation.planner.QueryPlan;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanExecutorTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private ExecutionClient client;

  private final Map<String, CompletableFuture<JsonNode>> responses = new HashMap<>();

  private final List<ExecutionRequest> requests = new ArrayList<>();

  private PlanExecutor executor;

  @BeforeEach
  void setUp() {
    executor = new PlanExecutor(client);
    when(client.execute(any()))
        .thenAnswer(
            invocation -> {
              ExecutionRequest request = invocation.getArgument(0);
              requests.add(request);
              return responses.get(request.service());
            });
  }

  @Test
  void should_merge_cross_service_field_and_strip_key_marker() throws Exception {
    respond("s1", "{\"a\": {\"localField\": \"local\", \"_federationKey\": \"k1\"}}");
    respond("s2", "{\"_federation\": {\"A\": [{\"crossServiceField\": \"remote\"}]}}");
    Plan root =
        plan(
            "s1",
            "Query",
            "{ a { localField _federationKey } }",
            List.of(plan("s2", "A", "{ crossServiceField }", List.of(), PathStep.field("a"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(
        json("{\"a\": {\"localField\": \"local\", \"crossServiceField\": \"remote\"}}"),
        result.data());
    assertTrue(result.errors().isEmpty());
    assertEquals(2, requests.size());
    assertEquals(List.of("k1"), keysOf(requests.get(1)));
  }

  @Test
  void should_send_one_batched_request_for_all_matched_instances() throws Exception {
    respond(
        "s1",
        "{\"as\": [{\"_federationKey\": 1}, null, {\"_federationKey\": 2}],"
            + " \"b\": {\"as\": []}}");
    respond("s2", "{\"_federation\": {\"A\": [{\"x\": \"one\"}, {\"x\": \"two\"}]}}");
    Plan root =
        plan(
            "s1",
            "Query",
            "{ as { _federationKey } b { as { _federationKey } } }",
            List.of(
                plan("s2", "A", "{ x }", List.of(), PathStep.field("as")),
                plan("s2", "A", "{ x }", List.of(), PathStep.field("b"), PathStep.field("as"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(
        json("{\"as\": [{\"x\": \"one\"}, null, {\"x\": \"two\"}], \"b\": {\"as\": []}}"),
        result.data());
    // No instance under b.as, so no request for the second child.
    verify(client, times(2)).execute(any());
    assertEquals(List.of(1, 2), keysOf(requests.get(1)));
  }

  @Test
  void should_isolate_failed_child_from_siblings_and_parent() throws Exception {
    respond("s1", "{\"a\": {\"id\": 5, \"_federationKey\": \"k\"}}");
    respond("s2", "{\"_federation\": {\"A\": [{\"fromS2\": true}]}}");
    fail("s3", new BackendException("s3", "boom"));
    Plan root =
        plan(
            "s1",
            "Query",
            "{ a { id _federationKey } }",
            List.of(
                plan("s2", "A", "{ fromS2 }", List.of(), PathStep.field("a")),
                plan(
                    "s3",
                    "A",
                    "{ fromS3 { deep } }",
                    List.of(plan("s4", "B", "{ deeper }", List.of(), PathStep.field("fromS3"))),
                    PathStep.field("a"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(json("{\"a\": {\"id\": 5, \"fromS2\": true}}"), result.data());
    assertEquals(List.of(new FederationError("boom", "s3", List.of("a"))), result.errors());
    assertEquals(3, requests.size());
  }

  @Test
  void should_keep_other_roots_when_one_root_fails() throws Exception {
    fail("s1", new BackendException("s1", "down"));
    respond("s2", "{\"y\": 2}");
    List<Plan> forest =
        List.of(
            plan(
                "s1",
                "Query",
                "{ x { _federationKey } }",
                List.of(plan("s3", "X", "{ z }", List.of(), PathStep.field("x")))),
            plan("s2", "Query", "{ y }", List.of()));

    ExecutionResult result = run(forest);

    assertEquals(json("{\"y\": 2}"), result.data());
    assertEquals(List.of(new FederationError("down", "s1", List.of())), result.errors());
    assertEquals(2, requests.size());
  }

  @Test
  void should_report_result_not_aligned_with_keys() throws Exception {
    respond("s1", "{\"a\": [{\"_federationKey\": 1}, {\"_federationKey\": 2}]}");
    respond("s2", "{\"_federation\": {\"A\": [{\"x\": 1}]}}");
    Plan root =
        plan(
            "s1",
            "Query",
            "{ a { _federationKey } }",
            List.of(plan("s2", "A", "{ x }", List.of(), PathStep.field("a"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(json("{\"a\": [{}, {}]}"), result.data());
    assertEquals(1, result.errors().size());
    assertEquals(
        "malformed result: expected 2 A objects but got 1", result.errors().get(0).message());
  }

  @Test
  void should_report_instances_without_key() throws Exception {
    respond("s1", "{\"a\": [{\"_federationKey\": null}]}");
    Plan root =
        plan(
            "s1",
            "Query",
            "{ a { _federationKey } }",
            List.of(plan("s2", "A", "{ x }", List.of(), PathStep.field("a"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(
        List.of(
            new FederationError(
                "1 object(s) of type A were returned without a federation key",
                "s2",
                List.of("a"))),
        result.errors());
    assertEquals(1, requests.size());
  }

  @Test
  void should_skip_type_condition_branch_without_matching_instances() throws Exception {
    respond("s1", "{\"pets\": [{\"__typename\": \"Cat\", \"meow\": \"m\"}]}");
    Plan root =
        plan(
            "s1",
            "Query",
            "{ pets { __typename ... on Cat { meow } ... on Dog { _federationKey } } }",
            List.of(
                plan(
                    "s2",
                    "Dog",
                    "{ bark }",
                    List.of(),
                    PathStep.field("pets"),
                    PathStep.typeCondition("Dog"))));

    ExecutionResult result = run(List.of(root));

    assertEquals(json("{\"pets\": [{\"__typename\": \"Cat\", \"meow\": \"m\"}]}"), result.data());
    assertTrue(result.errors().isEmpty());
    verify(client, times(1)).execute(any());
  }

  @Test
  void should_run_mutation_roots_one_after_another() throws Exception {
    CompletableFuture<JsonNode> first = new CompletableFuture<>();
    responses.put("a", first);
    respond("b", "{\"incB\": 2}");
    QueryPlan plan =
        new QueryPlan(
            OperationDefinition.Operation.MUTATION,
            "Mutation",
            selectionSet("{ incA incB }"),
            List.of(
                plan("a", "Mutation", "{ incA }", List.of()),
                plan("b", "Mutation", "{ incB }", List.of())));

    CompletableFuture<ExecutionResult> result = executor.execute(plan, new QueryContext());

    assertEquals(1, requests.size());
    assertTrue(requests.get(0).query().startsWith("mutation"));
    first.complete(json("{\"incA\": 1}"));
    assertEquals(json("{\"incA\": 1, \"incB\": 2}"), result.get(1, TimeUnit.SECONDS).data());
    assertEquals(2, requests.size());
  }

  @Test
  void should_abort_in_flight_requests_on_cancel() {
    CompletableFuture<JsonNode> pending = new CompletableFuture<>();
    responses.put("s1", pending);
    QueryContext context = new QueryContext("q1");

    CompletableFuture<ExecutionResult> result =
        executor.execute(List.of(plan("s1", "Query", "{ x }", List.of())), context);
    assertEquals(1, context.inFlightCount());
    context.cancel();

    assertTrue(pending.isCancelled());
    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
    assertInstanceOf(QueryCancelledException.class, exception.getCause());
    assertEquals("query was cancelled", exception.getCause().getMessage());
  }

  @Test
  void should_pass_request_metadata_to_client() throws Exception {
    respond("s1", "{\"x\": 1}");

    run(List.of(plan("s1", "Query", "{ x }", List.of())));

    ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
    verify(client).execute(captor.capture());
    assertEquals("s1", captor.getValue().service());
    assertEquals("Query", captor.getValue().type());
    assertTrue(captor.getValue().variables().isEmpty());
  }

  /** Reads the keys argument of a keyed request. */
  private static List<Object> keysOf(ExecutionRequest request) {
    OperationDefinition operation =
        request.document().getDefinitionsOfType(OperationDefinition.class).get(0);
    Field entry = (Field) operation.getSelectionSet().getSelections().get(0);
    Field lookup = (Field) entry.getSelectionSet().getSelections().get(0);
    List<Object> keys = new ArrayList<>();
    for (Value<?> value : ((ArrayValue) lookup.getArgument("keys").getValue()).getValues()) {
      keys.add(
          value instanceof IntValue
              ? ((IntValue) value).getValue().intValue()
              : ((StringValue) value).getValue());
    }
    return keys;
  }

  private ExecutionResult run(List<Plan> forest) throws Exception {
    return executor.execute(forest, new QueryContext()).get(1, TimeUnit.SECONDS);
  }

  private void respond(String service, String data) throws JsonProcessingException {
    responses.put(service, CompletableFuture.completedFuture(objectMapper.readTree(data)));
  }

  private void fail(String service, Exception error) {
    responses.put(service, CompletableFuture.failedFuture(error));
  }

  private JsonNode json(String json) throws JsonProcessingException {
    return objectMapper.readTree(json);
  }

  private static Plan plan(
      String service, String type, String selectionSet, List<Plan> after, PathStep... path) {
    return new Plan(service, type, selectionSet(selectionSet), List.of(path), after);
  }
}
