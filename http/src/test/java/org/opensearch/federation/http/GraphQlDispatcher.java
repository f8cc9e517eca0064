/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.ExecutionInput;
import graphql.GraphQL;
import graphql.schema.idl.RuntimeWiring;
import graphql.schema.idl.SchemaGenerator;
import graphql.schema.idl.SchemaParser;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

/** Answers GraphQL POST requests of a {@code MockWebServer} from an in-process schema. */
class GraphQlDispatcher extends Dispatcher {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final GraphQL graphQL;

  GraphQlDispatcher(String sdl, RuntimeWiring wiring) {
    this.graphQL =
        GraphQL.newGraphQL(
                new SchemaGenerator().makeExecutableSchema(new SchemaParser().parse(sdl), wiring))
            .build();
  }

  @Override
  @SuppressWarnings("unchecked")
  public MockResponse dispatch(RecordedRequest request) {
    try {
      JsonNode body = OBJECT_MAPPER.readTree(request.getBody().readUtf8());
      Map<String, Object> variables =
          body.hasNonNull("variables")
              ? OBJECT_MAPPER.convertValue(body.get("variables"), Map.class)
              : Map.of();
      Map<String, Object> result =
          graphQL
              .execute(
                  ExecutionInput.newExecutionInput()
                      .query(body.get("query").asText())
                      .variables(variables)
                      .build())
              .toSpecification();
      return new MockResponse()
          .setHeader("Content-Type", "application/json")
          .setBody(OBJECT_MAPPER.writeValueAsString(result));
    } catch (IOException e) {
      return new MockResponse().setResponseCode(400).setBody(e.getMessage());
    }
  }
}
