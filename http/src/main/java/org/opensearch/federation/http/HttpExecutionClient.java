/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.NonNull;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.exception.BackendException;
import org.opensearch.federation.executor.ExecutionClient;
import org.opensearch.federation.executor.ExecutionRequest;

/**
 * {@link ExecutionClient} that posts {@code {"query": ..., "variables": ...}} to each service's
 * GraphQL endpoint. A transport failure, a non-2xx status, a non-empty {@code errors} list or a
 * missing {@code data} object fails the request with a {@link BackendException}. Cancelling the
 * returned future cancels the HTTP call.
 */
public class HttpExecutionClient implements ExecutionClient {

  private static final Logger LOG = LogManager.getLogger(HttpExecutionClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final OkHttpClient okHttpClient;

  private final ImmutableMap<String, HttpUrl> endpoints;

  /**
   * Constructor.
   *
   * @param okHttpClient shared OkHttp client
   * @param endpoints GraphQL endpoint URL by service name
   */
  public HttpExecutionClient(
      @NonNull OkHttpClient okHttpClient, @NonNull Map<String, String> endpoints) {
    this.okHttpClient = okHttpClient;
    ImmutableMap.Builder<String, HttpUrl> urls = ImmutableMap.builder();
    endpoints.forEach(
        (service, url) -> {
          HttpUrl parsed = HttpUrl.parse(url);
          Preconditions.checkArgument(
              parsed != null, "Invalid URL %s for service %s", url, service);
          urls.put(service, parsed);
        });
    this.endpoints = urls.build();
  }

  public static HttpExecutionClient fromEndpoints(
      OkHttpClient okHttpClient, List<ServiceEndpoint> services) {
    ImmutableMap.Builder<String, String> endpoints = ImmutableMap.builder();
    services.forEach(service -> endpoints.put(service.getName(), service.getUrl()));
    return new HttpExecutionClient(okHttpClient, endpoints.build());
  }

  @Override
  public CompletableFuture<JsonNode> execute(ExecutionRequest request) {
    String service = request.service();
    HttpUrl url = endpoints.get(service);
    if (url == null) {
      return CompletableFuture.failedFuture(
          new BackendException(service, "unknown service " + service));
    }

    String payload;
    try {
      ObjectNode body = OBJECT_MAPPER.createObjectNode();
      body.put("query", request.query());
      body.set("variables", OBJECT_MAPPER.valueToTree(request.variables()));
      payload = OBJECT_MAPPER.writeValueAsString(body);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new BackendException(service, "cannot encode request: " + e.getMessage(), e));
    }

    Call call =
        okHttpClient.newCall(
            new Request.Builder().url(url).post(RequestBody.create(payload, JSON)).build());
    CompletableFuture<JsonNode> future = new CompletableFuture<>();
    future.whenComplete(
        (result, error) -> {
          if (future.isCancelled()) {
            call.cancel();
          }
        });
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call failed, IOException e) {
            future.completeExceptionally(
                new BackendException(
                    service,
                    String.format("request to %s failed: %s", service, e.getMessage()),
                    e));
          }

          @Override
          public void onResponse(Call completed, Response response) {
            try (response) {
              future.complete(readData(service, response));
            } catch (BackendException e) {
              future.completeExceptionally(e);
            } catch (IOException e) {
              future.completeExceptionally(
                  new BackendException(
                      service,
                      String.format("cannot read response of %s: %s", service, e.getMessage()),
                      e));
            }
          }
        });
    return future;
  }

  private static JsonNode readData(String service, Response response) throws IOException {
    ResponseBody body = response.body();
    String content = body == null ? "" : body.string();
    if (!response.isSuccessful()) {
      LOG.debug("Service {} answered HTTP {}: {}", service, response.code(), content);
      throw new BackendException(
          service, String.format("service %s answered HTTP %d", service, response.code()));
    }

    JsonNode json;
    try {
      json = OBJECT_MAPPER.readTree(content);
    } catch (JsonProcessingException e) {
      throw new BackendException(service, "service " + service + " returned malformed JSON", e);
    }
    JsonNode errors = json == null ? null : json.get("errors");
    if (errors != null && errors.isArray() && errors.size() > 0) {
      List<String> messages = new ArrayList<>();
      errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
      throw new BackendException(service, String.join("; ", messages));
    }
    JsonNode data = json == null ? null : json.get("data");
    if (data == null || !data.isObject()) {
      throw new BackendException(service, "service " + service + " returned no data");
    }
    return data;
  }
}
