/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.opensearch.federation.executor.FederationError;

/**
 * Response handed to the client: the merged data shaped like the query plus the errors of failed
 * sub-requests.
 */
public record QueryResponse(ObjectNode data, List<FederationError> errors) {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Returns the response in GraphQL wire format, {@code errors} present only when non-empty. */
  public ObjectNode toJson() {
    ObjectNode json = OBJECT_MAPPER.createObjectNode();
    json.set("data", data);
    if (hasErrors()) {
      ArrayNode array = json.putArray("errors");
      for (FederationError error : errors) {
        ObjectNode node = array.addObject();
        node.put("message", error.message());
        ArrayNode path = node.putArray("path");
        error.path().forEach(path::add);
        node.putObject("extensions").put("service", error.service());
      }
    }
    return json;
  }
}
