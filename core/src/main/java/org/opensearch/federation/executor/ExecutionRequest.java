/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import graphql.language.AstPrinter;
import graphql.language.Document;
import java.util.Map;

/**
 * One sub-request for a backend service.
 *
 * @param service target service
 * @param type type context the selection set is evaluated against
 * @param document the GraphQL document to execute
 * @param variables bound variable values, empty when all values are inlined
 */
public record ExecutionRequest(
    String service, String type, Document document, Map<String, Object> variables) {

  /** Returns the document in GraphQL syntax. */
  public String query() {
    return AstPrinter.printAst(document);
  }
}
