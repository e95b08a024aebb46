package net.kili.client.graphql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One GraphQL operation as sent on the wire, plus the extra HTTP headers of this call. */
public class GraphQLRequest {
  private final String query;
  private final Map<String, Object> variables;
  private final String operationName;
  private final Map<String, String> headers;

  public GraphQLRequest(String query, Map<String, Object> variables) {
    this(query, variables, null, Collections.emptyMap());
  }

  /**
   * @param query GraphQL document
   * @param variables variable values, may be null
   * @param operationName operation to run when the document holds several, may be null
   * @param headers extra headers of this call
   */
  public GraphQLRequest(
      String query,
      Map<String, Object> variables,
      String operationName,
      Map<String, String> headers) {
    if (query == null) {
      throw new IllegalArgumentException("query must not be null");
    }
    this.query = query;
    this.variables =
        variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    this.operationName = operationName;
    this.headers =
        headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public String getQuery() {
    return query;
  }

  public Map<String, Object> getVariables() {
    return variables;
  }

  public String getOperationName() {
    return operationName;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  /**
   * @param headers headers to add, overriding existing ones
   * @return a copy of this request with the headers merged
   */
  public GraphQLRequest withHeaders(Map<String, String> headers) {
    Map<String, String> merged = new LinkedHashMap<>(this.headers);
    merged.putAll(headers);
    return new GraphQLRequest(query, variables, operationName, merged);
  }

  /**
   * @param mapper mapper used to convert variable values
   * @return the POST body: {@code {"query": ..., "variables": ..., "operationName": ...}}
   */
  public ObjectNode toJson(ObjectMapper mapper) {
    ObjectNode body = mapper.createObjectNode();
    body.put("query", query);
    body.set("variables", mapper.valueToTree(variables));
    if (operationName != null) {
      body.put("operationName", operationName);
    }
    return body;
  }

  @Override
  public String toString() {
    return "GraphQLRequest{operationName=" + operationName + ", query=" + query + "}";
  }
}
