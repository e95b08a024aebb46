package net.kili.client.graphql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kili.client.core.ObjectMapperFactory;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * HTTP status and decoded body of a GraphQL call. A body that is not a JSON object leaves both
 * {@link #getData()} and {@link #getErrors()} null; the raw text stays available for error
 * messages.
 */
public class GraphQLResponse {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(GraphQLResponse.class);

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final int statusCode;
  private final JsonNode data;
  private final JsonNode errors;
  private final String body;

  public GraphQLResponse(int statusCode, JsonNode data, JsonNode errors, String body) {
    this.statusCode = statusCode;
    this.data = data;
    this.errors = errors;
    this.body = body;
  }

  /**
   * @param statusCode HTTP status
   * @param body response body, may be null
   * @return decoded response
   */
  public static GraphQLResponse fromJson(int statusCode, String body) {
    if (body == null || body.isEmpty()) {
      return new GraphQLResponse(statusCode, null, null, body);
    }
    try {
      JsonNode root = mapper.readTree(body);
      if (root == null || !root.isObject()) {
        return new GraphQLResponse(statusCode, null, null, body);
      }
      JsonNode data = root.get("data");
      JsonNode errors = root.get("errors");
      return new GraphQLResponse(
          statusCode,
          data == null || data.isNull() ? null : data,
          errors == null || errors.isNull() ? null : errors,
          body);
    } catch (JsonProcessingException ex) {
      logger.debug("Response body is not JSON, HTTP status {}", statusCode);
      return new GraphQLResponse(statusCode, null, null, body);
    }
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** @return the {@code data} member, null if absent */
  public JsonNode getData() {
    return data;
  }

  /** @return the {@code errors} array, null if absent */
  public JsonNode getErrors() {
    return errors;
  }

  public String getBody() {
    return body;
  }

  public boolean hasErrors() {
    return errors != null && errors.size() > 0;
  }

  /** @return true for a 2xx response without GraphQL errors */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300 && !hasErrors();
  }
}
