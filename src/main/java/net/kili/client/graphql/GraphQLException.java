package net.kili.client.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;

/** A GraphQL call failed. Carries its classification and the server's {@code errors}, if any. */
public class GraphQLException extends KiliException {
  private static final long serialVersionUID = 1L;

  private final FailureKind failureKind;
  private final transient JsonNode errors;
  private final int httpStatus;

  /**
   * @param failureKind classification of the failure
   * @param errors errors array returned by the server, may be null
   * @param httpStatus HTTP status, 0 when no response was received
   * @param reason human readable reason
   */
  public GraphQLException(FailureKind failureKind, JsonNode errors, int httpStatus, String reason) {
    this(null, failureKind, errors, httpStatus, reason);
  }

  /**
   * @param cause original cause, may be null
   * @param failureKind classification of the failure
   * @param errors errors array returned by the server, may be null
   * @param httpStatus HTTP status, 0 when no response was received
   * @param reason human readable reason
   */
  public GraphQLException(
      Throwable cause, FailureKind failureKind, JsonNode errors, int httpStatus, String reason) {
    super(
        cause,
        failureKind == FailureKind.AUTHENTICATION
            ? ErrorCode.AUTHENTICATION_FAILED
            : ErrorCode.GRAPHQL_ERROR,
        reason);
    this.failureKind = failureKind;
    this.errors = errors;
    this.httpStatus = httpStatus;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  /** @return the server's errors array, null for local or network failures */
  public JsonNode getErrors() {
    return errors;
  }

  public int getHttpStatus() {
    return httpStatus;
  }
}
