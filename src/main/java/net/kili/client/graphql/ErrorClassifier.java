package net.kili.client.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides how a failed call is recovered from.
 *
 * <p>The structured {@code extensions.code} of the server errors is checked first. When no known
 * code is present, the error messages are matched against known patterns; this is best effort,
 * since messages are not a stable contract. The HTTP status decides last. Anything unrecognized is
 * {@link FailureKind#PERMANENT}.
 */
public final class ErrorClassifier {
  static final Set<String> AUTHENTICATION_CODES =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("UNAUTHENTICATED", "FORBIDDEN")));

  static final Set<String> PERMANENT_CODES =
      Collections.unmodifiableSet(
          new HashSet<>(
              Arrays.asList(
                  "GRAPHQL_PARSE_FAILED", "GRAPHQL_VALIDATION_FAILED", "BAD_USER_INPUT")));

  static final Set<String> TRANSIENT_CODES =
      Collections.unmodifiableSet(
          new HashSet<>(
              Arrays.asList(
                  "OPERATION_RESOLUTION_FAILURE", "SERVICE_UNAVAILABLE", "TOO_MANY_REQUESTS")));

  // the document or its variables are at fault
  private static final List<Pattern> PERMANENT_MESSAGE_PATTERNS =
      Arrays.asList(
          Pattern.compile("Variable \"\\$\\w+\" of required type \"?[\\w\\[\\]!]+\"? was not provided"),
          Pattern.compile("Variable \"\\$\\w+\" got invalid value"),
          Pattern.compile("Cannot query field \"\\w+\""),
          Pattern.compile("Unknown argument \"\\w+\""),
          Pattern.compile("Unknown type \"\\w+\""),
          Pattern.compile("Syntax Error"));

  // an unrelated backend subsystem failed
  private static final List<Pattern> TRANSIENT_MESSAGE_PATTERNS =
      Arrays.asList(
          Pattern.compile("flagsmith", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\[unexpectedRetrieving\\]"),
          Pattern.compile("status code: 50[234]", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\b50[234] (Bad Gateway|Service Unavailable|Gateway Time-?out)"),
          Pattern.compile("timed? ?out", Pattern.CASE_INSENSITIVE),
          Pattern.compile("ECONNRESET|ECONNREFUSED|socket hang up"));

  private ErrorClassifier() {}

  /**
   * @param response response of a failed call
   * @return classification of the failure
   */
  public static FailureKind classify(GraphQLResponse response) {
    return classify(response.getStatusCode(), response.getErrors());
  }

  /**
   * @param httpStatus HTTP status of the response
   * @param errors errors array of the response, may be null
   * @return classification of the failure
   */
  public static FailureKind classify(int httpStatus, JsonNode errors) {
    FailureKind byCode = classifyByCode(errors);
    if (byCode != null) {
      return byCode;
    }
    FailureKind byMessage = classifyByMessage(errors);
    if (byMessage != null) {
      return byMessage;
    }
    return classifyByStatus(httpStatus);
  }

  static FailureKind classifyByCode(JsonNode errors) {
    if (errors == null || !errors.isArray()) {
      return null;
    }
    boolean permanent = false;
    boolean transientFailure = false;
    for (JsonNode error : errors) {
      String code = error.path("extensions").path("code").asText(null);
      if (code == null) {
        continue;
      }
      if (AUTHENTICATION_CODES.contains(code)) {
        return FailureKind.AUTHENTICATION;
      }
      permanent |= PERMANENT_CODES.contains(code);
      transientFailure |= TRANSIENT_CODES.contains(code);
    }
    if (permanent) {
      return FailureKind.PERMANENT;
    }
    return transientFailure ? FailureKind.TRANSIENT : null;
  }

  static FailureKind classifyByMessage(JsonNode errors) {
    if (errors == null || !errors.isArray()) {
      return null;
    }
    boolean transientFailure = false;
    for (JsonNode error : errors) {
      String message = error.path("message").asText("");
      if (matchesAny(PERMANENT_MESSAGE_PATTERNS, message)) {
        return FailureKind.PERMANENT;
      }
      transientFailure |= matchesAny(TRANSIENT_MESSAGE_PATTERNS, message);
    }
    return transientFailure ? FailureKind.TRANSIENT : null;
  }

  static FailureKind classifyByStatus(int httpStatus) {
    switch (httpStatus) {
      case 401:
      case 403:
        return FailureKind.AUTHENTICATION;
      case 429:
      case 500:
      case 502:
      case 503:
      case 504:
        return FailureKind.TRANSIENT;
      default:
        return FailureKind.PERMANENT;
    }
  }

  private static boolean matchesAny(List<Pattern> patterns, String message) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(message).find()) {
        return true;
      }
    }
    return false;
  }
}
