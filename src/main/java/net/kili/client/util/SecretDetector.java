package net.kili.client.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Search for credentials in log messages, headers and serialized JSON */
public class SecretDetector {
  // "Authorization: X-API-Key: <key>" header value, or the bare "X-API-Key: <key>" form
  private static final Pattern API_KEY_PATTERN =
      Pattern.compile("(X-API-Key)(\\s*:\\s*)([a-z0-9\\-_.=]{8,})", Pattern.CASE_INSENSITIVE);

  // Used for detecting authorization values in serialized JSON, e.g. the connection_init payload
  private static final Pattern AUTHORIZATION_JSON_PATTERN =
      Pattern.compile(
          "\"(Authorization|apiKey|api_key)\"\\s*:\\s*\"([^\"]{3,})\"", Pattern.CASE_INSENSITIVE);

  private static final Pattern BEARER_TOKEN_PATTERN =
      Pattern.compile("(Bearer)(\\s+)([a-z0-9\\-_.=+/]{8,})", Pattern.CASE_INSENSITIVE);

  private static final Pattern PASSWORD_PATTERN =
      Pattern.compile(
          "(password|passcode|pwd)"
              + "(['\"\\s:=]+)"
              + "([a-z0-9!\"#$%&'()*+,\\-./:;<=>?@\\[\\]^_`{|}~]{6,})",
          Pattern.CASE_INSENSITIVE);

  // only attempt to find secrets in the leading 100Kb of a message
  private static final int MAX_LENGTH = 100 * 1000;

  private static final Set<String> SENSITIVE_NAME_SET =
      new HashSet<>(
          Arrays.asList("authorization", "apikey", "api_key", "x-api-key", "password", "token"));

  private SecretDetector() {}

  /**
   * Check whether the name is sensitive
   *
   * @param name the name
   * @return true if the name is sensitive.
   */
  public static boolean isSensitive(String name) {
    return name != null && SENSITIVE_NAME_SET.contains(name.toLowerCase());
  }

  /**
   * Mask a header or parameter value whose key is sensitive.
   *
   * @param key parameter key
   * @param value parameter value
   * @return the original value if the key is not sensitive, a masked text otherwise
   */
  public static String maskParameterValue(String key, String value) {
    if (isSensitive(key)) {
      return "****";
    }
    return value;
  }

  /**
   * Masks any secrets present in the input string: API keys, authorization values in JSON, bearer
   * tokens and passwords.
   *
   * @param text Text which may contain secrets
   * @return Masked string
   */
  public static String maskSecrets(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    return filterPassword(filterBearerTokens(filterAuthorizationJson(filterApiKeys(text))));
  }

  private static String filterApiKeys(String text) {
    Matcher matcher = API_KEY_PATTERN.matcher(truncate(text));
    if (matcher.find()) {
      return matcher.replaceAll("$1$2****");
    }
    return text;
  }

  private static String filterAuthorizationJson(String text) {
    Matcher matcher = AUTHORIZATION_JSON_PATTERN.matcher(truncate(text));
    if (matcher.find()) {
      return matcher.replaceAll("\"$1\":\"****\"");
    }
    return text;
  }

  private static String filterBearerTokens(String text) {
    Matcher matcher = BEARER_TOKEN_PATTERN.matcher(truncate(text));
    if (matcher.find()) {
      return matcher.replaceAll("$1$2****");
    }
    return text;
  }

  private static String filterPassword(String text) {
    Matcher matcher = PASSWORD_PATTERN.matcher(truncate(text));
    if (matcher.find()) {
      return matcher.replaceAll("$1$2**** ");
    }
    return text;
  }

  private static String truncate(String text) {
    return text.length() <= MAX_LENGTH ? text : text.substring(0, MAX_LENGTH);
  }

  /**
   * Masks, in place, every textual value whose field name is sensitive and every textual value
   * containing a secret.
   *
   * @param node JSON tree, may be null
   * @return the same node
   */
  public static JsonNode maskJsonNode(JsonNode node) {
    if (node instanceof ObjectNode) {
      ObjectNode object = (ObjectNode) node;
      Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        JsonNode value = entry.getValue();
        if (value.isTextual()) {
          entry.setValue(
              isSensitive(entry.getKey())
                  ? new TextNode("****")
                  : new TextNode(maskSecrets(value.asText())));
        } else {
          maskJsonNode(value);
        }
      }
    } else if (node instanceof ArrayNode) {
      ArrayNode array = (ArrayNode) node;
      for (int i = 0; i < array.size(); i++) {
        JsonNode element = array.get(i);
        if (element.isTextual()) {
          array.set(i, new TextNode(maskSecrets(element.asText())));
        } else {
          maskJsonNode(element);
        }
      }
    }
    return node;
  }
}
