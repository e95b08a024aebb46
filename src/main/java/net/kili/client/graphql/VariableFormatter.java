package net.kili.client.graphql;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Cleans variable maps before they are sent. */
public final class VariableFormatter {
  /** Fields of the GraphQL JSON scalar type, sent as given. */
  public static final Set<String> OPAQUE_JSON_FIELDS =
      Collections.unmodifiableSet(
          new HashSet<>(
              Arrays.asList(
                  "metadata", "jsonMetadata", "jsonResponse", "jsonSettings", "jsonInterface")));

  private VariableFormatter() {}

  /**
   * Removes every null entry, recursively through nested objects. Values of {@link
   * #OPAQUE_JSON_FIELDS} and lists are kept unchanged. Objects left empty are kept.
   *
   * @param variables variables, may be null
   * @return a new map without null entries
   */
  public static Map<String, Object> removeNullableInputs(Map<String, ?> variables) {
    Map<String, Object> cleaned = new LinkedHashMap<>();
    if (variables == null) {
      return cleaned;
    }
    for (Map.Entry<String, ?> entry : variables.entrySet()) {
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (value instanceof Map && !OPAQUE_JSON_FIELDS.contains(entry.getKey())) {
        cleaned.put(entry.getKey(), removeNullableInputs(asStringKeyedMap((Map<?, ?>) value)));
      } else {
        cleaned.put(entry.getKey(), value);
      }
    }
    return cleaned;
  }

  private static Map<String, Object> asStringKeyedMap(Map<?, ?> map) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      result.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return result;
  }
}
