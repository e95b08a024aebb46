package net.kili.client.core;

import com.google.common.base.Strings;

/**
 * Client settings that can be supplied outside of code. Each property is looked up first as the
 * system property {@code kili.<propertyKey>}, then as its environment variable.
 */
public enum ClientProperty {
  API_ENDPOINT("apiEndpoint", "KILI_API_ENDPOINT", String.class),
  API_KEY("apiKey", "KILI_API_KEY", String.class),
  VERIFY("verify", "KILI_VERIFY", Boolean.class),
  SKIP_CHECKS("skipChecks", "KILI_SDK_SKIP_CHECKS", Boolean.class),
  TRIALS_NUMBER("trialsNumber", "KILI_SDK_TRIALS_NUMBER", Integer.class),
  SCHEMA_CACHE_DIR("graphqlSchemaCacheDir", "KILI_GRAPHQL_SCHEMA_CACHE_DIR", String.class);

  private static final String SYSTEM_PROPERTY_PREFIX = "kili.";

  private final String propertyKey;
  private final String environmentVariable;
  private final Class<?> valueType;

  ClientProperty(String propertyKey, String environmentVariable, Class<?> valueType) {
    this.propertyKey = propertyKey;
    this.environmentVariable = environmentVariable;
    this.valueType = valueType;
  }

  public String getPropertyKey() {
    return propertyKey;
  }

  public String getSystemPropertyName() {
    return SYSTEM_PROPERTY_PREFIX + propertyKey;
  }

  public String getEnvironmentVariable() {
    return environmentVariable;
  }

  public Class<?> getValueType() {
    return valueType;
  }

  /**
   * @return the raw configured value, or null when neither the system property nor the
   *     environment variable is set
   */
  public String getValue() {
    String value = SystemUtil.systemGetProperty(getSystemPropertyName());
    if (value == null) {
      value = SystemUtil.systemGetEnv(environmentVariable);
    }
    return value;
  }

  /** @return true when the property is set at all, whatever its value */
  public boolean isSet() {
    return getValue() != null;
  }

  public boolean getBooleanValue(boolean defaultValue) {
    String value = getValue();
    return Strings.isNullOrEmpty(value) ? defaultValue : Boolean.parseBoolean(value.trim());
  }

  public int getIntValue(int defaultValue) {
    return SystemUtil.parseIntOrDefault(getValue(), defaultValue);
  }
}
