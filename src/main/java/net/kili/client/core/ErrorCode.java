package net.kili.client.core;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal client error codes
 *
 * <p>Messages are kept in the {@code error_messages} resource bundle next to this class and keyed
 * by the numeric code.
 */
public enum ErrorCode {
  NETWORK_ERROR(300002),
  GRAPHQL_ERROR(300004),
  AUTHENTICATION_FAILED(300005),
  SCHEMA_CACHE_DIR_REQUIRED(300006),
  SCHEMA_CACHE_WRITE_FAILED(300007),
  SCHEMA_INTROSPECTION_FAILED(300008),
  RATE_LIMIT_TIMEOUT(300009),
  INTERRUPTED(300010),
  SUBSCRIPTION_ERROR(300011),
  CONNECTION_CLOSED(300012),
  INVALID_CONFIGURATION(300013),
  CLIENT_CLOSED(300014),
  SCHEMA_INVALID(300015);

  public static final String errorMessageResource = "net.kili.client.core.error_messages";

  private static final ResourceBundle errorMessages = loadBundle();

  private final int messageCode;

  ErrorCode(int messageCode) {
    this.messageCode = messageCode;
  }

  public int getMessageCode() {
    return messageCode;
  }

  /**
   * @param params values for the message placeholders
   * @return the localized message of this code with its placeholders filled
   */
  public String formatMessage(Object... params) {
    String key = String.valueOf(messageCode);
    if (errorMessages == null || !errorMessages.containsKey(key)) {
      return name() + " (" + messageCode + ")";
    }
    String pattern = errorMessages.getString(key);
    return params == null || params.length == 0 ? pattern : MessageFormat.format(pattern, params);
  }

  private static ResourceBundle loadBundle() {
    try {
      return ResourceBundle.getBundle(errorMessageResource);
    } catch (MissingResourceException ex) {
      return null;
    }
  }

  @Override
  public String toString() {
    return "ErrorCode{name=" + this.name() + ", messageCode=" + this.messageCode + "}";
  }
}
