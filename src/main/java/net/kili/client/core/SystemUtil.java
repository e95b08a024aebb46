package net.kili.client.core;

import com.google.common.base.Strings;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/** Access to system properties and environment variables that never throws. */
public class SystemUtil {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(SystemUtil.class);

  private SystemUtil() {}

  /**
   * System.getProperty wrapper. If System.getProperty raises a SecurityException, it is ignored
   * and returns null.
   *
   * @param property name of the property
   * @return the property value or null
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      // the logger itself reads a property through here, so log lazily
      if (logger != null) {
        logger.debug("Security exception raised: {}", ex.getMessage());
      }
      return null;
    }
  }

  /**
   * System.getenv wrapper. If System.getenv raises a SecurityException, it is ignored and returns
   * null.
   *
   * @param env name of the environment variable
   * @return the environment variable value or null
   */
  public static String systemGetEnv(String env) {
    try {
      return System.getenv(env);
    } catch (SecurityException ex) {
      logger.debug(
          "Failed to get environment variable {}. Security exception raised: {}",
          env,
          ex.getMessage());
    }
    return null;
  }

  /**
   * Helper function to convert an integer system property or environment variable.
   *
   * @param value raw value, may be null
   * @param defaultValue value used when the raw value is missing or not an integer
   * @return the parsed value or the default
   */
  public static int parseIntOrDefault(String value, int defaultValue) {
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      logger.debug("Failed to parse {} as an integer, using default {}", value, defaultValue);
      return defaultValue;
    }
  }
}
