package net.kili.client.log;

/**
 * Logging facade of the client. Messages use SLF4J style {@code {}} placeholders and every
 * formatted message goes through {@link net.kili.client.util.SecretDetector} before it is written,
 * so API keys passed as arguments never reach a log.
 *
 * <p>Arguments that are costly to render can be given as {@link ArgSupplier} lambdas; they are only
 * evaluated when the level is enabled.
 */
public interface KiliLogger {
  boolean isEnabled(LogLevel level);

  default boolean isDebugEnabled() {
    return isEnabled(LogLevel.DEBUG);
  }

  void error(String format, Object... arguments);

  void warn(String format, Object... arguments);

  void info(String format, Object... arguments);

  void debug(String format, Object... arguments);

  void trace(String format, Object... arguments);

  /**
   * Logs a constant message.
   *
   * @param msg message, written as is
   * @param isMasked whether secrets are masked in the message
   */
  void warn(String msg, boolean isMasked);

  void info(String msg, boolean isMasked);

  void debug(String msg, boolean isMasked);
}
