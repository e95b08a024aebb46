package net.kili.client.log;

import net.kili.client.util.SecretDetector;
import org.slf4j.helpers.MessageFormatter;

/** Formats, evaluates lazy arguments and masks secrets; back ends only decide and write. */
abstract class AbstractKiliLogger implements KiliLogger {
  /**
   * Writes an already formatted and masked message.
   *
   * @param level enabled level
   * @param message final message
   */
  protected abstract void write(LogLevel level, String message);

  @Override
  public void error(String format, Object... arguments) {
    log(LogLevel.ERROR, format, arguments);
  }

  @Override
  public void warn(String format, Object... arguments) {
    log(LogLevel.WARN, format, arguments);
  }

  @Override
  public void info(String format, Object... arguments) {
    log(LogLevel.INFO, format, arguments);
  }

  @Override
  public void debug(String format, Object... arguments) {
    log(LogLevel.DEBUG, format, arguments);
  }

  @Override
  public void trace(String format, Object... arguments) {
    log(LogLevel.TRACE, format, arguments);
  }

  @Override
  public void warn(String msg, boolean isMasked) {
    logConstant(LogLevel.WARN, msg, isMasked);
  }

  @Override
  public void info(String msg, boolean isMasked) {
    logConstant(LogLevel.INFO, msg, isMasked);
  }

  @Override
  public void debug(String msg, boolean isMasked) {
    logConstant(LogLevel.DEBUG, msg, isMasked);
  }

  private void log(LogLevel level, String format, Object[] arguments) {
    if (isEnabled(level)) {
      String message = MessageFormatter.basicArrayFormat(format, evaluate(arguments));
      write(level, SecretDetector.maskSecrets(message));
    }
  }

  private void logConstant(LogLevel level, String msg, boolean isMasked) {
    if (isEnabled(level)) {
      write(level, isMasked ? SecretDetector.maskSecrets(msg) : msg);
    }
  }

  private static Object[] evaluate(Object[] arguments) {
    Object[] values = new Object[arguments.length];
    for (int i = 0; i < arguments.length; i++) {
      values[i] =
          arguments[i] instanceof ArgSupplier ? ((ArgSupplier) arguments[i]).get() : arguments[i];
    }
    return values;
  }
}
