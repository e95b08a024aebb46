package net.kili.client.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

/** SLF4J back end, selected with {@code -Dnet.kili.client.loggerImpl=slf4j}. */
public class SLF4JLogger extends AbstractKiliLogger {
  // outermost facade class, so that location aware bindings report the caller of the facade
  private static final String FQCN = AbstractKiliLogger.class.getName();

  private final Logger slf4jLogger;

  public SLF4JLogger(String name) {
    this.slf4jLogger = LoggerFactory.getLogger(name);
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    switch (level) {
      case ERROR:
        return slf4jLogger.isErrorEnabled();
      case WARN:
        return slf4jLogger.isWarnEnabled();
      case INFO:
        return slf4jLogger.isInfoEnabled();
      case DEBUG:
        return slf4jLogger.isDebugEnabled();
      case TRACE:
      default:
        return slf4jLogger.isTraceEnabled();
    }
  }

  @Override
  protected void write(LogLevel level, String message) {
    if (slf4jLogger instanceof LocationAwareLogger) {
      ((LocationAwareLogger) slf4jLogger).log(null, FQCN, toLevelInt(level), message, null, null);
      return;
    }
    switch (level) {
      case ERROR:
        slf4jLogger.error(message);
        break;
      case WARN:
        slf4jLogger.warn(message);
        break;
      case INFO:
        slf4jLogger.info(message);
        break;
      case DEBUG:
        slf4jLogger.debug(message);
        break;
      case TRACE:
      default:
        slf4jLogger.trace(message);
    }
  }

  private static int toLevelInt(LogLevel level) {
    switch (level) {
      case ERROR:
        return LocationAwareLogger.ERROR_INT;
      case WARN:
        return LocationAwareLogger.WARN_INT;
      case INFO:
        return LocationAwareLogger.INFO_INT;
      case DEBUG:
        return LocationAwareLogger.DEBUG_INT;
      case TRACE:
      default:
        return LocationAwareLogger.TRACE_INT;
    }
  }
}
