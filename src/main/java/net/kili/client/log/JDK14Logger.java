package net.kili.client.log;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * java.util.logging back end, the default one.
 *
 * <p>Levels map as ERROR to SEVERE, WARN to WARNING, INFO to INFO, DEBUG to FINE and TRACE to
 * FINEST. Records carry the class and method that called the facade.
 */
public class JDK14Logger extends AbstractKiliLogger {
  private final Logger jdkLogger;

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    return jdkLogger.isLoggable(toJdkLevel(level));
  }

  @Override
  protected void write(LogLevel level, String message) {
    StackTraceElement caller = findCaller();
    if (caller == null) {
      jdkLogger.log(toJdkLevel(level), message);
    } else {
      jdkLogger.logp(toJdkLevel(level), caller.getClassName(), caller.getMethodName(), message);
    }
  }

  static Level toJdkLevel(LogLevel level) {
    switch (level) {
      case ERROR:
        return Level.SEVERE;
      case WARN:
        return Level.WARNING;
      case INFO:
        return Level.INFO;
      case DEBUG:
        return Level.FINE;
      case TRACE:
      default:
        return Level.FINEST;
    }
  }

  // first frame below the logger classes
  private static StackTraceElement findCaller() {
    boolean inLogger = false;
    for (StackTraceElement frame : Thread.currentThread().getStackTrace()) {
      boolean loggerFrame = isLoggerClass(frame.getClassName());
      if (loggerFrame) {
        inLogger = true;
      } else if (inLogger) {
        return frame;
      }
    }
    return null;
  }

  private static boolean isLoggerClass(String className) {
    return className.equals(JDK14Logger.class.getName())
        || className.equals(AbstractKiliLogger.class.getName());
  }
}
