package net.kili.client.log;

import static net.kili.client.core.SystemUtil.systemGetProperty;

import com.google.common.annotations.VisibleForTesting;
import java.util.function.Function;

/**
 * Creates {@link KiliLogger} instances. The back end is read once from the {@value
 * #LOGGER_IMPL_PROPERTY} system property, either a short name ({@code jdk14}, {@code slf4j}) or the
 * back end class name; java.util.logging is used when it is unset or unknown.
 */
public class KiliLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.kili.client.loggerImpl";

  private static volatile LoggerImpl loggerImplementation;

  enum LoggerImpl {
    JDK14("jdk14", JDK14Logger.class, JDK14Logger::new),
    SLF4J("slf4j", SLF4JLogger.class, SLF4JLogger::new);

    private final String shortName;
    private final Class<? extends KiliLogger> loggerClass;
    private final Function<String, KiliLogger> constructor;

    LoggerImpl(
        String shortName,
        Class<? extends KiliLogger> loggerClass,
        Function<String, KiliLogger> constructor) {
      this.shortName = shortName;
      this.loggerClass = loggerClass;
      this.constructor = constructor;
    }

    static LoggerImpl fromString(String value) {
      if (value == null) {
        return null;
      }
      String trimmed = value.trim();
      for (LoggerImpl impl : values()) {
        if (trimmed.equalsIgnoreCase(impl.shortName)
            || trimmed.equalsIgnoreCase(impl.loggerClass.getName())) {
          return impl;
        }
      }
      return null;
    }
  }

  private KiliLoggerFactory() {}

  public static KiliLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  public static KiliLogger getLogger(String name) {
    LoggerImpl impl = loggerImplementation;
    if (impl == null) {
      impl = LoggerImpl.fromString(systemGetProperty(LOGGER_IMPL_PROPERTY));
      if (impl == null) {
        impl = LoggerImpl.JDK14;
      }
      loggerImplementation = impl;
    }
    return impl.constructor.apply(name);
  }

  /** Forgets the selected back end, the next logger reads the system property again. */
  @VisibleForTesting
  static void reset() {
    loggerImplementation = null;
  }
}
