package net.kili.client.log;

/** Levels of {@link KiliLogger}, most severe first. */
public enum LogLevel {
  ERROR,
  WARN,
  INFO,
  DEBUG,
  TRACE
}
