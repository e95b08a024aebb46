package net.kili.client.log;

/**
 * An interface for representing lambda expressions that supply values to placeholders in message
 * formats.
 *
 * <p>E.g., {@code logger.debug("Schema: {}", (ArgSupplier) () -> printSchema(schema));}
 */
@FunctionalInterface
public interface ArgSupplier {
  /**
   * Get value
   *
   * @return Object value.
   */
  Object get();
}
