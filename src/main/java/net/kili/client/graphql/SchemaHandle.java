package net.kili.client.graphql;

import graphql.schema.GraphQLSchema;
import java.nio.file.Path;

/**
 * A parsed schema and the cache file it was loaded from or written to. Never mutated; a refresh
 * builds a new handle.
 */
public final class SchemaHandle {
  private final GraphQLSchema schema;
  private final Path cachePath;

  /**
   * @param schema parsed schema
   * @param cachePath cache file of the schema, null when not cached
   */
  public SchemaHandle(GraphQLSchema schema, Path cachePath) {
    if (schema == null) {
      throw new IllegalArgumentException("schema must not be null");
    }
    this.schema = schema;
    this.cachePath = cachePath;
  }

  public GraphQLSchema getSchema() {
    return schema;
  }

  /** @return cache file, null when caching is disabled */
  public Path getCachePath() {
    return cachePath;
  }

  @Override
  public String toString() {
    return "SchemaHandle{cachePath=" + cachePath + "}";
  }
}
