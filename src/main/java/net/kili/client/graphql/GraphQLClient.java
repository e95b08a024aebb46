package net.kili.client.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.GraphQLError;
import graphql.schema.GraphQLSchema;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import net.kili.client.core.ClientSession;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.core.ObjectMapperFactory;
import net.kili.client.core.RateLimiter;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.util.DecorrelatedJitterBackoff;
import net.kili.client.util.Stopwatch;

/**
 * Executes GraphQL queries and mutations over HTTP.
 *
 * <p>When a schema is loaded, documents are validated locally before any network I/O. A document
 * rejected by the local schema triggers one fresh introspection: if the fresh schema accepts it,
 * the cache is replaced and the call retried once, otherwise the failure is permanent. Every
 * network attempt takes a slot from the {@link RateLimiter}. Transient failures are retried with a
 * decorrelated jitter backoff until the session runs out of attempts.
 *
 * <p>Instances are thread safe.
 */
public class GraphQLClient {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(GraphQLClient.class);

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final ClientSession session;
  private final GraphQLTransport transport;
  private final RateLimiter rateLimiter;
  private final SchemaCache schemaCache;
  private final DecorrelatedJitterBackoff backoff;

  private final AtomicReference<SchemaHandle> schemaHandle = new AtomicReference<>();
  private final Object refreshLock = new Object();

  public GraphQLClient(ClientSession session) throws KiliException {
    this(session, new HttpGraphQLTransport(session));
  }

  /**
   * Creates the client and acquires its schema: from the cache when possible, by introspection
   * otherwise.
   *
   * @param session session settings
   * @param transport wire access to the endpoint
   * @throws KiliException with {@link ErrorCode#SCHEMA_CACHE_DIR_REQUIRED} if caching is enabled
   *     without a cache directory, or if the schema cannot be fetched or cached
   */
  public GraphQLClient(ClientSession session, GraphQLTransport transport) throws KiliException {
    this.session = session;
    this.transport = transport;
    this.rateLimiter = session.getRateLimiter();
    this.backoff =
        new DecorrelatedJitterBackoff(
            session.getMinBackoffInMillis(), session.getMaxBackoffInMillis());

    if (session.isSkipChecks()) {
      logger.debug("Skipping schema acquisition, queries are validated by the server only", false);
      this.schemaCache = null;
    } else if (!session.isSchemaCachingEnabled()) {
      logger.debug("Schema caching is disabled, queries are validated by the server only", false);
      this.schemaCache = null;
    } else {
      if (session.getSchemaCacheDir() == null) {
        throw new KiliException(ErrorCode.SCHEMA_CACHE_DIR_REQUIRED);
      }
      this.schemaCache = new SchemaCache(session.getSchemaCacheDir());
      schemaHandle.set(loadSchema());
    }
  }

  private SchemaHandle loadSchema() throws KiliException {
    String version = transport.fetchBackendVersion();
    if (version == null) {
      logger.info(
          "Could not read the backend version of {}, schema caching is disabled",
          session.getEndpoint());
      return null;
    }

    final Path cachePath = schemaCache.pathFor(session.getEndpoint(), version);
    return schemaCache.withLock(
        () -> {
          String cached = schemaCache.read(cachePath);
          if (cached != null) {
            try {
              GraphQLSchema schema = SchemaLoader.parseSchema(cached);
              logger.debug("Loaded GraphQL schema from cache file {}", cachePath);
              return new SchemaHandle(schema, cachePath);
            } catch (KiliException ex) {
              logger.warn(
                  "Cached schema {} is unreadable, fetching it again: {}",
                  cachePath,
                  ex.getMessage());
            }
          }
          // older versions of this host
          schemaCache.purgeHost(session.getEndpoint(), null);
          String sdl = SchemaLoader.introspect(transport, CallContext.create().toHeaders());
          GraphQLSchema schema = SchemaLoader.parseSchema(sdl);
          schemaCache.write(cachePath, sdl);
          logger.debug("Cached GraphQL schema in {}", cachePath);
          return new SchemaHandle(schema, cachePath);
        });
  }

  public ClientSession getSession() {
    return session;
  }

  /** @return the schema used for local validation, null when validation is remote only */
  public SchemaHandle getSchemaHandle() {
    return schemaHandle.get();
  }

  /**
   * Executes a query or mutation.
   *
   * @param query GraphQL document
   * @param variables variable values, null entries are removed before sending
   * @return the {@code data} member of the response
   * @throws GraphQLException if the call failed
   * @throws KiliException if the rate limiter or a schema refresh failed
   */
  public JsonNode execute(String query, Map<String, ?> variables) throws KiliException {
    return execute(query, variables, CallContext.create());
  }

  /**
   * Executes a query or mutation.
   *
   * @param query GraphQL document
   * @param variables variable values, null entries are removed before sending
   * @param callContext tracing headers of this call
   * @return the {@code data} member of the response
   * @throws GraphQLException if the call failed
   * @throws KiliException if the rate limiter or a schema refresh failed
   */
  public JsonNode execute(String query, Map<String, ?> variables, CallContext callContext)
      throws KiliException {
    GraphQLRequest request =
        new GraphQLRequest(
            query,
            VariableFormatter.removeNullableInputs(variables),
            null,
            callContext.toHeaders());

    Stopwatch stopwatch = Stopwatch.createStarted();
    SchemaHandle handle = schemaHandle.get();
    try {
      return executeWithRetry(request, handle);
    } catch (GraphQLException ex) {
      if (ex.getFailureKind() != FailureKind.LOCAL_VALIDATION) {
        throw ex;
      }
      logger.debug("Local schema rejected the query, checking it against a fresh schema", false);
      SchemaHandle refreshed = refreshAfterValidationFailure(handle, request);
      // second failure is surfaced as is
      return executeWithRetry(request, refreshed);
    } finally {
      stopwatch.stop();
      logger.debug("GraphQL call {} took {} ms", callContext.getCallId(), stopwatch.elapsedMillis());
    }
  }

  /**
   * Introspects the endpoint again and replaces the schema and its cache file. Does nothing when
   * validation is remote only.
   *
   * @return the new schema handle, null when validation is remote only
   * @throws KiliException if the schema cannot be fetched or cached
   */
  public SchemaHandle refreshSchema() throws KiliException {
    synchronized (refreshLock) {
      SchemaHandle current = schemaHandle.get();
      if (current == null) {
        logger.debug("No local schema to refresh", false);
        return null;
      }
      String sdl = SchemaLoader.introspect(transport, CallContext.create().toHeaders());
      return replaceSchema(current, sdl, SchemaLoader.parseSchema(sdl));
    }
  }

  private SchemaHandle refreshAfterValidationFailure(SchemaHandle failedHandle, GraphQLRequest request)
      throws KiliException {
    synchronized (refreshLock) {
      SchemaHandle current = schemaHandle.get();
      if (current != failedHandle) {
        // refreshed by another thread meanwhile
        List<GraphQLError> errors = validate(current, request);
        if (!errors.isEmpty()) {
          throw validationFailure(FailureKind.PERMANENT, errors);
        }
        return current;
      }

      String sdl = SchemaLoader.introspect(transport, request.getHeaders());
      GraphQLSchema freshSchema = SchemaLoader.parseSchema(sdl);
      List<GraphQLError> errors =
          SchemaLoader.validate(freshSchema, request.getQuery(), request.getVariables());
      if (!errors.isEmpty()) {
        logger.debug("Fresh schema rejects the query too, keeping the cached schema", false);
        throw validationFailure(FailureKind.PERMANENT, errors);
      }

      logger.info("Cached GraphQL schema is stale, replacing it", false);
      return replaceSchema(failedHandle, sdl, freshSchema);
    }
  }

  // caller holds refreshLock
  private SchemaHandle replaceSchema(SchemaHandle current, String sdl, GraphQLSchema freshSchema)
      throws KiliException {
    final Path cachePath = current.getCachePath();
    if (schemaCache != null && cachePath != null) {
      schemaCache.withLock(
          () -> {
            schemaCache.purgeAll();
            schemaCache.write(cachePath, sdl);
            return null;
          });
    }
    SchemaHandle refreshed = new SchemaHandle(freshSchema, cachePath);
    schemaHandle.set(refreshed);
    return refreshed;
  }

  private JsonNode executeWithRetry(GraphQLRequest request, SchemaHandle handle)
      throws KiliException {
    if (handle != null) {
      List<GraphQLError> errors = validate(handle, request);
      if (!errors.isEmpty()) {
        throw validationFailure(FailureKind.LOCAL_VALIDATION, errors);
      }
    }

    int maxAttempts = session.getMaxAttempts();
    long sleepTime = backoff.getBase();
    for (int attempt = 1; ; attempt++) {
      rateLimiter.acquire();
      try {
        return send(request);
      } catch (GraphQLException ex) {
        if (!ex.getFailureKind().isRetryable()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          logger.error(
              "GraphQL call failed after {} attempts, giving up: {}", attempt, ex.getMessage());
          throw ex;
        }
        sleepTime = backoff.nextSleepTime(sleepTime);
        logger.warn(
            "Transient failure on attempt {} of {}, retrying in {} ms: {}",
            attempt,
            maxAttempts,
            sleepTime,
            ex.getMessage());
        sleep(sleepTime);
      }
    }
  }

  private JsonNode send(GraphQLRequest request) throws GraphQLException {
    GraphQLResponse response;
    try {
      response = transport.execute(request);
    } catch (IOException ex) {
      throw new GraphQLException(
          ex,
          FailureKind.TRANSIENT,
          null,
          0,
          "network error calling " + transport.getEndpoint() + ": " + ex.getMessage());
    }

    if (response.isSuccess()) {
      if (response.getData() == null) {
        throw new GraphQLException(
            FailureKind.PERMANENT,
            null,
            response.getStatusCode(),
            "response has no data, body: " + response.getBody());
      }
      return response.getData();
    }

    FailureKind kind = ErrorClassifier.classify(response);
    throw new GraphQLException(
        kind, response.getErrors(), response.getStatusCode(), describe(response));
  }

  private static String describe(GraphQLResponse response) {
    if (response.hasErrors()) {
      List<String> messages = new ArrayList<>();
      for (JsonNode error : response.getErrors()) {
        messages.add(error.path("message").asText(error.toString()));
      }
      return String.join("; ", messages);
    }
    return "HTTP " + response.getStatusCode() + ", body: " + response.getBody();
  }

  private static List<GraphQLError> validate(SchemaHandle handle, GraphQLRequest request) {
    return SchemaLoader.validate(handle.getSchema(), request.getQuery(), request.getVariables());
  }

  private static GraphQLException validationFailure(FailureKind kind, List<GraphQLError> errors) {
    String message =
        errors.stream().map(GraphQLError::getMessage).collect(Collectors.joining("; "));
    JsonNode errorsJson =
        mapper.valueToTree(
            errors.stream().map(GraphQLError::toSpecification).collect(Collectors.toList()));
    return new GraphQLException(kind, errorsJson, 0, message);
  }

  private static void sleep(long millis) throws KiliException {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new KiliException(ex, ErrorCode.INTERRUPTED, "waiting to retry a GraphQL call");
    }
  }
}
