package net.kili.client.core;

import java.time.Duration;

/** Default values and protocol constants shared by the client. */
public final class Constants {
  private Constants() {}

  public static final String CLIENT_VERSION = "1.0.0";

  public static final String DEFAULT_API_ENDPOINT =
      "https://cloud.kili-technology.com/api/label/v2/graphql";

  public static final String GRAPHQL_PATH_SUFFIX = "/graphql";
  public static final String VERSION_PATH_SUFFIX = "/version";

  // HTTP headers
  public static final String HEADER_AUTHORIZATION = "Authorization";
  public static final String HEADER_ACCEPT = "Accept";
  public static final String HEADER_CONTENT_TYPE = "Content-Type";
  public static final String HEADER_CLIENT_NAME = "apollographql-client-name";
  public static final String HEADER_CLIENT_VERSION = "apollographql-client-version";
  public static final String API_KEY_PREFIX = "X-API-Key: ";
  public static final String APPLICATION_JSON = "application/json";

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  // transient retry policy
  public static final int DEFAULT_MAX_ATTEMPTS = 10;
  public static final long DEFAULT_MIN_BACKOFF_IN_MILLIS = 500;
  public static final long DEFAULT_MAX_BACKOFF_IN_MILLIS = 16000;

  // process-wide rate limiter
  public static final int MAX_CALLS_PER_MINUTE = 250;
  public static final Duration RATE_LIMIT_WINDOW = Duration.ofMinutes(1);
  public static final Duration RATE_LIMIT_MAX_DELAY = Duration.ofSeconds(120);

  // schema cache
  public static final String SCHEMA_FILE_EXTENSION = ".graphql";
  public static final String SCHEMA_CACHE_LOCK_NAME = "cache_dir.lck";
  public static final long SCHEMA_CACHE_LOCK_EXPIRATION_IN_SECONDS = 15;

  // subscriptions
  public static final String GRAPHQL_WS_SUBPROTOCOL = "graphql-ws";
  public static final int MAX_RECONNECTIONS = 10;
  public static final long DEFAULT_RECONNECT_BACKOFF_IN_MILLIS = 1000;
  public static final int DEFAULT_DISPATCHER_THREADS = 4;
}
