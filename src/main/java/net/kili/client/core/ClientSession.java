package net.kili.client.core;

import com.google.common.base.Strings;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.util.SecretDetector;

/**
 * Settings shared by every call a caller makes: endpoint, credentials, client identity, transport
 * and retry configuration. Immutable once built and safe to share across threads.
 *
 * <p>Values not given to the {@link Builder} are read from {@link ClientProperty}, then default to
 * {@link Constants}.
 */
public class ClientSession {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(ClientSession.class);

  private final String endpoint;
  private final String apiKey;
  private final ClientName clientName;
  private final String clientVersion;
  private final boolean verify;
  private final Duration timeout;
  private final boolean schemaCachingEnabled;
  private final Path schemaCacheDir;
  private final boolean skipChecks;
  private final int maxAttempts;
  private final long minBackoffInMillis;
  private final long maxBackoffInMillis;
  private final RateLimiter rateLimiter;
  private final long reconnectBackoffInMillis;
  private final int maxReconnections;
  private final int dispatcherThreads;

  private ClientSession(Builder builder) {
    this.endpoint = builder.endpoint;
    this.apiKey = builder.apiKey;
    this.clientName = builder.clientName;
    this.clientVersion = builder.clientVersion;
    this.verify = builder.verify;
    this.timeout = builder.timeout;
    this.schemaCachingEnabled = builder.schemaCachingEnabled;
    this.schemaCacheDir = builder.schemaCacheDir;
    this.skipChecks = builder.skipChecks;
    this.maxAttempts = builder.maxAttempts;
    this.minBackoffInMillis = builder.minBackoffInMillis;
    this.maxBackoffInMillis = builder.maxBackoffInMillis;
    this.rateLimiter = builder.rateLimiter;
    this.reconnectBackoffInMillis = builder.reconnectBackoffInMillis;
    this.maxReconnections = builder.maxReconnections;
    this.dispatcherThreads = builder.dispatcherThreads;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getEndpoint() {
    return endpoint;
  }

  public String getApiKey() {
    return apiKey;
  }

  /** @return value of the {@code Authorization} header and connection_init payload */
  public String getAuthorization() {
    return Constants.API_KEY_PREFIX + apiKey;
  }

  public ClientName getClientName() {
    return clientName;
  }

  public String getClientVersion() {
    return clientVersion;
  }

  public boolean isVerify() {
    return verify;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public boolean isSchemaCachingEnabled() {
    return schemaCachingEnabled;
  }

  /** @return cache root, null if none was configured */
  public Path getSchemaCacheDir() {
    return schemaCacheDir;
  }

  public boolean isSkipChecks() {
    return skipChecks;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getMinBackoffInMillis() {
    return minBackoffInMillis;
  }

  public long getMaxBackoffInMillis() {
    return maxBackoffInMillis;
  }

  public RateLimiter getRateLimiter() {
    return rateLimiter;
  }

  public long getReconnectBackoffInMillis() {
    return reconnectBackoffInMillis;
  }

  public int getMaxReconnections() {
    return maxReconnections;
  }

  public int getDispatcherThreads() {
    return dispatcherThreads;
  }

  /**
   * WebSocket URL of the endpoint: {@code http} becomes {@code ws} and {@code https} becomes
   * {@code wss}.
   *
   * @return subscription URL
   */
  public String getWebSocketEndpoint() {
    if (endpoint.startsWith("https://")) {
      return "wss://" + endpoint.substring("https://".length());
    }
    if (endpoint.startsWith("http://")) {
      return "ws://" + endpoint.substring("http://".length());
    }
    return endpoint;
  }

  /**
   * Sibling endpoint serving the backend build version, the GraphQL path suffix replaced by
   * {@code /version}.
   *
   * @return version URL
   */
  public String getVersionEndpoint() {
    if (endpoint.endsWith(Constants.GRAPHQL_PATH_SUFFIX)) {
      return endpoint.substring(0, endpoint.length() - Constants.GRAPHQL_PATH_SUFFIX.length())
          + Constants.VERSION_PATH_SUFFIX;
    }
    return endpoint.replace(Constants.GRAPHQL_PATH_SUFFIX, Constants.VERSION_PATH_SUFFIX);
  }

  @Override
  public String toString() {
    return "ClientSession{"
        + "endpoint="
        + endpoint
        + ", apiKey="
        + SecretDetector.maskParameterValue("apiKey", apiKey)
        + ", clientName="
        + clientName.getHeaderValue()
        + ", clientVersion="
        + clientVersion
        + ", verify="
        + verify
        + ", timeout="
        + timeout
        + ", schemaCachingEnabled="
        + schemaCachingEnabled
        + ", schemaCacheDir="
        + schemaCacheDir
        + ", skipChecks="
        + skipChecks
        + ", maxAttempts="
        + maxAttempts
        + "}";
  }

  /**
   * Default schema cache root: {@code $XDG_CACHE_HOME/kili/graphql} when the variable is set,
   * {@code ~/.cache/kili/graphql} otherwise.
   *
   * @return default cache directory
   */
  public static Path getDefaultSchemaCacheDir() {
    String xdgCacheHome = SystemUtil.systemGetEnv("XDG_CACHE_HOME");
    Path cacheHome =
        Strings.isNullOrEmpty(xdgCacheHome)
            ? Paths.get(SystemUtil.systemGetProperty("user.home"), ".cache")
            : Paths.get(xdgCacheHome);
    return cacheHome.resolve("kili").resolve("graphql");
  }

  /** Builder of {@link ClientSession}. */
  public static class Builder {
    private String endpoint;
    private String apiKey;
    private ClientName clientName = ClientName.SDK;
    private String clientVersion = Constants.CLIENT_VERSION;
    private Boolean verifyOverride;
    private boolean verify;
    private Duration timeout = Constants.DEFAULT_TIMEOUT;
    private boolean schemaCachingEnabled = true;
    private boolean schemaCacheDirSet;
    private Path schemaCacheDir;
    private Boolean skipChecksOverride;
    private boolean skipChecks;
    private Integer maxAttemptsOverride;
    private int maxAttempts;
    private long minBackoffInMillis = Constants.DEFAULT_MIN_BACKOFF_IN_MILLIS;
    private long maxBackoffInMillis = Constants.DEFAULT_MAX_BACKOFF_IN_MILLIS;
    private RateLimiter rateLimiter;
    private long reconnectBackoffInMillis = Constants.DEFAULT_RECONNECT_BACKOFF_IN_MILLIS;
    private int maxReconnections = Constants.MAX_RECONNECTIONS;
    private int dispatcherThreads = Constants.DEFAULT_DISPATCHER_THREADS;

    private Builder() {}

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder clientName(ClientName clientName) {
      this.clientName = clientName;
      return this;
    }

    public Builder clientVersion(String clientVersion) {
      this.clientVersion = clientVersion;
      return this;
    }

    public Builder verify(boolean verify) {
      this.verifyOverride = verify;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder schemaCachingEnabled(boolean schemaCachingEnabled) {
      this.schemaCachingEnabled = schemaCachingEnabled;
      return this;
    }

    /**
     * @param schemaCacheDir cache root; null explicitly leaves the session without one, which is
     *     an error when caching is enabled
     * @return this builder
     */
    public Builder schemaCacheDir(Path schemaCacheDir) {
      this.schemaCacheDirSet = true;
      this.schemaCacheDir = schemaCacheDir;
      return this;
    }

    public Builder skipChecks(boolean skipChecks) {
      this.skipChecksOverride = skipChecks;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttemptsOverride = maxAttempts;
      return this;
    }

    public Builder backoff(long minBackoffInMillis, long maxBackoffInMillis) {
      this.minBackoffInMillis = minBackoffInMillis;
      this.maxBackoffInMillis = maxBackoffInMillis;
      return this;
    }

    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    public Builder reconnectBackoffInMillis(long reconnectBackoffInMillis) {
      this.reconnectBackoffInMillis = reconnectBackoffInMillis;
      return this;
    }

    public Builder maxReconnections(int maxReconnections) {
      this.maxReconnections = maxReconnections;
      return this;
    }

    public Builder dispatcherThreads(int dispatcherThreads) {
      this.dispatcherThreads = dispatcherThreads;
      return this;
    }

    /**
     * @return the session
     * @throws KiliException with {@link ErrorCode#INVALID_CONFIGURATION} if no API key is
     *     available or a numeric setting is out of range
     */
    public ClientSession build() throws KiliException {
      if (Strings.isNullOrEmpty(endpoint)) {
        endpoint = ClientProperty.API_ENDPOINT.getValue();
      }
      if (Strings.isNullOrEmpty(endpoint)) {
        endpoint = Constants.DEFAULT_API_ENDPOINT;
      }
      if (Strings.isNullOrEmpty(apiKey)) {
        apiKey = ClientProperty.API_KEY.getValue();
      }
      if (Strings.isNullOrEmpty(apiKey)) {
        throw new KiliException(
            ErrorCode.INVALID_CONFIGURATION,
            "no API key given, set " + ClientProperty.API_KEY.getEnvironmentVariable());
      }
      verify =
          verifyOverride != null ? verifyOverride : ClientProperty.VERIFY.getBooleanValue(true);
      skipChecks =
          skipChecksOverride != null
              ? skipChecksOverride
              : ClientProperty.SKIP_CHECKS.isSet()
                  && ClientProperty.SKIP_CHECKS.getBooleanValue(true);
      maxAttempts =
          maxAttemptsOverride != null
              ? maxAttemptsOverride
              : ClientProperty.TRIALS_NUMBER.getIntValue(Constants.DEFAULT_MAX_ATTEMPTS);
      if (!schemaCacheDirSet) {
        String configured = ClientProperty.SCHEMA_CACHE_DIR.getValue();
        schemaCacheDir =
            Strings.isNullOrEmpty(configured)
                ? getDefaultSchemaCacheDir()
                : Paths.get(configured);
      }
      if (rateLimiter == null) {
        rateLimiter = WindowRateLimiter.getProcessWideInstance();
      }

      if (maxAttempts < 1) {
        throw new KiliException(
            ErrorCode.INVALID_CONFIGURATION, "maxAttempts must be positive: " + maxAttempts);
      }
      if (minBackoffInMillis < 1 || maxBackoffInMillis < minBackoffInMillis) {
        throw new KiliException(
            ErrorCode.INVALID_CONFIGURATION,
            "backoff bounds must satisfy 1 <= min <= max, got "
                + minBackoffInMillis
                + " and "
                + maxBackoffInMillis);
      }
      if (dispatcherThreads < 1) {
        throw new KiliException(
            ErrorCode.INVALID_CONFIGURATION,
            "dispatcherThreads must be positive: " + dispatcherThreads);
      }

      ClientSession session = new ClientSession(this);
      logger.debug("Created {}", session);
      return session;
    }
  }
}
