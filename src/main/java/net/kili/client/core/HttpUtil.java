package net.kili.client.core;

import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.ssl.SSLContexts;
import org.apache.http.ssl.SSLInitializationException;

/** HttpUtil class: builds and caches the pooled HTTP clients used for GraphQL calls. */
public class HttpUtil {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(HttpUtil.class);

  static final int DEFAULT_MAX_CONNECTIONS = 300;
  static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 300;
  private static final int DEFAULT_TTL = 60; // secs

  public static final String MAX_CONNECTIONS_PROPERTY = "net.kili.client.max_connections";
  public static final String MAX_CONNECTIONS_PER_ROUTE_PROPERTY =
      "net.kili.client.max_connections_per_route";

  /** The unique httpClient shared by all sessions with the same settings. */
  private static final Map<String, CloseableHttpClient> httpClients = new ConcurrentHashMap<>();

  private static final Map<String, PoolingHttpClientConnectionManager> connectionManagers =
      new ConcurrentHashMap<>();

  private HttpUtil() {}

  /**
   * Accessor for the HTTP client singleton matching the given settings.
   *
   * @param verify whether server certificates and host names are checked
   * @param timeout connect, connection request and socket timeout
   * @return HttpClient object shared across all sessions with the same settings
   */
  public static CloseableHttpClient getHttpClient(boolean verify, Duration timeout) {
    String key = settingsKey(verify, timeout);
    return httpClients.computeIfAbsent(key, k -> buildHttpClient(k, verify, timeout));
  }

  /**
   * Build an Http client using our set of defaults.
   *
   * @param key cache key of the client
   * @param verify whether server certificates and host names are checked
   * @param timeout connect, connection request and socket timeout
   * @return HttpClient object
   */
  static CloseableHttpClient buildHttpClient(String key, boolean verify, Duration timeout) {
    long timeoutMillis = timeout.toMillis();
    logger.debug(
        "Building http client with verify: {}, timeout: {} ms, ttl: {} s",
        verify,
        timeoutMillis,
        DEFAULT_TTL);

    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout((int) timeoutMillis)
            .setConnectionRequestTimeout((int) timeoutMillis)
            .setSocketTimeout((int) timeoutMillis)
            .build();

    SSLConnectionSocketFactory sslSocketFactory =
        verify
            ? SSLConnectionSocketFactory.getSocketFactory()
            : new SSLConnectionSocketFactory(getSslContext(false), NoopHostnameVerifier.INSTANCE);
    if (!verify) {
      logger.warn("TLS verification is disabled, server certificates will not be checked", false);
    }

    Registry<ConnectionSocketFactory> registry =
        RegistryBuilder.<ConnectionSocketFactory>create()
            .register("https", sslSocketFactory)
            .register("http", PlainConnectionSocketFactory.getSocketFactory())
            .build();

    // Build a connection manager with enough connections
    PoolingHttpClientConnectionManager connectionManager =
        new PoolingHttpClientConnectionManager(
            registry, null, null, null, DEFAULT_TTL, TimeUnit.SECONDS);
    int maxConnections =
        SystemUtil.parseIntOrDefault(
            SystemUtil.systemGetProperty(MAX_CONNECTIONS_PROPERTY), DEFAULT_MAX_CONNECTIONS);
    int maxConnectionsPerRoute =
        SystemUtil.parseIntOrDefault(
            SystemUtil.systemGetProperty(MAX_CONNECTIONS_PER_ROUTE_PROPERTY),
            DEFAULT_MAX_CONNECTIONS_PER_ROUTE);
    logger.debug(
        "Max connections total in connection pooling manager: {}; max connections per route: {}",
        maxConnections,
        maxConnectionsPerRoute);
    connectionManager.setMaxTotal(maxConnections);
    connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
    connectionManagers.put(key, connectionManager);

    return HttpClientBuilder.create()
        .setConnectionManager(connectionManager)
        // Support JVM proxy settings
        .useSystemProperties()
        .setUserAgent("kili-java-client/" + Constants.CLIENT_VERSION)
        .disableCookieManagement()
        .setDefaultRequestConfig(requestConfig)
        .build();
  }

  /**
   * SSL context for connections that do not go through Apache HttpClient, e.g. the subscription
   * WebSocket.
   *
   * @param verify false to trust every server certificate
   * @return the default context when verifying, a trust-all context otherwise
   */
  public static SSLContext getSslContext(boolean verify) {
    try {
      if (verify) {
        return SSLContext.getDefault();
      }
      return SSLContexts.custom().loadTrustMaterial(null, TrustAllStrategy.INSTANCE).build();
    } catch (NoSuchAlgorithmException | KeyManagementException | KeyStoreException ex) {
      throw new SSLInitializationException(ex.getMessage(), ex);
    }
  }

  /** Close idle connections of every pooled client. */
  public static void closeExpiredAndIdleConnections() {
    for (PoolingHttpClientConnectionManager connectionManager : connectionManagers.values()) {
      logger.debug("Connection pool stats: {}", connectionManager.getTotalStats());
      connectionManager.closeExpiredConnections();
      connectionManager.closeIdleConnections(0, TimeUnit.MILLISECONDS);
    }
  }

  private static String settingsKey(boolean verify, Duration timeout) {
    return "verify=" + verify + ";timeout=" + timeout.toMillis();
  }
}
