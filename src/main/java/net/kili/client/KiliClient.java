package net.kili.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import net.kili.client.core.ClientSession;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.graphql.CallContext;
import net.kili.client.graphql.ErrorClassifier;
import net.kili.client.graphql.FailureKind;
import net.kili.client.graphql.GraphQLException;
import net.kili.client.graphql.GraphQLClient;
import net.kili.client.graphql.GraphQLRequest;
import net.kili.client.graphql.GraphQLResponse;
import net.kili.client.graphql.GraphQLTransport;
import net.kili.client.graphql.HttpGraphQLTransport;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.subscription.JdkWebSocketConnector;
import net.kili.client.subscription.Subscription;
import net.kili.client.subscription.SubscriptionCallback;
import net.kili.client.subscription.SubscriptionClient;
import net.kili.client.subscription.WebSocketConnector;

/**
 * Entry point of the client: checks the API key, then gives access to queries, mutations and
 * subscriptions.
 *
 * <pre>{@code
 * ClientSession session = ClientSession.builder().apiKey(apiKey).build();
 * try (KiliClient kili = new KiliClient(session)) {
 *   JsonNode me = kili.execute("query { me { id email } }", null);
 * }
 * }</pre>
 */
public class KiliClient implements Closeable {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(KiliClient.class);

  static final String API_KEY_CHECK_QUERY = "query { me { id email } }";

  private final ClientSession session;
  private final GraphQLClient graphQLClient;
  private final WebSocketConnector webSocketConnector;

  private final Object subscriptionLock = new Object();
  private SubscriptionClient subscriptionClient;

  public KiliClient(ClientSession session) throws KiliException {
    this(
        session,
        new HttpGraphQLTransport(session),
        new JdkWebSocketConnector(session.isVerify(), session.getTimeout()));
  }

  /**
   * @param session session settings
   * @param transport wire access to the GraphQL endpoint
   * @param webSocketConnector opens the subscription connection
   * @throws KiliException with {@link ErrorCode#AUTHENTICATION_FAILED} if the API key is refused,
   *     a {@link GraphQLException} if the check fails for another reason, or if the schema cannot
   *     be acquired
   */
  public KiliClient(
      ClientSession session, GraphQLTransport transport, WebSocketConnector webSocketConnector)
      throws KiliException {
    this.session = session;
    this.webSocketConnector = webSocketConnector;
    if (session.isSkipChecks()) {
      logger.debug("Skipping API key check", false);
    } else {
      checkApiKey(transport);
    }
    this.graphQLClient = new GraphQLClient(session, transport);
  }

  // single attempt, no retry
  private void checkApiKey(GraphQLTransport transport) throws KiliException {
    GraphQLResponse response;
    try {
      response =
          transport.execute(
              new GraphQLRequest(
                  API_KEY_CHECK_QUERY, null, null, CallContext.create("checkApiKey").toHeaders()));
    } catch (IOException ex) {
      throw new KiliException(
          ex, ErrorCode.NETWORK_ERROR, transport.getEndpoint(), ex.getMessage());
    }
    if (!response.isSuccess()) {
      String reason =
          response.hasErrors()
              ? response.getErrors().toString()
              : "HTTP " + response.getStatusCode();
      FailureKind kind = ErrorClassifier.classify(response);
      if (kind == FailureKind.AUTHENTICATION) {
        throw new KiliException(
            ErrorCode.AUTHENTICATION_FAILED,
            "API key refused by " + transport.getEndpoint() + ": " + reason);
      }
      throw new GraphQLException(
          kind,
          response.getErrors(),
          response.getStatusCode(),
          "API key check against " + transport.getEndpoint() + " failed: " + reason);
    }
    JsonNode me = response.getData() == null ? null : response.getData().get("me");
    if (me == null || me.isNull()) {
      throw new KiliException(
          ErrorCode.AUTHENTICATION_FAILED,
          "API key refused by " + transport.getEndpoint() + ": no user returned");
    }
    logger.debug("API key accepted for user {}", me.path("id").asText());
  }

  public ClientSession getSession() {
    return session;
  }

  public GraphQLClient getGraphQLClient() {
    return graphQLClient;
  }

  /**
   * @param query GraphQL query or mutation
   * @param variables variable values, may be null
   * @return the {@code data} member of the response
   * @throws KiliException if the call failed
   * @see GraphQLClient#execute(String, Map)
   */
  public JsonNode execute(String query, Map<String, ?> variables) throws KiliException {
    return graphQLClient.execute(query, variables);
  }

  /**
   * @param query GraphQL subscription
   * @param variables variable values, may be null
   * @param headers headers forwarded in the start payload, may be null
   * @param callback receiver of the frames
   * @return handle of the subscription
   * @throws KiliException if the subscription cannot be started
   * @see SubscriptionClient#subscribe(String, Map, Map, SubscriptionCallback)
   */
  public Subscription subscribe(
      String query,
      Map<String, ?> variables,
      Map<String, String> headers,
      SubscriptionCallback callback)
      throws KiliException {
    return getSubscriptionClient().subscribe(query, variables, headers, callback);
  }

  /** @return the subscription client, created on first use */
  public SubscriptionClient getSubscriptionClient() {
    synchronized (subscriptionLock) {
      if (subscriptionClient == null) {
        subscriptionClient = new SubscriptionClient(session, webSocketConnector);
      }
      return subscriptionClient;
    }
  }

  @Override
  public void close() {
    synchronized (subscriptionLock) {
      if (subscriptionClient != null) {
        subscriptionClient.close();
      }
    }
  }
}
