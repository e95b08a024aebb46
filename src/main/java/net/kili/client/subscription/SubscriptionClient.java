package net.kili.client.subscription;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.Closeable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import net.kili.client.core.ClientSession;
import net.kili.client.core.Constants;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * GraphQL subscriptions over one {@code graphql-ws} WebSocket per client.
 *
 * <p>The connection is opened by the first {@link #subscribe} call. Frames are received by a
 * single daemon thread and delivered to callbacks on a fixed pool of dispatcher threads. A closed
 * connection is reopened and the running subscriptions are resubmitted with their original
 * payload.
 */
public class SubscriptionClient implements Closeable {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(SubscriptionClient.class);

  private final ClientSession session;
  private final WebSocketConnector connector;
  private final ExecutorService dispatcher;
  private final Map<String, String> connectionHeaders;

  private final Object socketLock = new Object();
  private SubscriptionSocket socket;
  private volatile boolean paused;
  private volatile boolean closed;

  public SubscriptionClient(ClientSession session) {
    this(session, new JdkWebSocketConnector(session.isVerify(), session.getTimeout()));
  }

  public SubscriptionClient(ClientSession session, WebSocketConnector connector) {
    this.session = session;
    this.connector = connector;
    this.dispatcher = createDispatcher(session.getDispatcherThreads());

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(Constants.HEADER_ACCEPT, Constants.APPLICATION_JSON);
    headers.put(Constants.HEADER_CONTENT_TYPE, Constants.APPLICATION_JSON);
    headers.put(Constants.HEADER_CLIENT_NAME, session.getClientName().getHeaderValue());
    headers.put(Constants.HEADER_CLIENT_VERSION, session.getClientVersion());
    this.connectionHeaders = headers;
  }

  private static ExecutorService createDispatcher(int threads) {
    AtomicInteger threadCount = new AtomicInteger(1);
    ThreadFactory daemonThreadFactory =
        r -> {
          Thread thread = Executors.defaultThreadFactory().newThread(r);
          thread.setName("kili-subscription-dispatcher-" + threadCount.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(threads, daemonThreadFactory);
  }

  /**
   * Starts a subscription.
   *
   * @param query GraphQL subscription document
   * @param variables variable values, may be null
   * @param headers headers forwarded in the start payload, may be null
   * @param callback receiver of the frames
   * @return handle of the subscription
   * @throws KiliException if the connection cannot be opened, the handshake is refused ({@link
   *     ErrorCode#AUTHENTICATION_FAILED}) or the client is closed
   */
  public Subscription subscribe(
      String query,
      Map<String, ?> variables,
      Map<String, String> headers,
      SubscriptionCallback callback)
      throws KiliException {
    Preconditions.checkArgument(callback != null, "callback must not be null");
    return currentSocket().subscribe(query, variables, headers, callback);
  }

  /**
   * Starts a subscription, waits for its first data frame and stops it.
   *
   * @param query GraphQL document
   * @param variables variable values, may be null
   * @param headers headers forwarded in the start payload, may be null
   * @param timeout maximum wait for the first frame
   * @return the first data frame
   * @throws KiliException with {@link ErrorCode#SUBSCRIPTION_ERROR} if no frame arrives in time or
   *     the server ends the subscription first
   */
  public Frame queryOnce(
      String query, Map<String, ?> variables, Map<String, String> headers, Duration timeout)
      throws KiliException {
    CompletableFuture<Frame> firstFrame = new CompletableFuture<>();
    Subscription subscription =
        subscribe(
            query,
            variables,
            headers,
            new SubscriptionCallback() {
              @Override
              public void onMessage(String id, Frame frame) {
                firstFrame.complete(frame);
              }

              @Override
              public void onTerminated(String id, Frame frame) {
                firstFrame.completeExceptionally(
                    new KiliException(
                        ErrorCode.SUBSCRIPTION_ERROR,
                        "ended before any data: " + (frame == null ? "connection lost" : frame)));
              }
            });
    try {
      return firstFrame.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      throw new KiliException(
          ex, ErrorCode.SUBSCRIPTION_ERROR, "no data within " + timeout.toMillis() + " ms");
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof KiliException) {
        throw (KiliException) ex.getCause();
      }
      throw new KiliException(ex.getCause(), ErrorCode.SUBSCRIPTION_ERROR, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new KiliException(ex, ErrorCode.INTERRUPTED, "waiting for subscription data");
    } finally {
      subscription.stop();
    }
  }

  private SubscriptionSocket currentSocket() throws KiliException {
    synchronized (socketLock) {
      if (closed) {
        throw new KiliException(ErrorCode.CLIENT_CLOSED);
      }
      if (socket == null || !socket.isAlive()) {
        socket = new SubscriptionSocket(session, connector, dispatcher, connectionHeaders, this);
      }
      return socket;
    }
  }

  /** Discards received data frames of every subscription until {@link #unpause()}. */
  public void pause() {
    paused = true;
  }

  public void unpause() {
    paused = false;
  }

  public boolean isPaused() {
    return paused;
  }

  /** @return time since the connection was last opened, zero before the first subscription */
  public Duration getConnectionAge() {
    synchronized (socketLock) {
      return socket == null ? Duration.ZERO : socket.getConnectionAge();
    }
  }

  /**
   * Reopens the connection and resubmits the running subscriptions. Not counted as a connection
   * failure.
   *
   * @throws KiliException if the new connection cannot be opened
   */
  public void resetConnection() throws KiliException {
    SubscriptionSocket current;
    synchronized (socketLock) {
      if (closed) {
        throw new KiliException(ErrorCode.CLIENT_CLOSED);
      }
      current = socket;
    }
    if (current != null) {
      current.resetConnection();
    }
  }

  @VisibleForTesting
  int getConsecutiveFailures() {
    synchronized (socketLock) {
      return socket == null ? 0 : socket.getConsecutiveFailures();
    }
  }

  /** Closes the connection. Running subscriptions receive no further callback. */
  @Override
  public void close() {
    SubscriptionSocket current;
    synchronized (socketLock) {
      if (closed) {
        return;
      }
      closed = true;
      current = socket;
    }
    if (current != null) {
      current.close();
    }
    dispatcher.shutdownNow();
    logger.debug("Subscription client closed", false);
  }
}
