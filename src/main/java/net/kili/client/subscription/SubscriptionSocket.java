package net.kili.client.subscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.kili.client.core.ClientSession;
import net.kili.client.core.Constants;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.util.DecorrelatedJitterBackoff;

/**
 * One WebSocket connection shared by the subscriptions of a client, with a single receive loop
 * routing frames by session id.
 *
 * <p>When the connection closes, the loop reconnects, redoes the handshake and resubmits every
 * running subscription under a new id. The consecutive failure count is reset by the first frame
 * received after a reconnection; when it reaches the configured maximum the socket gives up and
 * ends every subscription.
 */
class SubscriptionSocket {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(SubscriptionSocket.class);

  private static final String ID_CHARACTERS =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  static final int ID_LENGTH = 6;

  static final long POLL_INTERVAL_IN_MILLIS = 200;

  private final ClientSession session;
  private final String url;
  private final WebSocketConnector connector;
  private final Executor dispatcher;
  private final Map<String, String> connectionHeaders;
  private final SubscriptionClient owner;
  private final DecorrelatedJitterBackoff reconnectBackoff;

  // guards connection replacement, session registration and start frames
  private final Object stateLock = new Object();

  private volatile WebSocketConnection connection;
  private volatile long connectedAtNanos;
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  // every id issued by this socket, so that a late frame of a stopped or resubmitted session is
  // never routed to a new one; grows by one per subscribe and per resubmission, and is dropped with
  // the socket when the client closes or gives up
  private final Set<String> usedIds = ConcurrentHashMap.newKeySet();
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private volatile boolean awaitingFirstFrame;
  private volatile boolean closed;
  private volatile boolean gaveUp;
  private Thread receiver;

  SubscriptionSocket(
      ClientSession session,
      WebSocketConnector connector,
      Executor dispatcher,
      Map<String, String> connectionHeaders,
      SubscriptionClient owner) {
    this.session = session;
    this.url = session.getWebSocketEndpoint();
    this.connector = connector;
    this.dispatcher = dispatcher;
    this.connectionHeaders = connectionHeaders;
    this.owner = owner;
    long base = Math.max(1, session.getReconnectBackoffInMillis());
    this.reconnectBackoff = new DecorrelatedJitterBackoff(base, base * 16);
  }

  /** @return false once closed or given up */
  boolean isAlive() {
    return !closed && !gaveUp;
  }

  int getConsecutiveFailures() {
    return consecutiveFailures.get();
  }

  Duration getConnectionAge() {
    if (connectedAtNanos == 0) {
      return Duration.ZERO;
    }
    return Duration.ofNanos(System.nanoTime() - connectedAtNanos);
  }

  Subscription subscribe(
      String query,
      Map<String, ?> variables,
      Map<String, String> headers,
      SubscriptionCallback callback)
      throws KiliException {
    Subscription subscription = new Subscription(this, query, variables, headers, callback);
    synchronized (stateLock) {
      ensureOpen();
      if (connection == null) {
        openConnection();
        startReceiver();
      }
      register(subscription);
      try {
        send(Frame.start(subscription.getId(), subscription.getStartPayload()));
      } catch (ConnectionClosedException ex) {
        // the receive loop resubmits it once reconnected
        logger.debug("Connection lost while starting {}: {}", subscription.getId(), ex.getMessage());
      }
    }
    logger.debug("Started subscription {}", subscription.getId());
    return subscription;
  }

  void stop(Subscription subscription) {
    synchronized (stateLock) {
      String id = subscription.getId();
      subscription.markStopped(true);
      if (id == null || !subscriptions.remove(id, subscription)) {
        return;
      }
      try {
        send(Frame.stop(id));
      } catch (ConnectionClosedException ex) {
        logger.debug("Could not send stop frame for {}: {}", id, ex.getMessage());
      }
    }
    logger.debug("Stopped subscription {}", subscription.getId());
  }

  /**
   * Replaces the connection and resubmits the running subscriptions. Not counted as a failure.
   *
   * @throws KiliException if the new connection cannot be opened
   */
  void resetConnection() throws KiliException {
    synchronized (stateLock) {
      ensureOpen();
      logger.debug("Resetting WebSocket connection to {}", url);
      reconnect();
    }
  }

  /** Tears the connection down. No callback is made afterwards. */
  void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (Subscription subscription : subscriptions.values()) {
      subscription.markStopped(true);
    }
    subscriptions.clear();
    WebSocketConnection current = connection;
    if (current != null) {
      current.close();
    }
    logger.debug("Closed WebSocket connection to {}", url);
  }

  private void ensureOpen() throws KiliException {
    if (closed) {
      throw new KiliException(ErrorCode.CLIENT_CLOSED);
    }
    if (gaveUp) {
      throw new ConnectionClosedException(url, "gave up reconnecting");
    }
  }

  // caller holds stateLock
  private void register(Subscription subscription) {
    String id = generateId();
    subscription.setId(id);
    subscriptions.put(id, subscription);
  }

  private String generateId() {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    while (true) {
      StringBuilder sb = new StringBuilder(ID_LENGTH);
      for (int i = 0; i < ID_LENGTH; i++) {
        sb.append(ID_CHARACTERS.charAt(random.nextInt(ID_CHARACTERS.length())));
      }
      String id = sb.toString();
      if (usedIds.add(id)) {
        return id;
      }
    }
  }

  private void send(Frame frame) throws ConnectionClosedException {
    WebSocketConnection current = connection;
    if (current == null) {
      throw new ConnectionClosedException(url, "not connected");
    }
    logger.trace("Sending frame {}", frame);
    current.send(frame.toJson());
  }

  // caller holds stateLock
  private void openConnection() throws KiliException {
    WebSocketConnection newConnection =
        connector.connect(url, Constants.GRAPHQL_WS_SUBPROTOCOL);
    try {
      handshake(newConnection);
    } catch (KiliException ex) {
      newConnection.close();
      throw ex;
    }
    connection = newConnection;
    connectedAtNanos = System.nanoTime();
    // close() sets closed before reading connection; one of the two sides sees the other
    if (closed) {
      newConnection.close();
      throw new KiliException(ErrorCode.CLIENT_CLOSED);
    }
    logger.debug("Connected to {}", url);
  }

  private void handshake(WebSocketConnection newConnection) throws KiliException {
    newConnection.send(
        Frame.connectionInit(connectionHeaders, session.getAuthorization()).toJson());
    long deadline = System.nanoTime() + session.getTimeout().toNanos();
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new ConnectionClosedException(url, "no connection_ack received");
      }
      String text;
      try {
        text = newConnection.receive(remaining, TimeUnit.NANOSECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new KiliException(ex, ErrorCode.INTERRUPTED, "waiting for connection_ack");
      }
      if (text == null) {
        continue;
      }
      Frame frame = Frame.parse(text);
      switch (frame.getType()) {
        case CONNECTION_ACK:
          return;
        case CONNECTION_ERROR:
          throw new KiliException(
              ErrorCode.AUTHENTICATION_FAILED, "connection refused: " + frame.getPayload());
        default:
          logger.debug("Ignoring frame received before connection_ack: {}", frame);
      }
    }
  }

  // caller holds stateLock
  private void reconnect() throws KiliException {
    WebSocketConnection old = connection;
    if (old != null) {
      old.close();
    }
    openConnection();
    awaitingFirstFrame = true;
    resubmitAll();
  }

  // caller holds stateLock
  private void resubmitAll() throws ConnectionClosedException {
    List<Subscription> running = new ArrayList<>();
    for (Subscription subscription : subscriptions.values()) {
      if (subscription.isRunning()) {
        running.add(subscription);
      }
    }
    subscriptions.clear();
    for (Subscription subscription : running) {
      String oldId = subscription.getId();
      register(subscription);
      logger.debug("Resubmitting subscription {} as {}", oldId, subscription.getId());
    }
    for (Subscription subscription : running) {
      send(Frame.start(subscription.getId(), subscription.getStartPayload()));
    }
  }

  private void startReceiver() {
    receiver = new Thread(this::receiveLoop, "kili-subscription-receiver");
    receiver.setDaemon(true);
    receiver.start();
  }

  private void receiveLoop() {
    while (!closed && !gaveUp) {
      WebSocketConnection current = connection;
      try {
        String text = current.receive(POLL_INTERVAL_IN_MILLIS, TimeUnit.MILLISECONDS);
        if (text == null) {
          continue;
        }
        if (awaitingFirstFrame) {
          awaitingFirstFrame = false;
          consecutiveFailures.set(0);
        }
        handleFrame(Frame.parse(text));
      } catch (ConnectionClosedException ex) {
        if (closed) {
          break;
        }
        if (current != connection) {
          // replaced by resetConnection
          continue;
        }
        recover(current, ex);
      } catch (KiliException ex) {
        logger.warn("Dropping frame: {}", ex.getMessage());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.debug("Subscription receiver interrupted, closing", false);
        owner.close();
        break;
      }
    }
    logger.debug("Subscription receive loop of {} ended", url);
  }

  private void recover(WebSocketConnection failed, ConnectionClosedException cause) {
    long sleepTime = reconnectBackoff.getBase();
    while (!closed) {
      boolean exhausted = false;
      synchronized (stateLock) {
        // closed meanwhile, or replaced by resetConnection
        if (closed || connection != failed) {
          return;
        }
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= session.getMaxReconnections()) {
          logger.error(
              "Connection to {} failed {} times in a row, giving up: {}",
              url,
              failures,
              cause.getMessage());
          exhausted = true;
        } else {
          logger.warn(
              "Connection to {} closed ({}), reconnecting, consecutive failures: {}",
              url,
              cause.getMessage(),
              failures);
          try {
            reconnect();
            return;
          } catch (ConnectionClosedException ex) {
            cause = ex;
            failed = connection;
          } catch (KiliException ex) {
            if (closed) {
              logger.debug("Socket closed while reconnecting to {}", url);
              return;
            }
            logger.error("Reconnection to {} failed, giving up: {}", url, ex.getMessage());
            exhausted = true;
          }
        }
      }
      if (exhausted) {
        giveUp();
        return;
      }
      sleepTime = reconnectBackoff.nextSleepTime(sleepTime);
      logger.warn("Reconnection failed, next attempt in {} ms", sleepTime);
      try {
        Thread.sleep(sleepTime);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        owner.close();
        return;
      }
    }
  }

  private void giveUp() {
    List<Subscription> ended;
    synchronized (stateLock) {
      gaveUp = true;
      ended = new ArrayList<>(subscriptions.values());
      subscriptions.clear();
      WebSocketConnection current = connection;
      if (current != null) {
        current.close();
      }
    }
    for (Subscription subscription : ended) {
      subscription.markStopped(false);
      subscription.deliverTermination(dispatcher, subscription.getId(), null);
    }
  }

  private void handleFrame(Frame frame) {
    FrameType type = frame.getType();
    switch (type) {
      case KEEP_ALIVE:
      case CONNECTION_ACK:
        return;
      case DATA:
        {
          Subscription subscription = lookup(frame);
          if (subscription == null) {
            return;
          }
          if (owner.isPaused() || subscription.isPaused()) {
            logger.trace("Discarding frame of paused subscription {}", frame.getId());
            return;
          }
          subscription.deliver(dispatcher, frame.getId(), frame);
          return;
        }
      case ERROR:
      case COMPLETE:
        {
          Subscription subscription = lookup(frame);
          if (subscription == null) {
            return;
          }
          terminate(subscription, frame);
          return;
        }
      case CONNECTION_ERROR:
        logger.warn("Server reported a connection error: {}", frame.getPayload());
        return;
      default:
        logger.debug("Ignoring frame of type {}", type);
    }
  }

  private Subscription lookup(Frame frame) {
    String id = frame.getId();
    Subscription subscription = id == null ? null : subscriptions.get(id);
    if (subscription == null) {
      logger.debug("Ignoring frame for unknown subscription {}", id);
    }
    return subscription;
  }

  private void terminate(Subscription subscription, Frame frame) {
    String id = frame.getId();
    synchronized (stateLock) {
      if (!subscriptions.remove(id, subscription)) {
        return;
      }
      subscription.markStopped(false);
      try {
        send(Frame.stop(id));
      } catch (ConnectionClosedException ex) {
        logger.debug("Could not send stop frame for {}: {}", id, ex.getMessage());
      }
    }
    logger.debug("Subscription {} ended by the server with {}", id, frame.getType());
    subscription.deliverTermination(dispatcher, id, frame);
  }
}
