package net.kili.client.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import net.kili.client.core.ObjectMapperFactory;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * Handle of one subscription. The query, variables and headers are kept as given so that a
 * reconnection resubmits the same start payload; only the session id changes.
 *
 * <p>{@link #pause()}, {@link #unpause()} and {@link #stop()} may be called from any thread.
 */
public class Subscription {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(Subscription.class);

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final SubscriptionSocket socket;
  private final String query;
  private final Map<String, Object> variables;
  private final Map<String, String> headers;
  private final SubscriptionCallback callback;
  private final ObjectNode startPayload;

  private volatile String id;
  private volatile boolean running = true;
  private volatile boolean paused;
  // no callbacks at all once set
  private volatile boolean cancelled;

  private final Queue<Runnable> pendingCallbacks = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();

  Subscription(
      SubscriptionSocket socket,
      String query,
      Map<String, ?> variables,
      Map<String, String> headers,
      SubscriptionCallback callback) {
    this.socket = socket;
    this.query = query;
    this.variables =
        variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    this.headers =
        headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.callback = callback;

    ObjectNode payload = mapper.createObjectNode();
    payload.set("headers", mapper.valueToTree(this.headers));
    payload.put("query", query);
    payload.set("variables", mapper.valueToTree(this.variables));
    this.startPayload = payload;
  }

  /** @return current session id, changes when the subscription is resubmitted */
  public String getId() {
    return id;
  }

  void setId(String id) {
    this.id = id;
  }

  public String getQuery() {
    return query;
  }

  public Map<String, Object> getVariables() {
    return variables;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  /** @return a copy of the payload of the start frame */
  public ObjectNode getStartPayload() {
    return startPayload.deepCopy();
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isPaused() {
    return paused;
  }

  /** Received data frames are discarded until {@link #unpause()}. */
  public void pause() {
    paused = true;
  }

  public void unpause() {
    paused = false;
  }

  /** Sends a stop frame and ends the subscription. No callback is made afterwards. */
  public void stop() {
    socket.stop(this);
  }

  void markStopped(boolean cancel) {
    running = false;
    if (cancel) {
      cancelled = true;
    }
  }

  void deliver(Executor dispatcher, String frameId, Frame frame) {
    enqueue(
        dispatcher,
        () -> {
          if (running && !cancelled) {
            callback.onMessage(frameId, frame);
          }
        });
  }

  void deliverTermination(Executor dispatcher, String frameId, Frame frame) {
    enqueue(
        dispatcher,
        () -> {
          if (!cancelled) {
            callback.onTerminated(frameId, frame);
          }
        });
  }

  private void enqueue(Executor dispatcher, Runnable task) {
    pendingCallbacks.add(task);
    if (draining.compareAndSet(false, true)) {
      try {
        dispatcher.execute(this::drain);
      } catch (RejectedExecutionException ex) {
        draining.set(false);
        logger.debug("Dispatcher is shut down, dropping callbacks of subscription {}", id);
      }
    }
  }

  // callbacks of one subscription run one at a time
  private void drain() {
    do {
      Runnable task;
      while ((task = pendingCallbacks.poll()) != null) {
        try {
          task.run();
        } catch (RuntimeException ex) {
          logger.warn("Subscription callback of {} failed: {}", id, ex);
        }
      }
      draining.set(false);
    } while (!pendingCallbacks.isEmpty() && draining.compareAndSet(false, true));
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", running=" + running + ", paused=" + paused + "}";
  }
}
