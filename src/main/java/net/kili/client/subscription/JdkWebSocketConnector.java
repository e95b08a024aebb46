package net.kili.client.subscription;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import net.kili.client.core.HttpUtil;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/** Opens connections with the JDK {@link java.net.http.WebSocket} client. */
public class JdkWebSocketConnector implements WebSocketConnector {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(JdkWebSocketConnector.class);

  private final HttpClient httpClient;
  private final Duration timeout;

  /**
   * @param verify false to accept any server certificate
   * @param timeout connect timeout
   */
  public JdkWebSocketConnector(boolean verify, Duration timeout) {
    this.timeout = timeout;
    this.httpClient =
        HttpClient.newBuilder()
            .sslContext(HttpUtil.getSslContext(verify))
            .connectTimeout(timeout)
            .build();
  }

  @Override
  public WebSocketConnection connect(String url, String subprotocol)
      throws ConnectionClosedException {
    logger.debug("Opening WebSocket connection to {}", url);
    MessageListener listener = new MessageListener(url);
    CompletableFuture<WebSocket> future =
        httpClient
            .newWebSocketBuilder()
            .subprotocols(subprotocol)
            .connectTimeout(timeout)
            .buildAsync(URI.create(url), listener);
    try {
      WebSocket webSocket = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return new JdkWebSocketConnection(url, webSocket, listener);
    } catch (ExecutionException ex) {
      throw new ConnectionClosedException(ex.getCause(), url, String.valueOf(ex.getCause()));
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new ConnectionClosedException(ex, url, "connect timed out");
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ConnectionClosedException(ex, url, "interrupted while connecting");
    }
  }

  /** Collects complete text messages into a queue, ended by a close marker. */
  private static final class MessageListener implements WebSocket.Listener {
    private static final String CLOSED = new String("<closed>");

    private final String url;
    private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
    private final StringBuilder partial = new StringBuilder();
    private volatile String closeReason;

    MessageListener(String url) {
      this.url = url;
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        messages.add(partial.toString());
        partial.setLength(0);
      }
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
      logger.debug("Ignoring binary message from {}", url);
      webSocket.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      markClosed("closed by server, status " + statusCode + " " + reason);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      markClosed(String.valueOf(error));
    }

    void markClosed(String reason) {
      if (closeReason == null) {
        closeReason = reason;
      }
      messages.add(CLOSED);
    }
  }

  private static final class JdkWebSocketConnection implements WebSocketConnection {
    private final String url;
    private final WebSocket webSocket;
    private final MessageListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();

    JdkWebSocketConnection(String url, WebSocket webSocket, MessageListener listener) {
      this.url = url;
      this.webSocket = webSocket;
      this.listener = listener;
    }

    @Override
    public synchronized void send(String text) throws ConnectionClosedException {
      if (!isOpen()) {
        throw new ConnectionClosedException(url, String.valueOf(listener.closeReason));
      }
      try {
        webSocket.sendText(text, true).join();
      } catch (CompletionException ex) {
        throw new ConnectionClosedException(ex.getCause(), url, String.valueOf(ex.getCause()));
      }
    }

    @Override
    public String receive(long timeout, TimeUnit unit)
        throws ConnectionClosedException, InterruptedException {
      String message = listener.messages.poll(timeout, unit);
      if (message == MessageListener.CLOSED) {
        // later calls fail too
        listener.messages.add(MessageListener.CLOSED);
        throw new ConnectionClosedException(url, String.valueOf(listener.closeReason));
      }
      return message;
    }

    @Override
    public boolean isOpen() {
      return !closed.get() && !webSocket.isInputClosed() && !webSocket.isOutputClosed();
    }

    @Override
    public void close() {
      if (closed.compareAndSet(false, true)) {
        logger.debug("Closing WebSocket connection to {}", url);
        webSocket.abort();
        listener.markClosed("closed by client");
      }
    }
  }
}
