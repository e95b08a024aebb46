package net.kili.client.subscription;

import java.util.concurrent.TimeUnit;

/** An open WebSocket exchanging text messages. */
public interface WebSocketConnection {
  /**
   * Sends one text message and waits until it is written.
   *
   * @param text message
   * @throws ConnectionClosedException if the connection is closed
   */
  void send(String text) throws ConnectionClosedException;

  /**
   * Waits for the next text message.
   *
   * @param timeout maximum wait
   * @param unit unit of the timeout
   * @return the message, null if none arrived in time
   * @throws ConnectionClosedException if the connection is closed, including by {@link #close()}
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  String receive(long timeout, TimeUnit unit)
      throws ConnectionClosedException, InterruptedException;

  boolean isOpen();

  /** Closes the connection. Blocked and later {@link #receive} calls fail. Idempotent. */
  void close();
}
