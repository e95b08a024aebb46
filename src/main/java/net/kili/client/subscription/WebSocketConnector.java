package net.kili.client.subscription;

/** Opens WebSocket connections. */
@FunctionalInterface
public interface WebSocketConnector {
  /**
   * @param url {@code ws} or {@code wss} URL
   * @param subprotocol sub-protocol to negotiate
   * @return an open connection
   * @throws ConnectionClosedException if the connection cannot be opened
   */
  WebSocketConnection connect(String url, String subprotocol) throws ConnectionClosedException;
}
