package net.kili.client.subscription;

import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;

/** The WebSocket connection is closed or could not be opened. */
public class ConnectionClosedException extends KiliException {
  private static final long serialVersionUID = 1L;

  public ConnectionClosedException(String url, String reason) {
    super(ErrorCode.CONNECTION_CLOSED, url, reason);
  }

  public ConnectionClosedException(Throwable cause, String url, String reason) {
    super(cause, ErrorCode.CONNECTION_CLOSED, url, reason);
  }
}
