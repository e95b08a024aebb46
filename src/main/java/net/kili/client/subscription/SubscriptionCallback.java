package net.kili.client.subscription;

/**
 * Receives the frames of one subscription. Calls for one subscription are made one at a time and
 * in arrival order, on a dispatcher thread.
 */
@FunctionalInterface
public interface SubscriptionCallback {
  /**
   * @param id session id the frame was received for
   * @param frame data frame
   */
  void onMessage(String id, Frame frame);

  /**
   * The subscription ended without being stopped by the caller.
   *
   * @param id last session id of the subscription
   * @param frame the server's {@code error} or {@code complete} frame, null when the client gave
   *     up reconnecting
   */
  default void onTerminated(String id, Frame frame) {}
}
