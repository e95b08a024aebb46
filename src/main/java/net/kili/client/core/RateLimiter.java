package net.kili.client.core;

/**
 * Admission control for outgoing calls. Implementations decide how many calls may reach the
 * network per time window; {@link #acquire()} blocks the caller until its call is admitted.
 *
 * <p>One instance is meant to be shared by every client of the process, see {@link
 * WindowRateLimiter#getProcessWideInstance()}. Tests inject their own.
 */
public interface RateLimiter {
  /**
   * Take one slot, waiting for the window to roll forward if the quota is used up.
   *
   * @throws KiliException with {@link ErrorCode#RATE_LIMIT_TIMEOUT} if no slot can be obtained
   *     within the limiter's maximum wait, or {@link ErrorCode#INTERRUPTED}
   */
  void acquire() throws KiliException;

  /** A limiter that admits every call immediately. */
  RateLimiter UNLIMITED = () -> {};
}
