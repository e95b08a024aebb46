package net.kili.client.core;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * Rate limiter admitting at most {@code maxCalls} calls within any rolling window. Admission times
 * are kept in a log; a caller arriving once the quota is used waits until the oldest admission
 * leaves the window. Blocked callers are not served in FIFO order.
 */
public class WindowRateLimiter implements RateLimiter {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(WindowRateLimiter.class);

  private static final WindowRateLimiter processWideInstance =
      new WindowRateLimiter(
          Constants.MAX_CALLS_PER_MINUTE,
          Constants.RATE_LIMIT_WINDOW,
          Constants.RATE_LIMIT_MAX_DELAY);

  private final int maxCalls;
  private final long windowNanos;
  private final long maxDelayNanos;

  // admission times, oldest first; guarded by this
  private final Deque<Long> admissions = new ArrayDeque<>();

  /**
   * @param maxCalls maximum number of calls admitted within any window
   * @param window window length
   * @param maxDelay maximum total time a caller may wait for a slot
   */
  public WindowRateLimiter(int maxCalls, Duration window, Duration maxDelay) {
    Preconditions.checkArgument(maxCalls >= 1, "maxCalls must be positive: %s", maxCalls);
    this.maxCalls = maxCalls;
    this.windowNanos = window.toNanos();
    this.maxDelayNanos = maxDelay.toNanos();
  }

  /**
   * The limiter shared by every client of this process that does not inject its own.
   *
   * @return process-wide limiter
   */
  public static WindowRateLimiter getProcessWideInstance() {
    return processWideInstance;
  }

  @Override
  public synchronized void acquire() throws KiliException {
    final long deadline = System.nanoTime() + maxDelayNanos;
    while (true) {
      long now = System.nanoTime();
      evictExpired(now);
      if (admissions.size() < maxCalls) {
        admissions.addLast(now);
        return;
      }

      long waitNanos = admissions.peekFirst() + windowNanos - now;
      if (now + waitNanos - deadline > 0) {
        throw new KiliException(
            ErrorCode.RATE_LIMIT_TIMEOUT, TimeUnit.NANOSECONDS.toMillis(maxDelayNanos));
      }
      logger.debug(
          "Rate limit of {} calls reached, waiting {} ms for the oldest call to leave the window",
          maxCalls,
          TimeUnit.NANOSECONDS.toMillis(waitNanos));
      try {
        TimeUnit.NANOSECONDS.timedWait(this, waitNanos);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new KiliException(ex, ErrorCode.INTERRUPTED, "waiting for a rate limiter slot");
      }
    }
  }

  // caller holds the monitor
  private void evictExpired(long now) {
    while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowNanos) {
      admissions.removeFirst();
    }
  }

  /** @return number of calls admitted within the last window */
  public synchronized int getCallsInWindow() {
    evictExpired(System.nanoTime());
    return admissions.size();
  }

  public int getMaxCalls() {
    return maxCalls;
  }

  public Duration getWindow() {
    return Duration.ofNanos(windowNanos);
  }
}
