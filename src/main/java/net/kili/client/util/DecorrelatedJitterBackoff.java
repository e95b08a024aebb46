package net.kili.client.util;

import com.google.common.base.Preconditions;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decorrelated Jitter backoff
 *
 * <p>https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/
 */
public class DecorrelatedJitterBackoff {
  private final long base;
  private final long cap;

  /**
   * @param base minimum sleep time in milliseconds, at least 1
   * @param cap maximum sleep time in milliseconds
   */
  public DecorrelatedJitterBackoff(long base, long cap) {
    Preconditions.checkArgument(
        base >= 1 && cap >= base,
        "Backoff requires 1 <= base <= cap, got base=%s, cap=%s",
        base,
        cap);
    this.base = base;
    this.cap = cap;
  }

  public long getBase() {
    return base;
  }

  /**
   * Compute the next sleep time from the previous one.
   *
   * @param sleep previous sleep time in milliseconds, {@link #getBase()} for the first retry
   * @return next sleep time in milliseconds, within [base, cap]
   */
  public long nextSleepTime(long sleep) {
    long upper = Math.max(base + 1, sleep * 3);
    return Math.min(cap, ThreadLocalRandom.current().nextLong(base, upper));
  }
}
