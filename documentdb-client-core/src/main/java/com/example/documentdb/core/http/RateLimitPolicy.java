package com.example.documentdb.core.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds the sleep-and-retry loop run when the service answers 429.
 *
 * <p>The delay before each retry is always the one suggested by the service in {@code
 * x-ms-retry-after-ms}; this policy only decides whether another retry is allowed. Both limits
 * apply to a single request, i.e. one page of a query. The first retry is always granted when
 * {@code maxRetries} is positive, however long the suggested delay; from the second retry on the
 * cumulative wait, including the next delay, must stay within {@code maxTotalWait}.
 *
 * @param maxRetries maximum number of retries after the first attempt, must be >= 0
 * @param maxTotalWait maximum cumulative time spent waiting, must be non-negative
 */
public record RateLimitPolicy(int maxRetries, Duration maxTotalWait) {

  private static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);

  public RateLimitPolicy {
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    Objects.requireNonNull(maxTotalWait, "maxTotalWait");
    if (maxTotalWait.isNegative())
      throw new IllegalArgumentException("maxTotalWait must be non-negative");
  }

  /** Up to 9 retries and 30 seconds of waiting. */
  public static RateLimitPolicy defaults() {
    return new RateLimitPolicy(9, Duration.ofSeconds(30));
  }

  /**
   * Creates a bounded policy.
   *
   * @param maxRetries maximum number of retries
   * @param maxTotalWait maximum cumulative wait
   * @return bounded policy
   */
  public static RateLimitPolicy bounded(final int maxRetries, final Duration maxTotalWait) {
    return new RateLimitPolicy(maxRetries, maxTotalWait);
  }

  /** Retries for as long as the service keeps rate limiting. */
  public static RateLimitPolicy unbounded() {
    return new RateLimitPolicy(Integer.MAX_VALUE, FOREVER);
  }

  /** Surfaces the first 429 to the caller. */
  public static RateLimitPolicy disabled() {
    return new RateLimitPolicy(0, Duration.ZERO);
  }

  /** True only for {@link #unbounded()}, i.e. when neither limit applies. */
  public boolean isUnbounded() {
    return maxRetries == Integer.MAX_VALUE && maxTotalWait.equals(FOREVER);
  }

  /**
   * Decides whether a rate-limited request may be retried.
   *
   * @param retriesSoFar retries already made for this request
   * @param waitedSoFar time already spent waiting for this request
   * @param nextWait wait the service asks for before the next retry
   * @return true if the retry is allowed
   */
  public boolean allowsRetry(
      final int retriesSoFar, final Duration waitedSoFar, final Duration nextWait) {
    if (isUnbounded()) return true;
    if (retriesSoFar >= maxRetries) return false;
    return retriesSoFar == 0 || waitedSoFar.plus(nextWait).compareTo(maxTotalWait) <= 0;
  }
}
