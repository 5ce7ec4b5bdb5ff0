package com.example.documentdb.core;

import java.time.Duration;

/**
 * Raised when the service keeps answering 429 after the configured rate-limit policy has been
 * used up.
 */
public class RateLimitedException extends DocumentDbException {

  private final int retries;
  private final Duration retryAfter;

  public RateLimitedException(final int retries, final Duration retryAfter) {
    super(
        "Request was rate limited after %d retries (server asked to wait %d ms)"
            .formatted(retries, retryAfter.toMillis()));
    this.retries = retries;
    this.retryAfter = retryAfter;
  }

  public int retries() {
    return retries;
  }

  /** Last wait duration suggested by the service. */
  public Duration retryAfter() {
    return retryAfter;
  }
}
