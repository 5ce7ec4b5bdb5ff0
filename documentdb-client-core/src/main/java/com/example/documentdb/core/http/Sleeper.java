package com.example.documentdb.core.http;

import java.time.Duration;

/** Suspends the calling thread while the client backs off from a rate-limited request. */
@FunctionalInterface
public interface Sleeper {

  void sleep(final Duration duration) throws InterruptedException;

  /** Sleeper that blocks the calling thread with {@link Thread#sleep(long)}. */
  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
