package com.example.documentdb.core;

import com.example.documentdb.core.http.RateLimitPolicy;
import com.example.documentdb.core.query.RequestOptions;
import java.time.Duration;
import java.util.Optional;

/**
 * Client defaults read from system properties or environment variables:
 *
 * <ul>
 *   <li>documentdb.ratelimit.max.retries / DOCUMENTDB_RATELIMIT_MAX_RETRIES (default 9, -1 =
 *       retry for as long as the service rate limits)
 *   <li>documentdb.ratelimit.max.wait.millis / DOCUMENTDB_RATELIMIT_MAX_WAIT_MILLIS (default
 *       30000)
 *   <li>documentdb.max.item.count / DOCUMENTDB_MAX_ITEM_COUNT (default 100)
 *   <li>documentdb.user.agent / DOCUMENTDB_USER_AGENT (default empty)
 *   <li>documentdb.http.timeout.millis / DOCUMENTDB_HTTP_TIMEOUT_MILLIS (default 60000)
 * </ul>
 *
 * <p>Values that cannot be parsed fall back to the default.
 *
 * @param rateLimitPolicy policy for 429 responses
 * @param maxItemCount default page size hint for queries
 * @param userAgent default user agent
 * @param httpTimeout timeout of the default transport
 */
public record ClientSettings(
    RateLimitPolicy rateLimitPolicy, int maxItemCount, String userAgent, Duration httpTimeout) {

  static final int DEFAULT_MAX_RETRIES = 9;
  static final long DEFAULT_MAX_WAIT_MILLIS = 30_000L;
  static final long DEFAULT_HTTP_TIMEOUT_MILLIS = 60_000L;

  public static ClientSettings defaults() {
    return new ClientSettings(
        RateLimitPolicy.defaults(),
        RequestOptions.DEFAULT_MAX_ITEM_COUNT,
        "",
        Duration.ofMillis(DEFAULT_HTTP_TIMEOUT_MILLIS));
  }

  public static ClientSettings fromEnvironment() {
    final var maxRetries =
        longSetting("documentdb.ratelimit.max.retries", "DOCUMENTDB_RATELIMIT_MAX_RETRIES")
            .filter(v -> v >= -1 && v <= Integer.MAX_VALUE)
            .orElse((long) DEFAULT_MAX_RETRIES);
    final var maxWait =
        longSetting("documentdb.ratelimit.max.wait.millis", "DOCUMENTDB_RATELIMIT_MAX_WAIT_MILLIS")
            .filter(v -> v >= 0)
            .orElse(DEFAULT_MAX_WAIT_MILLIS);
    final var policy =
        maxRetries == -1
            ? RateLimitPolicy.unbounded()
            : RateLimitPolicy.bounded(maxRetries.intValue(), Duration.ofMillis(maxWait));

    final var maxItemCount =
        longSetting("documentdb.max.item.count", "DOCUMENTDB_MAX_ITEM_COUNT")
            .filter(v -> v >= 1 && v <= Integer.MAX_VALUE)
            .map(Long::intValue)
            .orElse(RequestOptions.DEFAULT_MAX_ITEM_COUNT);

    final var userAgent = setting("documentdb.user.agent", "DOCUMENTDB_USER_AGENT").orElse("");

    final var timeout =
        longSetting("documentdb.http.timeout.millis", "DOCUMENTDB_HTTP_TIMEOUT_MILLIS")
            .filter(v -> v > 0)
            .orElse(DEFAULT_HTTP_TIMEOUT_MILLIS);

    return new ClientSettings(policy, maxItemCount, userAgent, Duration.ofMillis(timeout));
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  private static Optional<Long> longSetting(final String property, final String env) {
    return setting(property, env)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            });
  }
}
