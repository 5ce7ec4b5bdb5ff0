package com.example.documentdb.core.secrets;

import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * Lazily configured AWS Secrets Manager client holding DocumentDB account secrets.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *   <li>aws.sm.cache.ttl.millis / AWS_SM_CACHE_TTL_MILLIS (optional, default 0 = disabled)
 * </ul>
 */
public final class SecretsManagerProvider {

  private static final Logger logger = System.getLogger(SecretsManagerProvider.class.getName());

  private static final ConcurrentHashMap<String, CacheEntry> CACHE = new ConcurrentHashMap<>();
  private static volatile SecretsManagerClient client;
  private static volatile long ttlMillis = initTtlMillis();
  private static volatile Clock clock = Clock.systemUTC();

  static {
    Runtime.getRuntime()
        .addShutdownHook(new Thread(SecretsManagerProvider::closeClient, "secrets-manager-close"));
  }

  private SecretsManagerProvider() {}

  private static long initTtlMillis() {
    return Optional.ofNullable(System.getProperty("aws.sm.cache.ttl.millis"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_CACHE_TTL_MILLIS")))
        .map(String::trim)
        .filter(val -> !val.isEmpty())
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring invalid secret cache TTL: {0}", val);
                return Optional.empty();
              }
            })
        .map(parsed -> Math.max(0L, parsed))
        .orElse(0L);
  }

  /** For tests only: override TTL and clock. */
  public static synchronized void configureCacheForTests(
      final long newTtlMillis, final Clock newClock) {
    ttlMillis = Math.max(0L, newTtlMillis);
    clock = Optional.ofNullable(newClock).orElse(Clock.systemUTC());
    CACHE.clear();
  }

  /** Clears the in-memory cache. */
  public static void resetCache() {
    CACHE.clear();
  }

  /**
   * Drops the cached value of one secret so the next read goes to Secrets Manager.
   *
   * @param secretId the secret ID or name
   */
  public static void invalidate(final String secretId) {
    CACHE.remove(secretId);
  }

  /** Closes the client and clears the cache; the next access builds a client from current config. */
  public static synchronized void resetClient() {
    closeClient();
    client = null;
    resetCache();
  }

  private static void closeClient() {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final RuntimeException e) {
                logger.log(WARNING, "Failed to close Secrets Manager client", e);
              }
            });
  }

  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();

    builder.region(
        Optional.ofNullable(System.getProperty("aws.region"))
            .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
            .map(Region::of)
            .orElse(Region.US_EAST_1));

    Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    Optional.ofNullable(System.getProperty("aws.accessKeyId", System.getenv("AWS_ACCESS_KEY_ID")))
        .flatMap(
            accessKey ->
                Optional.ofNullable(
                        System.getProperty(
                            "aws.secretAccessKey", System.getenv("AWS_SECRET_ACCESS_KEY")))
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.create()));

    return builder.build();
  }

  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /**
   * Retrieves the raw secret string. Uses the cache when enabled (ttl > 0).
   *
   * @param secretId the secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public static String getSecret(final String secretId) {
    return getSecretValue(secretId, CacheEntry::secretString, GetSecretValueResponse::secretString);
  }

  /**
   * Retrieves the current version identifier of a secret. Uses the cache when enabled (ttl > 0).
   *
   * @param secretId the secret ID or name
   * @return versionId of the latest secret value
   */
  public static String getSecretVersion(final String secretId) {
    return getSecretValue(secretId, CacheEntry::versionId, GetSecretValueResponse::versionId);
  }

  private static String getSecretValue(
      final String secretId,
      final Function<CacheEntry, String> cacheExtractor,
      final Function<GetSecretValueResponse, String> responseExtractor) {
    final var ttl = ttlMillis;
    if (ttl <= 0) return responseExtractor.apply(fetchSecret(secretId));

    final var now = Instant.now(clock).toEpochMilli();
    return Optional.ofNullable(CACHE.get(secretId))
        .filter(cached -> cached.expiresAtMillis() >= now)
        .map(cacheExtractor)
        .orElseGet(
            () -> {
              final var response = fetchSecret(secretId);
              final var entry =
                  new CacheEntry(response.secretString(), response.versionId(), now + ttl);
              CACHE.put(secretId, entry);
              return cacheExtractor.apply(entry);
            });
  }

  private static GetSecretValueResponse fetchSecret(final String secretId) {
    return getClient().getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build());
  }

  private record CacheEntry(String secretString, String versionId, long expiresAtMillis) {}
}
