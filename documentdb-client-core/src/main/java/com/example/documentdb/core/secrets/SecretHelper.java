package com.example.documentdb.core.secrets;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;

/** Reads DocumentDB account secrets from AWS Secrets Manager and parses them with Jackson. */
public final class SecretHelper {

  private static volatile Supplier<ObjectMapper> mapperSupplier = SecretHelper::defaultMapper;

  private SecretHelper() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier == null ? SecretHelper::defaultMapper : supplier;
  }

  /**
   * Retrieves an account secret and converts it into an {@link AccountSecret}.
   *
   * @param secretId the secret ID or name
   * @return the parsed secret
   * @throws IllegalStateException if the secret cannot be fetched or parsed
   */
  public static AccountSecret getAccountSecret(final String secretId) {
    try {
      return mapperSupplier
          .get()
          .readValue(SecretsManagerProvider.getSecret(secretId), AccountSecret.class);
    } catch (final Exception exception) {
      throw new IllegalStateException("Failed to load account secret " + secretId, exception);
    }
  }

  /**
   * Retrieves the current version identifier of a secret.
   *
   * @param secretId the secret ID or name
   * @return the version id of the latest secret value
   * @throws IllegalStateException if the version cannot be retrieved
   */
  public static String getSecretVersion(final String secretId) {
    try {
      return SecretsManagerProvider.getSecretVersion(secretId);
    } catch (final Exception exception) {
      throw new IllegalStateException("Failed to retrieve version of secret " + secretId, exception);
    }
  }

  static ObjectMapper defaultMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
