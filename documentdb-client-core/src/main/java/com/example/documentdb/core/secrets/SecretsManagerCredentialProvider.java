package com.example.documentdb.core.secrets;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.documentdb.core.auth.CredentialProvider;
import java.lang.System.Logger;
import java.util.HashSet;
import java.util.Set;

/**
 * Master key provider backed by an {@link AccountSecret} in AWS Secrets Manager.
 *
 * <p>The secret is read on first use. When the service rejects a request, {@link #refresh()}
 * re-reads the secret: a rotated primary key is picked up, and if the primary key did not change
 * the secondary key is tried, which covers the window in which the primary key is being
 * regenerated.
 */
public final class SecretsManagerCredentialProvider implements CredentialProvider {

  private static final Logger logger =
      System.getLogger(SecretsManagerCredentialProvider.class.getName());

  private final String secretId;
  private final Set<String> rejectedKeys = new HashSet<>();

  private AccountSecret secret;
  private String activeKey;
  private String versionId;

  public SecretsManagerCredentialProvider(final String secretId) {
    if (secretId == null || secretId.isBlank())
      throw new IllegalArgumentException("secretId must not be blank");
    this.secretId = secretId;
  }

  public String secretId() {
    return secretId;
  }

  /** Account secret currently in use, loading it on first call. */
  public synchronized AccountSecret secret() {
    if (secret == null) install(SecretHelper.getAccountSecret(secretId), currentVersion());
    return secret;
  }

  @Override
  public synchronized String masterKey() {
    secret();
    return activeKey;
  }

  /**
   * Re-reads the secret after the service rejected the active key.
   *
   * <p>Every key that was active when this method was called counts as rejected. The primary key
   * is preferred, then the secondary key, skipping rejected ones. Rejected keys are forgotten once
   * they no longer appear in the secret.
   *
   * @return true if a key that has not been rejected yet is now active
   */
  @Override
  public synchronized boolean refresh() {
    if (activeKey != null) rejectedKeys.add(activeKey);
    try {
      SecretsManagerProvider.invalidate(secretId);
      final var latestVersion = currentVersion();
      if (latestVersion != null && !latestVersion.equals(versionId))
        logger.log(INFO, "Secret {0} has a new version, reloading master key", secretId);
      final var latest = SecretHelper.getAccountSecret(secretId);
      install(latest, latestVersion);
      rejectedKeys.retainAll(keysOf(latest));

      if (latest.hasPrimaryKey() && !rejectedKeys.contains(latest.primaryKey())) {
        activeKey = latest.primaryKey();
        return true;
      }
      if (latest.hasSecondaryKey() && !rejectedKeys.contains(latest.secondaryKey())) {
        logger.log(INFO, "Primary key of secret {0} rejected, switching to secondary key", secretId);
        activeKey = latest.secondaryKey();
        return true;
      }
      logger.log(INFO, "Every key of secret {0} has been rejected", secretId);
      return false;
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to refresh master key from secret " + secretId, e);
      return false;
    }
  }

  private static Set<String> keysOf(final AccountSecret loaded) {
    final var keys = new HashSet<String>();
    if (loaded.hasPrimaryKey()) keys.add(loaded.primaryKey());
    if (loaded.hasSecondaryKey()) keys.add(loaded.secondaryKey());
    return keys;
  }

  private String currentVersion() {
    try {
      return SecretHelper.getSecretVersion(secretId);
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to read version of secret " + secretId, e);
      return null;
    }
  }

  private void install(final AccountSecret loaded, final String loadedVersion) {
    if (loaded == null || !(loaded.hasPrimaryKey() || loaded.hasSecondaryKey()))
      throw new IllegalStateException("Secret " + secretId + " holds no master key");
    secret = loaded;
    activeKey = loaded.hasPrimaryKey() ? loaded.primaryKey() : loaded.secondaryKey();
    versionId = loadedVersion;
  }

  @Override
  public String toString() {
    return "SecretsManagerCredentialProvider[secretId=" + secretId + "]";
  }
}
