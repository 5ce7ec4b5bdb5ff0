package com.example.documentdb.core.auth;

/**
 * Credential provider backed by a fixed master key.
 *
 * @param masterKey base64 encoded master key
 */
public record StaticCredentialProvider(String masterKey) implements CredentialProvider {

  public StaticCredentialProvider {
    if (masterKey == null || masterKey.isBlank())
      throw new IllegalArgumentException("masterKey must not be blank");
  }

  @Override
  public String toString() {
    return "StaticCredentialProvider[masterKey=****]";
  }
}
