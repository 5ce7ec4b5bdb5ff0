package com.example.documentdb.core.secrets;

/**
 * Account credentials stored as a JSON secret in AWS Secrets Manager:
 *
 * <pre>{@code
 * {"accountUrl": "https://myaccount.documents.azure.com", "primaryKey": "...", "secondaryKey": "..."}
 * }</pre>
 *
 * @param accountUrl account endpoint
 * @param primaryKey base64 primary master key
 * @param secondaryKey base64 secondary master key, optional
 */
public record AccountSecret(String accountUrl, String primaryKey, String secondaryKey) {

  public boolean hasPrimaryKey() {
    return primaryKey != null && !primaryKey.isBlank();
  }

  public boolean hasSecondaryKey() {
    return secondaryKey != null && !secondaryKey.isBlank();
  }

  @Override
  public String toString() {
    return "AccountSecret[accountUrl=%s, primaryKey=****, secondaryKey=****]".formatted(accountUrl);
  }
}
