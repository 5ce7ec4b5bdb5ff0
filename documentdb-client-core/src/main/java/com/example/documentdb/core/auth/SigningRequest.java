package com.example.documentdb.core.auth;

import com.example.documentdb.core.AuthenticationException;

/**
 * Inputs of a single request signature. Built fresh for every outbound request since the
 * timestamp must be current.
 *
 * @param verb HTTP verb of the request
 * @param resourceType kind of resource addressed, e.g. {@code dbs}, {@code colls}, {@code docs}
 * @param resourceLink path of the addressed resource, empty for account level operations
 * @param timestamp HTTP-date sent in the {@code x-ms-date} header
 * @param secretKey base64 encoded master key
 * @param keyType key type, {@code master} for master keys
 * @param tokenVersion token version, {@code 1.0}
 */
public record SigningRequest(
    HttpVerb verb,
    String resourceType,
    String resourceLink,
    String timestamp,
    String secretKey,
    String keyType,
    String tokenVersion) {

  public static final String MASTER_KEY_TYPE = "master";
  public static final String TOKEN_VERSION = "1.0";

  public SigningRequest {
    if (verb == null) throw new AuthenticationException("verb must not be empty");
    requireText(resourceType, "resourceType");
    if (resourceLink == null) resourceLink = "";
    requireText(timestamp, "timestamp");
    requireText(secretKey, "secretKey");
    requireText(keyType, "keyType");
    requireText(tokenVersion, "tokenVersion");
  }

  /**
   * Creates a master key signing request with token version {@code 1.0}.
   *
   * @param verb HTTP verb
   * @param resourceType resource type
   * @param resourceLink resource link, may be empty
   * @param timestamp HTTP-date of the request
   * @param secretKey base64 master key
   * @return signing request
   */
  public static SigningRequest master(
      final HttpVerb verb,
      final String resourceType,
      final String resourceLink,
      final String timestamp,
      final String secretKey) {
    return new SigningRequest(
        verb, resourceType, resourceLink, timestamp, secretKey, MASTER_KEY_TYPE, TOKEN_VERSION);
  }

  @Override
  public String toString() {
    return "SigningRequest[verb=%s, resourceType=%s, resourceLink=%s, timestamp=%s]"
        .formatted(verb, resourceType, resourceLink, timestamp);
  }

  private static void requireText(final String value, final String name) {
    if (value == null || value.isEmpty())
      throw new AuthenticationException(name + " must not be empty");
  }
}
