package com.example.documentdb.core.auth;

/** Supplies the base64 master key used to sign requests. */
@FunctionalInterface
public interface CredentialProvider {

  /**
   * Returns the master key currently in use.
   *
   * @return base64 encoded master key
   */
  String masterKey();

  /**
   * Called after the service rejected a request as unauthorized. Implementations that can pick up
   * a rotated key do so here.
   *
   * @return true if a different key is now available and the request is worth signing again
   */
  default boolean refresh() {
    return false;
  }
}
