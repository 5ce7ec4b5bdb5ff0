package com.example.documentdb.core;

/**
 * Raised when a request cannot be signed, typically because the master key is not valid base64
 * or a required signing field is empty. Never retried.
 */
public class AuthenticationException extends DocumentDbException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
