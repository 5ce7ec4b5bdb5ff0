package com.example.documentdb.core;

/**
 * Raised when the service answers a request with a non-2xx status other than 429. Carries the
 * remote error code and message verbatim.
 */
public class QueryException extends DocumentDbException {

  private final int statusCode;
  private final RemoteError error;

  public QueryException(final int statusCode, final RemoteError error) {
    super(
        "A %s error occurred during DocumentDB querying. Error Message: %s"
            .formatted(error.code(), error.message()));
    this.statusCode = statusCode;
    this.error = error;
  }

  public int statusCode() {
    return statusCode;
  }

  public RemoteError error() {
    return error;
  }
}
