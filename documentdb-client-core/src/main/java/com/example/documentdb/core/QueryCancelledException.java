package com.example.documentdb.core;

/** Raised when a request deadline has passed or the calling thread was interrupted. */
public class QueryCancelledException extends DocumentDbException {

  public QueryCancelledException(final String message) {
    super(message);
  }

  public QueryCancelledException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
