package com.example.documentdb.core;

/** Base class of every failure raised by the DocumentDB client. */
public class DocumentDbException extends RuntimeException {

  public DocumentDbException(final String message) {
    super(message);
  }

  public DocumentDbException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
