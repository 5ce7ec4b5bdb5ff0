package com.example.documentdb.core.auth;

import com.example.documentdb.core.AuthenticationException;
import java.util.Locale;

/** HTTP verbs understood by the DocumentDB REST API. */
public enum HttpVerb {
  GET,
  POST,
  PUT,
  DELETE;

  /**
   * Parses a verb case-insensitively.
   *
   * @param verb verb text such as {@code "get"} or {@code "POST"}
   * @return the matching verb
   * @throws AuthenticationException if the verb is empty or unknown
   */
  public static HttpVerb parse(final String verb) {
    if (verb == null || verb.isBlank()) throw new AuthenticationException("verb must not be empty");
    try {
      return valueOf(verb.trim().toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      throw new AuthenticationException("Unsupported verb: " + verb, e);
    }
  }
}
