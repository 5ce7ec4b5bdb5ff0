package com.example.documentdb.core.http;

import com.example.documentdb.core.auth.HttpVerb;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outbound HTTP request.
 *
 * <p>Header values may be empty strings; transports omit such headers on the wire.
 *
 * @param method HTTP verb
 * @param uri absolute target URI
 * @param headers request headers in insertion order
 * @param body request body, or null when the request has none
 */
public record TransportRequest(
    HttpVerb method, URI uri, Map<String, String> headers, String body) {

  public TransportRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uri, "uri");
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers)));
  }

  /**
   * Looks up a header, ignoring case.
   *
   * @param name header name
   * @return header value if present
   */
  public Optional<String> header(final String name) {
    return headers.entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst();
  }
}
