package com.example.documentdb.core.http;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * HTTP response as seen by the client.
 *
 * @param statusCode HTTP status code
 * @param headers response headers, looked up case-insensitively
 * @param body response body, empty when the response has none
 */
public record TransportResponse(int statusCode, Map<String, String> headers, String body) {

  public TransportResponse {
    final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(Objects.requireNonNull(headers, "headers"));
    headers = Collections.unmodifiableMap(copy);
    body = Optional.ofNullable(body).orElse("");
  }

  public Optional<String> header(final String name) {
    return Optional.ofNullable(headers.get(name));
  }

  public boolean isSuccess() {
    return statusCode / 100 == 2;
  }
}
