package com.example.documentdb.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;

/**
 * Structured error payload returned by the service on a failed request.
 *
 * @param code service error code, e.g. {@code BadRequest}
 * @param message human readable error message
 */
public record RemoteError(String code, String message) {

  /**
   * Decodes the error body of a failed response.
   *
   * <p>Bodies that are not a JSON object fall back to the HTTP status as code and the raw body as
   * message.
   *
   * @param statusCode HTTP status of the response
   * @param body raw response body, may be empty
   * @param mapper mapper used to parse the body
   * @return decoded error
   */
  public static RemoteError decode(final int statusCode, final String body, final ObjectMapper mapper) {
    final var raw = Optional.ofNullable(body).orElse("");
    final var fallback = new RemoteError(String.valueOf(statusCode), raw);
    if (raw.isBlank()) return fallback;

    try {
      final var node = mapper.readTree(raw);
      if (node == null || !node.isObject()) return fallback;
      return new RemoteError(
          text(node, "code").orElse(fallback.code()), text(node, "message").orElse(raw));
    } catch (final IOException e) {
      return fallback;
    }
  }

  private static Optional<String> text(final JsonNode node, final String field) {
    return Optional.ofNullable(node.get(field)).filter(n -> !n.isNull()).map(JsonNode::asText);
  }
}
