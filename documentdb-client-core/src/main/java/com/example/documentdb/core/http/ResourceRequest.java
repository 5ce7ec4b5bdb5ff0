package com.example.documentdb.core.http;

import com.example.documentdb.core.auth.HttpVerb;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request against one DocumentDB resource, before signing.
 *
 * @param verb HTTP verb
 * @param resourceType resource type used for signing
 * @param resourceLink resource link used for signing, may be empty
 * @param path URL path below the account endpoint, without leading slash
 * @param headers request specific headers
 * @param body request body, or null
 * @param deadline instant after which the request must not be sent, or null
 */
public record ResourceRequest(
    HttpVerb verb,
    String resourceType,
    String resourceLink,
    String path,
    Map<String, String> headers,
    String body,
    Instant deadline) {

  public ResourceRequest {
    Objects.requireNonNull(verb, "verb");
    Objects.requireNonNull(resourceType, "resourceType");
    resourceLink = resourceLink == null ? "" : resourceLink;
    Objects.requireNonNull(path, "path");
    headers =
        Collections.unmodifiableMap(new LinkedHashMap<>(headers == null ? Map.of() : headers));
  }

  public static ResourceRequest of(
      final HttpVerb verb, final String resourceType, final String resourceLink, final String path) {
    return new ResourceRequest(verb, resourceType, resourceLink, path, Map.of(), null, null);
  }

  public ResourceRequest withHeaders(final Map<String, String> extra) {
    final var merged = new LinkedHashMap<>(headers);
    merged.putAll(extra);
    return new ResourceRequest(verb, resourceType, resourceLink, path, merged, body, deadline);
  }

  public ResourceRequest withBody(final String newBody) {
    return new ResourceRequest(verb, resourceType, resourceLink, path, headers, newBody, deadline);
  }

  public ResourceRequest withDeadline(final Instant newDeadline) {
    return new ResourceRequest(verb, resourceType, resourceLink, path, headers, body, newDeadline);
  }
}
