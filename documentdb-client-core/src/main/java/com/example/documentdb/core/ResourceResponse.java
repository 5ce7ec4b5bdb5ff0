package com.example.documentdb.core;

import com.example.documentdb.core.http.ResponseMetadata;

/**
 * Outcome of an operation that returns no resource.
 *
 * @param requestCharge request units charged
 * @param sessionToken session token of the last response, or null
 */
public record ResourceResponse(double requestCharge, String sessionToken) {

  static ResourceResponse of(final ResponseMetadata metadata) {
    return new ResourceResponse(metadata.requestCharge(), metadata.sessionToken());
  }
}
