package com.example.documentdb.core;

import java.util.Map;

/**
 * A single document read from a collection.
 *
 * @param document document fields, including system fields such as {@code _rid} and {@code _etag}
 * @param requestCharge request units charged
 * @param sessionToken session token of the response, or null
 */
public record DocumentResponse(
    Map<String, Object> document, double requestCharge, String sessionToken) {}
