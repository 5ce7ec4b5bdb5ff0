package com.example.documentdb.core;

/**
 * Outcome of an existence check.
 *
 * @param exists whether the resource exists
 * @param requestCharge request units charged
 * @param sessionToken session token of the response, or null
 */
public record ExistsResponse(boolean exists, double requestCharge, String sessionToken) {}
