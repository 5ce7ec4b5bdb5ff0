package com.example.documentdb.core;

import java.util.List;
import java.util.Map;

/**
 * Resources listed by a feed read, e.g. the collections of a database or the offers of an account.
 *
 * @param resources listed resources
 * @param requestCharge request units charged
 * @param sessionToken session token of the response, or null
 */
public record ResourceListResponse(
    List<Map<String, Object>> resources, double requestCharge, String sessionToken) {

  public ResourceListResponse {
    resources = List.copyOf(resources);
  }
}
