package com.example.documentdb.core.query;

import java.util.List;
import java.util.Map;

/**
 * One page of a query response.
 *
 * @param documents records of the page, possibly empty
 * @param requestCharge request units charged for the page
 * @param continuation continuation token, or null on the last page
 * @param sessionToken session token of the page, or null
 */
public record QueryPage(
    List<Map<String, Object>> documents,
    double requestCharge,
    String continuation,
    String sessionToken) {

  public QueryPage {
    documents = List.copyOf(documents);
  }

  public boolean hasContinuation() {
    return continuation != null && !continuation.isEmpty();
  }
}
