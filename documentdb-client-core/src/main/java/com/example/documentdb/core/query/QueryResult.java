package com.example.documentdb.core.query;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of a query, merged over all of its pages.
 *
 * <p>Every record carries every field seen on any page; fields a record did not have map to
 * null.
 *
 * @param documents merged records in arrival order
 * @param fields union of record fields in first-seen order
 * @param requestCharge sum of the request charges of all pages
 * @param sessionToken session token of the last page that reported one, or null
 * @param pageCount number of pages fetched
 */
public record QueryResult(
    List<Map<String, Object>> documents,
    List<String> fields,
    double requestCharge,
    String sessionToken,
    int pageCount) {

  public QueryResult {
    documents = List.copyOf(documents);
    fields = List.copyOf(fields);
  }

  public int size() {
    return documents.size();
  }

  public boolean isEmpty() {
    return documents.isEmpty();
  }

  /**
   * Values of one field across all records, nulls included.
   *
   * @param field field name
   * @return one value per record
   */
  public List<Object> values(final String field) {
    return documents.stream()
        .map(document -> document.get(field))
        .collect(Collectors.toList());
  }
}
