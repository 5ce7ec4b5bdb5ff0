package com.example.documentdb.core.http;

/** Header names and fixed values of the DocumentDB REST API. */
public final class DocumentDbHeaders {

  public static final String API_VERSION = "2016-07-11";

  public static final String ACCEPT = "Accept";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String USER_AGENT = "User-Agent";
  public static final String AUTHORIZATION = "authorization";
  public static final String DATE = "x-ms-date";
  public static final String VERSION = "x-ms-version";
  public static final String CONSISTENCY_LEVEL = "x-ms-consistency-level";
  public static final String SESSION_TOKEN = "x-ms-session-token";
  public static final String REQUEST_CHARGE = "x-ms-request-charge";
  public static final String CONTINUATION = "x-ms-continuation";
  public static final String RETRY_AFTER_MS = "x-ms-retry-after-ms";
  public static final String MAX_ITEM_COUNT = "x-ms-max-item-count";
  public static final String IS_QUERY = "x-ms-documentdb-isquery";
  public static final String ENABLE_CROSS_PARTITION = "x-ms-documentdb-query-enablecrosspartition";
  public static final String PARTITION_KEY = "x-ms-documentdb-partitionkey";
  public static final String IS_UPSERT = "x-ms-documentdb-is-upsert";
  public static final String OFFER_THROUGHPUT = "x-ms-offer-throughput";

  public static final String APPLICATION_JSON = "application/json";
  public static final String APPLICATION_QUERY_JSON = "application/query+json";

  private DocumentDbHeaders() {}
}
