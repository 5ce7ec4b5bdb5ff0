package com.example.documentdb.core.query;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.documentdb.core.QueryCancelledException;
import com.example.documentdb.core.QueryException;
import com.example.documentdb.core.RateLimitedException;
import com.example.documentdb.core.auth.HttpVerb;
import com.example.documentdb.core.http.DocumentDbHeaders;
import com.example.documentdb.core.http.RequestDispatcher;
import com.example.documentdb.core.http.ResourceRequest;
import com.example.documentdb.core.http.ResponseMetadata;
import com.example.documentdb.core.http.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a SQL query against a collection and follows continuation tokens until the service reports
 * no further page.
 *
 * <p>Pages are fetched one after another on the calling thread. Each page is signed afresh; a
 * rate-limited page is retried with the same continuation token, so no page is skipped. Records of
 * all pages are merged by {@link RecordMerger}, request charges are summed and the session token of
 * the latest page wins.
 *
 * <p>An instance holds no per-query state and may be shared between threads.
 */
public final class QueryExecutor {

  private static final Logger logger = System.getLogger(QueryExecutor.class.getName());

  static final String DOCUMENTS_FIELD = "Documents";

  /** Field name given to non-object query results such as {@code SELECT VALUE COUNT(1)}. */
  public static final String SCALAR_FIELD = "$1";

  private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE =
      new TypeReference<>() {};

  private final RequestDispatcher dispatcher;
  private final ObjectMapper mapper;
  private final String defaultUserAgent;

  public QueryExecutor(final RequestDispatcher dispatcher, final String defaultUserAgent) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.mapper = dispatcher.mapper();
    this.defaultUserAgent = Objects.requireNonNullElse(defaultUserAgent, "");
  }

  /**
   * Executes the query and returns the records of all pages.
   *
   * @param collectionLink collection link, e.g. {@code dbs/ToDoList/colls/Items}
   * @param queryText SQL query text
   * @param options partition key, page size hint, consistency and deadline
   * @return merged result
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects a page
   * @throws RateLimitedException if a page stays rate limited beyond the configured policy
   * @throws QueryCancelledException if the deadline passes between pages
   */
  public QueryResult execute(
      final String collectionLink, final String queryText, final RequestOptions options)
      throws IOException {
    if (collectionLink == null || collectionLink.isBlank())
      throw new IllegalArgumentException("collectionLink must not be blank");
    if (queryText == null || queryText.isBlank())
      throw new IllegalArgumentException("queryText must not be blank");
    final var effective = Objects.requireNonNullElseGet(options, RequestOptions::defaults);

    final var request =
        ResourceRequest.of(HttpVerb.POST, "docs", collectionLink, collectionLink + "/docs")
            .withHeaders(queryHeaders(effective))
            .withBody(mapper.writeValueAsString(Map.of("query", queryText)))
            .withDeadline(effective.deadline());

    final var merger = new RecordMerger();
    var continuation = "";
    var requestCharge = 0.0;
    String sessionToken = null;
    var pageCount = 0;

    do {
      final var page = fetch(request, continuation);
      pageCount++;
      merger.add(page.documents());
      requestCharge += page.requestCharge();
      if (page.sessionToken() != null) sessionToken = page.sessionToken();
      continuation = page.continuation();
      logger.log(
          DEBUG,
          "Query page {0} on {1}: {2} records, {3} RU, more pages: {4}",
          pageCount,
          collectionLink,
          page.documents().size(),
          page.requestCharge(),
          page.hasContinuation());
    } while (continuation != null && !continuation.isEmpty());

    return new QueryResult(
        merger.records(), merger.fields(), requestCharge, sessionToken, pageCount);
  }

  private QueryPage fetch(final ResourceRequest request, final String continuation)
      throws IOException {
    final var response =
        dispatcher.execute(
            request.withHeaders(Map.of(DocumentDbHeaders.CONTINUATION, continuation)));
    final var metadata = ResponseMetadata.from(response);
    return new QueryPage(
        documents(response),
        metadata.requestCharge(),
        response.header(DocumentDbHeaders.CONTINUATION).orElse(null),
        metadata.sessionToken());
  }

  /**
   * Extracts the records of one page. A body without a {@code Documents} array contributes no
   * records.
   */
  List<Map<String, Object>> documents(final TransportResponse response) {
    if (response.body().isBlank()) return List.of();

    final JsonNode root;
    try {
      root = mapper.readTree(response.body());
    } catch (final JsonProcessingException e) {
      logger.log(WARNING, "Query page body is not JSON, treating it as empty", e);
      return List.of();
    }

    final var documents = root == null ? null : root.get(DOCUMENTS_FIELD);
    if (documents == null || !documents.isArray()) {
      logger.log(DEBUG, "Query page has no {0} array", DOCUMENTS_FIELD);
      return List.of();
    }

    final var records = new ArrayList<Map<String, Object>>(documents.size());
    for (final var element : documents) {
      if (element.isObject()) {
        records.add(mapper.convertValue(element, RECORD_TYPE));
      } else {
        final var scalar = new LinkedHashMap<String, Object>();
        scalar.put(SCALAR_FIELD, mapper.convertValue(element, Object.class));
        records.add(scalar);
      }
    }
    return records;
  }

  private Map<String, String> queryHeaders(final RequestOptions options)
      throws JsonProcessingException {
    final var headers = new LinkedHashMap<String, String>();
    headers.put(DocumentDbHeaders.CONTENT_TYPE, DocumentDbHeaders.APPLICATION_QUERY_JSON);
    headers.put(DocumentDbHeaders.IS_QUERY, "True");
    headers.put(
        DocumentDbHeaders.ENABLE_CROSS_PARTITION, String.valueOf(options.crossPartitionEnabled()));
    headers.put(DocumentDbHeaders.MAX_ITEM_COUNT, String.valueOf(options.maxItemCount()));
    headers.put(DocumentDbHeaders.PARTITION_KEY, options.partitionKeyHeader(mapper));
    headers.putAll(options.sessionHeaders(defaultUserAgent));
    return headers;
  }
}
