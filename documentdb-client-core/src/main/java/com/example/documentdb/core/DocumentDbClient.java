package com.example.documentdb.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.documentdb.core.auth.CredentialProvider;
import com.example.documentdb.core.auth.HttpVerb;
import com.example.documentdb.core.auth.StaticCredentialProvider;
import com.example.documentdb.core.http.DocumentDbHeaders;
import com.example.documentdb.core.http.HttpTransport;
import com.example.documentdb.core.http.JdkHttpTransport;
import com.example.documentdb.core.http.RateLimitPolicy;
import com.example.documentdb.core.http.RequestDispatcher;
import com.example.documentdb.core.http.ResourceRequest;
import com.example.documentdb.core.http.ResponseMetadata;
import com.example.documentdb.core.http.Sleeper;
import com.example.documentdb.core.http.TransportResponse;
import com.example.documentdb.core.query.QueryExecutor;
import com.example.documentdb.core.query.QueryResult;
import com.example.documentdb.core.query.RequestOptions;
import com.example.documentdb.core.secrets.SecretsManagerCredentialProvider;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.System.Logger;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the DocumentDB REST API: databases, collections, offers and documents of one account.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var client = DocumentDbClient.builder()
 *     .accountUrl("https://myaccount.documents.azure.com")
 *     .masterKey(System.getenv("DOCUMENTDB_KEY"))
 *     .databaseId("ToDoList")
 *     .collectionId("Items")
 *     .build();
 *
 * var result = client.selectDocuments("SELECT * FROM c WHERE c.done = false");
 * result.documents().forEach(System.out::println);
 * }</pre>
 *
 * <h2>Key From AWS Secrets Manager</h2>
 *
 * <pre>{@code
 * var client = DocumentDbClient.builder()
 *     .secretsManagerSecret("prod/documentdb/account")
 *     .databaseId("ToDoList")
 *     .collectionId("Items")
 *     .build();
 * }</pre>
 *
 * <p>The account URL is taken from the secret when none is set on the builder. A 401 response makes
 * the client reload the secret once and, if the key changed, repeat the request.
 *
 * <h2>Rate Limiting</h2>
 *
 * <pre>{@code
 * var client = DocumentDbClient.builder()
 *     .accountUrl(url)
 *     .masterKey(key)
 *     .rateLimitPolicy(RateLimitPolicy.bounded(20, Duration.ofMinutes(2)))
 *     .build();
 * }</pre>
 *
 * <p>Every operation takes an optional {@link RequestOptions} carrying partition key, consistency
 * level, session token, user agent and deadline. Unset options fall back to the client defaults.
 */
public final class DocumentDbClient {

  private static final Logger logger = System.getLogger(DocumentDbClient.class.getName());

  static final int NOT_FOUND = 404;
  static final int DELETE_BATCH_SIZE = 1000;
  static final String COLLECTIONS_FIELD = "DocumentCollections";
  static final String OFFERS_FIELD = "Offers";

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
      new TypeReference<>() {};

  private final ConnectionInfo connection;
  private final RequestDispatcher dispatcher;
  private final QueryExecutor queryExecutor;
  private final ObjectMapper mapper;
  private final RequestOptions defaultOptions;
  private final String userAgent;

  private DocumentDbClient(
      final ConnectionInfo connection,
      final RequestDispatcher dispatcher,
      final RequestOptions defaultOptions,
      final String userAgent) {
    this.connection = connection;
    this.dispatcher = dispatcher;
    this.mapper = dispatcher.mapper();
    this.defaultOptions = defaultOptions;
    this.userAgent = userAgent;
    this.queryExecutor = new QueryExecutor(dispatcher, userAgent);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public ConnectionInfo connection() {
    return connection;
  }

  /**
   * Returns a client bound to another database. Transport, credentials and policies are shared.
   *
   * @param databaseId database subsequent operations default to
   * @return new client
   */
  public DocumentDbClient withDatabase(final String databaseId) {
    return new DocumentDbClient(
        connection.withDatabase(databaseId), dispatcher, defaultOptions, userAgent);
  }

  /**
   * Returns a client bound to another collection of the current database.
   *
   * @param collectionId collection subsequent operations default to
   * @return new client
   */
  public DocumentDbClient withCollection(final String collectionId) {
    return new DocumentDbClient(
        connection.withCollection(collectionId), dispatcher, defaultOptions, userAgent);
  }

  public ResourceResponse createDatabase(final String databaseId) throws IOException {
    return createDatabase(databaseId, null);
  }

  /**
   * Creates a database.
   *
   * @param databaseId id of the new database
   * @param options session options
   * @return request charge and session token
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request, e.g. with 409 if it exists
   */
  public ResourceResponse createDatabase(final String databaseId, final RequestOptions options)
      throws IOException {
    requireId(databaseId, "databaseId");
    final var effective = resolve(options);
    final var request =
        ResourceRequest.of(HttpVerb.POST, "dbs", "", "dbs")
            .withHeaders(effective.sessionHeaders(userAgent))
            .withBody(json(Map.of("id", databaseId)))
            .withDeadline(effective.deadline());
    final var response = execute(request);
    logger.log(INFO, "Created database {0}", databaseId);
    return response;
  }

  public ResourceResponse deleteDatabase(final String databaseId) throws IOException {
    return deleteDatabase(databaseId, null);
  }

  public ResourceResponse deleteDatabase(final String databaseId, final RequestOptions options)
      throws IOException {
    final var link = ConnectionInfo.databaseLink(databaseId);
    final var response = execute(plain(HttpVerb.DELETE, "dbs", link, resolve(options)));
    logger.log(INFO, "Deleted database {0}", databaseId);
    return response;
  }

  public ExistsResponse existsDatabase(final String databaseId) throws IOException {
    return existsDatabase(databaseId, null);
  }

  /**
   * Checks whether a database exists.
   *
   * @param databaseId database to look for
   * @param options session options
   * @return {@code exists == false} if the service answered 404
   * @throws IOException if the transport fails
   * @throws QueryException if the service fails with a status other than 404
   */
  public ExistsResponse existsDatabase(final String databaseId, final RequestOptions options)
      throws IOException {
    return exists(
        plain(HttpVerb.GET, "dbs", ConnectionInfo.databaseLink(databaseId), resolve(options)));
  }

  public ResourceResponse createCollection(final String collectionId) throws IOException {
    return createCollection(collectionId, CollectionOptions.defaults(), null);
  }

  public ResourceResponse createCollection(
      final String collectionId, final CollectionOptions collectionOptions) throws IOException {
    return createCollection(collectionId, collectionOptions, null);
  }

  /**
   * Creates a collection in the current database.
   *
   * @param collectionId id of the new collection
   * @param collectionOptions throughput, partition key path and indexing policy
   * @param options session options
   * @return request charge and session token
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request
   */
  public ResourceResponse createCollection(
      final String collectionId,
      final CollectionOptions collectionOptions,
      final RequestOptions options)
      throws IOException {
    requireId(collectionId, "collectionId");
    final var settings =
        Objects.requireNonNullElseGet(collectionOptions, CollectionOptions::defaults);
    final var effective = resolve(options);
    final var databaseLink = connection.databaseLink();

    final var body = new LinkedHashMap<String, Object>();
    body.put("id", collectionId);
    if (settings.indexingPolicy() != null) body.put("indexingPolicy", settings.indexingPolicy());
    if (settings.partitionKeyPath() != null && !settings.partitionKeyPath().isBlank())
      body.put(
          "partitionKey", Map.of("paths", List.of(settings.partitionKeyPath()), "kind", "Hash"));

    final var headers = new LinkedHashMap<String, String>();
    if (settings.throughput() != null)
      headers.put(DocumentDbHeaders.OFFER_THROUGHPUT, String.valueOf(settings.throughput()));
    headers.putAll(effective.sessionHeaders(userAgent));

    final var request =
        ResourceRequest.of(HttpVerb.POST, "colls", databaseLink, databaseLink + "/colls")
            .withHeaders(headers)
            .withBody(json(body))
            .withDeadline(effective.deadline());
    final var response = execute(request);
    logger.log(INFO, "Created collection {0} in {1}", collectionId, databaseLink);
    return response;
  }

  public ResourceResponse deleteCollection(final String collectionId) throws IOException {
    return deleteCollection(collectionId, null);
  }

  public ResourceResponse deleteCollection(final String collectionId, final RequestOptions options)
      throws IOException {
    final var link = connection.collectionLink(collectionId);
    final var response = execute(plain(HttpVerb.DELETE, "colls", link, resolve(options)));
    logger.log(INFO, "Deleted collection {0}", link);
    return response;
  }

  public ExistsResponse existsCollection(final String collectionId) throws IOException {
    return existsCollection(collectionId, null);
  }

  public ExistsResponse existsCollection(final String collectionId, final RequestOptions options)
      throws IOException {
    return exists(
        plain(HttpVerb.GET, "colls", connection.collectionLink(collectionId), resolve(options)));
  }

  public ResourceListResponse getCollections() throws IOException {
    return getCollections(null);
  }

  /**
   * Lists the collections of the current database.
   *
   * @param options session options
   * @return collection resources as returned by the service
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request
   */
  public ResourceListResponse getCollections(final RequestOptions options) throws IOException {
    final var databaseLink = connection.databaseLink();
    final var effective = resolve(options);
    final var request =
        ResourceRequest.of(HttpVerb.GET, "colls", databaseLink, databaseLink + "/colls")
            .withHeaders(effective.sessionHeaders(userAgent))
            .withDeadline(effective.deadline());
    return list(dispatcher.execute(request), COLLECTIONS_FIELD);
  }

  public ResourceListResponse getOffers() throws IOException {
    return getOffers(null);
  }

  /**
   * Lists the offers of the account.
   *
   * @param options session options
   * @return offer resources as returned by the service
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request
   */
  public ResourceListResponse getOffers(final RequestOptions options) throws IOException {
    final var effective = resolve(options);
    final var request =
        ResourceRequest.of(HttpVerb.GET, "offers", "", "offers")
            .withHeaders(effective.sessionHeaders(userAgent))
            .withDeadline(effective.deadline());
    return list(dispatcher.execute(request), OFFERS_FIELD);
  }

  public ResourceResponse setCollectionThroughput(final int throughput) throws IOException {
    return setCollectionThroughput(connection.collectionId(), throughput, null);
  }

  /**
   * Switches a collection to user-defined throughput.
   *
   * <p>The collection and its current offer are looked up first. The requested value must be a
   * multiple of 100 and at least 400. Single-partition collections and offers of a version other
   * than V2 allow at most 10,000; partitioned collections require at least 10,100.
   *
   * @param collectionId collection of the current database
   * @param throughput request units per second
   * @param options user agent and deadline
   * @return request charge and session token of the update
   * @throws IOException if the transport fails
   * @throws IllegalStateException if the collection or its offer cannot be found
   * @throws IllegalArgumentException if the offer does not allow the requested throughput
   * @throws QueryException if the service rejects a request
   */
  public ResourceResponse setCollectionThroughput(
      final String collectionId, final int throughput, final RequestOptions options)
      throws IOException {
    requireId(collectionId, "collectionId");
    ThroughputRules.validate(throughput);

    final var collection =
        getCollections(options).resources().stream()
            .filter(c -> collectionId.equals(c.get("id")))
            .findFirst()
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "API did not return a collection with ID \"" + collectionId + "\""));
    final var collectionRid = String.valueOf(collection.get("_rid"));

    final var offer =
        getOffers(options).resources().stream()
            .filter(o -> collectionRid.equals(o.get("offerResourceId")))
            .findFirst()
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "API did not return an offer for collection with RID \""
                            + collectionRid
                            + "\""));

    ThroughputRules.validate(
        throughput,
        collectionId,
        Objects.toString(offer.get("offerVersion"), null),
        currentThroughput(offer));

    final var offerRid = String.valueOf(offer.get("_rid"));
    final var body = new LinkedHashMap<String, Object>();
    body.put("offerVersion", ThroughputRules.OFFER_VERSION_V2);
    body.put("offerType", "Invalid");
    body.put(
        "content", Map.of("offerThroughput", throughput, "userSpecifiedThroughput", throughput));
    body.put("resource", collection.get("_self"));
    body.put("offerResourceId", collectionRid);
    body.put("id", offerRid);
    body.put("_rid", offerRid);

    final var effective = resolve(options);
    final var request =
        ResourceRequest.of(
                HttpVerb.PUT, "offers", offerRid.toLowerCase(Locale.ROOT), "offers/" + offerRid)
            .withHeaders(
                Map.of(
                    DocumentDbHeaders.USER_AGENT,
                    Optional.ofNullable(effective.userAgent()).orElse(userAgent)))
            .withBody(json(body))
            .withDeadline(effective.deadline());
    final var response = execute(request);
    logger.log(INFO, "Set throughput of collection {0} to {1} RU/s", collectionId, throughput);
    return response;
  }

  private static Integer currentThroughput(final Map<String, Object> offer) {
    if (offer.get("content") instanceof Map<?, ?> content
        && content.get("offerThroughput") instanceof Number number) return number.intValue();
    return null;
  }

  public DocumentResponse getDocument(final String documentId) throws IOException {
    return getDocument(documentId, null);
  }

  /**
   * Reads a document of the current collection.
   *
   * @param documentId document id
   * @param options partition key (required for partitioned collections) and session options
   * @return the document
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request, e.g. with 404
   */
  public DocumentResponse getDocument(final String documentId, final RequestOptions options)
      throws IOException {
    final var effective = resolve(options);
    final var link = connection.documentLink(documentId);
    final var request =
        ResourceRequest.of(HttpVerb.GET, "docs", link, link)
            .withHeaders(documentHeaders(effective))
            .withDeadline(effective.deadline());
    final var response = dispatcher.execute(request);
    final var metadata = ResponseMetadata.from(response);
    return new DocumentResponse(
        readObject(response), metadata.requestCharge(), metadata.sessionToken());
  }

  public ResourceResponse upsertDocument(final Map<String, ?> document) throws IOException {
    return upsertDocument(document, null);
  }

  public ResourceResponse upsertDocument(
      final Map<String, ?> document, final RequestOptions options) throws IOException {
    Objects.requireNonNull(document, "document");
    return upsertDocument(json(document), options);
  }

  /**
   * Creates or replaces a document in the current collection.
   *
   * @param documentJson document as JSON object text, including its {@code id}
   * @param options partition key (required for partitioned collections) and session options
   * @return request charge and session token
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request
   */
  public ResourceResponse upsertDocument(final String documentJson, final RequestOptions options)
      throws IOException {
    if (documentJson == null || documentJson.isBlank())
      throw new IllegalArgumentException("document must not be blank");
    final var effective = resolve(options);
    final var collectionLink = connection.collectionLink();

    final var headers = new LinkedHashMap<String, String>();
    headers.put(DocumentDbHeaders.CONTENT_TYPE, DocumentDbHeaders.APPLICATION_JSON);
    headers.put(DocumentDbHeaders.IS_UPSERT, "True");
    headers.putAll(documentHeaders(effective));

    final var request =
        ResourceRequest.of(HttpVerb.POST, "docs", collectionLink, collectionLink + "/docs")
            .withHeaders(headers)
            .withBody(documentJson)
            .withDeadline(effective.deadline());
    return execute(request);
  }

  public ResourceResponse upsertDocuments(final List<? extends Map<String, ?>> documents)
      throws IOException {
    return upsertDocuments(documents, null, null);
  }

  /**
   * Upserts documents one after another. Each upsert uses the session token of the previous one.
   *
   * <p>Numeric ids are sent as their plain decimal text, e.g. {@code 10} or {@code 1500000}.
   *
   * @param documents documents to upsert, each with an {@code id}
   * @param partitionKeyField field holding each document's partition key value, or null
   * @param options session options applied to every upsert
   * @return summed request charge and the session token of the last upsert
   * @throws IOException if the transport fails
   * @throws IllegalArgumentException if a document has no id
   * @throws QueryException if the service rejects an upsert; earlier upserts stay applied
   */
  public ResourceResponse upsertDocuments(
      final List<? extends Map<String, ?>> documents,
      final String partitionKeyField,
      final RequestOptions options)
      throws IOException {
    Objects.requireNonNull(documents, "documents");
    final var effective = resolve(options);
    var requestCharge = 0.0;
    var sessionToken = effective.sessionToken();

    for (var i = 0; i < documents.size(); i++) {
      final var document = new LinkedHashMap<String, Object>(documents.get(i));
      final var id = document.get("id");
      if (id == null) throw new IllegalArgumentException("Document at index " + i + " has no id");
      document.put("id", idText(id));

      final var partitionKey =
          partitionKeyField == null || partitionKeyField.isBlank()
              ? effective.partitionKey()
              : Optional.ofNullable(document.get(partitionKeyField)).map(this::idText).orElse(null);

      final var result =
          upsertDocument(
              document,
              effective.toBuilder().partitionKey(partitionKey).sessionToken(sessionToken).build());
      requestCharge += result.requestCharge();
      if (result.sessionToken() != null) sessionToken = result.sessionToken();
    }

    logger.log(DEBUG, "Upserted {0} documents, {1} RU", documents.size(), requestCharge);
    return new ResourceResponse(requestCharge, sessionToken);
  }

  private String idText(final Object value) {
    if (value instanceof Number number)
      return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    return value.toString();
  }

  public ResourceResponse deleteDocument(final String documentId) throws IOException {
    return deleteDocument(documentId, null);
  }

  /**
   * Deletes a document of the current collection.
   *
   * @param documentId document id
   * @param options partition key (required for partitioned collections) and session options
   * @return request charge and session token
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the request, e.g. with 404
   */
  public ResourceResponse deleteDocument(final String documentId, final RequestOptions options)
      throws IOException {
    final var effective = resolve(options);
    final var link = connection.documentLink(documentId);
    final var request =
        ResourceRequest.of(HttpVerb.DELETE, "docs", link, link)
            .withHeaders(documentHeaders(effective))
            .withDeadline(effective.deadline());
    return execute(request);
  }

  public ResourceResponse deleteDocuments(final String predicate) throws IOException {
    return deleteDocuments(predicate, null);
  }

  /**
   * Deletes all documents matching a predicate, in batches of up to 1000 ids.
   *
   * @param predicate SQL condition on alias {@code c}, e.g. {@code c.value < 0.5}; null or blank
   *     deletes every document
   * @param options partition key and session options
   * @return summed request charge of queries and deletes, and the last session token
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects a request; earlier deletes stay applied
   */
  public ResourceResponse deleteDocuments(final String predicate, final RequestOptions options)
      throws IOException {
    final var effective = resolve(options).toBuilder().maxItemCount(DELETE_BATCH_SIZE).build();
    final var queryText =
        withPredicate("SELECT TOP " + DELETE_BATCH_SIZE + " c.id FROM c", predicate);
    var requestCharge = 0.0;
    var sessionToken = effective.sessionToken();
    var deleted = 0;

    while (true) {
      final var ids = selectDocuments(queryText, effective.withSessionToken(sessionToken));
      requestCharge += ids.requestCharge();
      if (ids.sessionToken() != null) sessionToken = ids.sessionToken();
      if (ids.isEmpty()) break;

      for (final var id : ids.values("id")) {
        if (id == null) continue;
        final var result = deleteDocument(idText(id), effective.withSessionToken(sessionToken));
        requestCharge += result.requestCharge();
        if (result.sessionToken() != null) sessionToken = result.sessionToken();
        deleted++;
      }
    }

    logger.log(INFO, "Deleted {0} documents from {1}", deleted, connection.collectionLink());
    return new ResourceResponse(requestCharge, sessionToken);
  }

  public CountResponse countDocuments(final String predicate) throws IOException {
    return countDocuments(predicate, null);
  }

  /**
   * Counts the documents matching a predicate.
   *
   * @param predicate SQL condition on alias {@code c}; null or blank counts every document
   * @param options partition key and session options
   * @return the count, summed over all partitions the service answered for
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects the query
   */
  public CountResponse countDocuments(final String predicate, final RequestOptions options)
      throws IOException {
    final var result =
        selectDocuments(withPredicate("SELECT VALUE COUNT(1) FROM c", predicate), options);
    final var count =
        result.values(QueryExecutor.SCALAR_FIELD).stream()
            .filter(Number.class::isInstance)
            .mapToLong(value -> ((Number) value).longValue())
            .sum();
    return new CountResponse(count, result.requestCharge(), result.sessionToken());
  }

  public QueryResult selectDocuments(final String queryText) throws IOException {
    return selectDocuments(queryText, null);
  }

  /**
   * Runs a SQL query against the current collection and returns the records of all pages.
   *
   * @param queryText SQL query text
   * @param options partition key, page size, session options and deadline
   * @return merged result
   * @throws IOException if the transport fails
   * @throws QueryException if the service rejects a page
   * @throws RateLimitedException if a page stays rate limited beyond the configured policy
   * @throws QueryCancelledException if the deadline passes or the thread is interrupted
   */
  public QueryResult selectDocuments(final String queryText, final RequestOptions options)
      throws IOException {
    return queryExecutor.execute(connection.collectionLink(), queryText, resolve(options));
  }


  private RequestOptions resolve(final RequestOptions options) {
    return options == null ? defaultOptions : options;
  }

  private ResourceRequest plain(
      final HttpVerb verb, final String type, final String link, final RequestOptions options) {
    return ResourceRequest.of(verb, type, link, link)
        .withHeaders(options.sessionHeaders(userAgent))
        .withDeadline(options.deadline());
  }

  private Map<String, String> documentHeaders(final RequestOptions options) throws IOException {
    final var headers = new LinkedHashMap<String, String>();
    headers.put(DocumentDbHeaders.PARTITION_KEY, options.partitionKeyHeader(mapper));
    headers.putAll(options.sessionHeaders(userAgent));
    return headers;
  }

  private ResourceResponse execute(final ResourceRequest request) throws IOException {
    return ResourceResponse.of(ResponseMetadata.from(dispatcher.execute(request)));
  }

  private ExistsResponse exists(final ResourceRequest request) throws IOException {
    final var response = dispatcher.send(request);
    final var metadata = ResponseMetadata.from(response);
    if (response.statusCode() == NOT_FOUND)
      return new ExistsResponse(false, metadata.requestCharge(), metadata.sessionToken());
    if (!response.isSuccess()) throw dispatcher.failure(response);
    return new ExistsResponse(true, metadata.requestCharge(), metadata.sessionToken());
  }

  private ResourceListResponse list(final TransportResponse response, final String field)
      throws IOException {
    final var metadata = ResponseMetadata.from(response);
    final var resources = new ArrayList<Map<String, Object>>();
    final JsonNode array =
        response.body().isBlank() ? null : mapper.readTree(response.body()).get(field);
    if (array != null && array.isArray())
      for (final var element : array) resources.add(mapper.convertValue(element, OBJECT_TYPE));
    return new ResourceListResponse(resources, metadata.requestCharge(), metadata.sessionToken());
  }

  private Map<String, Object> readObject(final TransportResponse response) throws IOException {
    if (response.body().isBlank()) return Map.of();
    return mapper.readValue(response.body(), OBJECT_TYPE);
  }

  private String json(final Object value) throws IOException {
    return mapper.writeValueAsString(value);
  }

  private static String withPredicate(final String queryText, final String predicate) {
    return predicate == null || predicate.isBlank() ? queryText : queryText + " WHERE " + predicate;
  }

  private static void requireId(final String id, final String name) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
  }

  /**
   * Builder for {@link DocumentDbClient} instances.
   *
   * <h3>Example: Tests</h3>
   *
   * <pre>{@code
   * var client = DocumentDbClient.builder()
   *     .accountUrl("https://localhost:8081")
   *     .masterKey(key)
   *     .transport(recordingTransport)
   *     .clock(Clock.fixed(Instant.parse("2017-04-27T00:51:12Z"), ZoneOffset.UTC))
   *     .sleeper(duration -> {})
   *     .build();
   * }</pre>
   */
  public static class Builder {
    private String accountUrl;
    private String databaseId;
    private String collectionId;
    private CredentialProvider credentials;
    private HttpTransport transport;
    private Clock clock = Clock.systemUTC();
    private RateLimitPolicy rateLimitPolicy;
    private Sleeper sleeper = Sleeper.threadSleep();
    private ObjectMapper mapper;
    private String userAgent;
    private ClientSettings settings;
    private RequestOptions defaultOptions;

    private Builder() {}

    /**
     * Sets the account endpoint, e.g. {@code https://myaccount.documents.azure.com}. Required unless
     * the key comes from a Secrets Manager secret that carries it.
     *
     * @param accountUrl account endpoint
     * @return this builder
     */
    public Builder accountUrl(final String accountUrl) {
      this.accountUrl = accountUrl;
      return this;
    }

    public Builder databaseId(final String databaseId) {
      this.databaseId = databaseId;
      return this;
    }

    public Builder collectionId(final String collectionId) {
      this.collectionId = collectionId;
      return this;
    }

    /**
     * Uses a fixed base64 master key, primary or secondary.
     *
     * @param masterKey base64 master key
     * @return this builder
     */
    public Builder masterKey(final String masterKey) {
      this.credentials = new StaticCredentialProvider(masterKey);
      return this;
    }

    /**
     * Reads account URL and master keys from an AWS Secrets Manager secret. See {@link
     * com.example.documentdb.core.secrets.AccountSecret} for the expected format.
     *
     * @param secretId the secret identifier
     * @return this builder
     */
    public Builder secretsManagerSecret(final String secretId) {
      this.credentials = new SecretsManagerCredentialProvider(secretId);
      return this;
    }

    public Builder credentials(final CredentialProvider credentials) {
      this.credentials = credentials;
      return this;
    }

    /**
     * Sets the HTTP transport.
     *
     * <p>Default: {@link JdkHttpTransport} with the timeout of the client settings
     *
     * @param transport transport
     * @return this builder
     */
    public Builder transport(final HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the clock used for request timestamps and deadlines.
     *
     * <p>Default: {@link Clock#systemUTC()}
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the policy for rate-limited (429) responses.
     *
     * <p>Default: the policy of the client settings, 9 retries within 30 seconds
     *
     * @param rateLimitPolicy policy
     * @return this builder
     */
    public Builder rateLimitPolicy(final RateLimitPolicy rateLimitPolicy) {
      this.rateLimitPolicy = rateLimitPolicy;
      return this;
    }

    public Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder mapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    public Builder userAgent(final String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /**
     * Sets the client settings.
     *
     * <p>Default: {@link ClientSettings#fromEnvironment()}
     *
     * @param settings settings
     * @return this builder
     */
    public Builder settings(final ClientSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the options used by operations called without options.
     *
     * @param defaultOptions default request options
     * @return this builder
     */
    public Builder defaultOptions(final RequestOptions defaultOptions) {
      this.defaultOptions = defaultOptions;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return configured client
     * @throws IllegalStateException if required fields are not set
     */
    public DocumentDbClient build() {
      if (credentials == null)
        throw new IllegalStateException(
            "masterKey, secretsManagerSecret or credentials is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (sleeper == null) throw new IllegalStateException("sleeper cannot be null");

      final var effectiveSettings =
          Optional.ofNullable(settings).orElseGet(ClientSettings::fromEnvironment);
      final var url =
          Optional.ofNullable(accountUrl)
              .filter(u -> !u.isBlank())
              .or(this::accountUrlFromSecret)
              .orElseThrow(() -> new IllegalStateException("accountUrl is required"));
      final var agent =
          Optional.ofNullable(userAgent)
              .or(() -> Optional.ofNullable(effectiveSettings.userAgent()))
              .orElse("");

      final var dispatcher =
          new RequestDispatcher(
              url,
              Optional.ofNullable(transport)
                  .orElseGet(() -> JdkHttpTransport.create(effectiveSettings.httpTimeout())),
              credentials,
              clock,
              Optional.ofNullable(rateLimitPolicy).orElse(effectiveSettings.rateLimitPolicy()),
              sleeper,
              Optional.ofNullable(mapper).orElseGet(ObjectMapper::new));

      final var options =
          Optional.ofNullable(defaultOptions)
              .orElseGet(
                  () ->
                      RequestOptions.builder()
                          .maxItemCount(effectiveSettings.maxItemCount())
                          .build());

      return new DocumentDbClient(
          new ConnectionInfo(url, databaseId, collectionId), dispatcher, options, agent);
    }

    private Optional<String> accountUrlFromSecret() {
      if (credentials instanceof SecretsManagerCredentialProvider provider)
        return Optional.ofNullable(provider.secret().accountUrl()).filter(u -> !u.isBlank());
      return Optional.empty();
    }
  }
}
