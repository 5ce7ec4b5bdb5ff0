package com.example.documentdb.core.query;

import com.example.documentdb.core.http.DocumentDbHeaders;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-request options shared by queries and resource operations.
 *
 * @param partitionKey partition key value the request is limited to, or null
 * @param enableCrossPartitionQuery whether a query may fan out over partitions; null means
 *     "enabled unless a partition key is given"
 * @param maxItemCount page size hint sent as {@code x-ms-max-item-count}
 * @param consistencyLevel consistency level override passed through verbatim, or null
 * @param sessionToken session token for session consistency, or null
 * @param userAgent user agent overriding the client default, or null
 * @param deadline instant after which no further request is sent, or null
 */
public record RequestOptions(
    String partitionKey,
    Boolean enableCrossPartitionQuery,
    int maxItemCount,
    String consistencyLevel,
    String sessionToken,
    String userAgent,
    Instant deadline) {

  public static final int DEFAULT_MAX_ITEM_COUNT = 100;

  public RequestOptions {
    if (maxItemCount < 1 && maxItemCount != -1)
      throw new IllegalArgumentException("maxItemCount must be >= 1 or -1 for service default");
  }

  public static RequestOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .partitionKey(partitionKey)
        .enableCrossPartitionQuery(enableCrossPartitionQuery)
        .maxItemCount(maxItemCount)
        .consistencyLevel(consistencyLevel)
        .sessionToken(sessionToken)
        .userAgent(userAgent)
        .deadline(deadline);
  }

  public RequestOptions withSessionToken(final String token) {
    return toBuilder().sessionToken(token).build();
  }

  public boolean hasPartitionKey() {
    return partitionKey != null && !partitionKey.isEmpty();
  }

  public boolean crossPartitionEnabled() {
    return Optional.ofNullable(enableCrossPartitionQuery).orElse(!hasPartitionKey());
  }

  /**
   * Encodes the partition key as the JSON array the service expects, e.g. {@code ["tenant-1"]}.
   *
   * @param mapper mapper used for encoding
   * @return encoded partition key, or an empty string when none is set
   * @throws JsonProcessingException if encoding fails
   */
  public String partitionKeyHeader(final ObjectMapper mapper) throws JsonProcessingException {
    return hasPartitionKey() ? mapper.writeValueAsString(List.of(partitionKey)) : "";
  }

  /**
   * Headers carrying consistency level, session token and user agent. Unset values map to empty
   * strings, which transports leave off the wire.
   *
   * @param defaultUserAgent user agent used when none is set on these options
   * @return header map
   */
  public Map<String, String> sessionHeaders(final String defaultUserAgent) {
    final var headers = new LinkedHashMap<String, String>();
    headers.put(DocumentDbHeaders.CONSISTENCY_LEVEL, orEmpty(consistencyLevel));
    headers.put(DocumentDbHeaders.SESSION_TOKEN, orEmpty(sessionToken));
    headers.put(
        DocumentDbHeaders.USER_AGENT,
        orEmpty(Optional.ofNullable(userAgent).orElse(defaultUserAgent)));
    return headers;
  }

  private static String orEmpty(final String value) {
    return value == null ? "" : value;
  }

  /** Fluent builder for {@link RequestOptions}. */
  public static final class Builder {
    private String partitionKey;
    private Boolean enableCrossPartitionQuery;
    private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;
    private String consistencyLevel;
    private String sessionToken;
    private String userAgent;
    private Instant deadline;

    private Builder() {}

    public Builder partitionKey(final String partitionKey) {
      this.partitionKey = partitionKey;
      return this;
    }

    public Builder enableCrossPartitionQuery(final Boolean enableCrossPartitionQuery) {
      this.enableCrossPartitionQuery = enableCrossPartitionQuery;
      return this;
    }

    public Builder maxItemCount(final int maxItemCount) {
      this.maxItemCount = maxItemCount;
      return this;
    }

    /**
     * Sets the consistency level override: Strong, BoundedStaleness, Session or Eventual. It must
     * be the same as or weaker than the account's configured level.
     *
     * @param consistencyLevel consistency level
     * @return this builder
     */
    public Builder consistencyLevel(final String consistencyLevel) {
      this.consistencyLevel = consistencyLevel;
      return this;
    }

    public Builder sessionToken(final String sessionToken) {
      this.sessionToken = sessionToken;
      return this;
    }

    public Builder userAgent(final String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder deadline(final Instant deadline) {
      this.deadline = deadline;
      return this;
    }

    public RequestOptions build() {
      return new RequestOptions(
          partitionKey,
          enableCrossPartitionQuery,
          maxItemCount,
          consistencyLevel,
          sessionToken,
          userAgent,
          deadline);
    }
  }
}
