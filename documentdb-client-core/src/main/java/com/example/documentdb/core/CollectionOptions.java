package com.example.documentdb.core;

import java.util.Map;

/**
 * Settings of a new collection.
 *
 * @param throughput provisioned request units per second, or null for the service default
 * @param partitionKeyPath partition key path such as {@code /tenantId}, or null for a single
 *     partition collection
 * @param indexingPolicy indexing policy document, or null for the default policy
 */
public record CollectionOptions(
    Integer throughput, String partitionKeyPath, Map<String, Object> indexingPolicy) {

  public CollectionOptions {
    if (throughput != null && throughput < 400)
      throw new IllegalArgumentException("throughput must be at least 400");
    indexingPolicy = indexingPolicy == null ? null : Map.copyOf(indexingPolicy);
  }

  public static CollectionOptions defaults() {
    return new CollectionOptions(null, null, null);
  }

  public CollectionOptions withThroughput(final Integer newThroughput) {
    return new CollectionOptions(newThroughput, partitionKeyPath, indexingPolicy);
  }

  public CollectionOptions withPartitionKeyPath(final String path) {
    return new CollectionOptions(throughput, path, indexingPolicy);
  }

  public CollectionOptions withIndexingPolicy(final Map<String, Object> policy) {
    return new CollectionOptions(throughput, partitionKeyPath, policy);
  }
}
