package com.example.documentdb.core;

import java.util.Objects;

/**
 * Account endpoint plus the database and collection operations default to.
 *
 * @param accountUrl account endpoint, e.g. {@code https://myaccount.documents.azure.com}
 * @param databaseId default database, or null for account level work
 * @param collectionId default collection, or null for database level work
 */
public record ConnectionInfo(String accountUrl, String databaseId, String collectionId) {

  public ConnectionInfo {
    Objects.requireNonNull(accountUrl, "accountUrl");
    if (accountUrl.isBlank()) throw new IllegalArgumentException("accountUrl must not be blank");
  }

  public ConnectionInfo withDatabase(final String newDatabaseId) {
    return new ConnectionInfo(accountUrl, newDatabaseId, collectionId);
  }

  public ConnectionInfo withCollection(final String newCollectionId) {
    return new ConnectionInfo(accountUrl, databaseId, newCollectionId);
  }

  /** {@code dbs/{databaseId}} */
  public String databaseLink() {
    return databaseLink(requireId(databaseId, "databaseId"));
  }

  /** {@code dbs/{databaseId}/colls/{collectionId}} */
  public String collectionLink() {
    return collectionLink(requireId(collectionId, "collectionId"));
  }

  public String collectionLink(final String collection) {
    return databaseLink() + "/colls/" + requireId(collection, "collectionId");
  }

  /** {@code dbs/{databaseId}/colls/{collectionId}/docs/{documentId}} */
  public String documentLink(final String documentId) {
    return collectionLink() + "/docs/" + requireId(documentId, "documentId");
  }

  static String databaseLink(final String database) {
    return "dbs/" + requireId(database, "databaseId");
  }

  private static String requireId(final String id, final String name) {
    if (id == null || id.isBlank()) throw new IllegalStateException(name + " is required");
    return id;
  }
}
