package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.documentdb.core.DocumentDbClient;
import com.example.documentdb.core.query.QueryResult;
import com.example.documentdb.core.query.RequestOptions;
import java.io.IOException;
import java.util.Map;

/** Demo application querying a DocumentDB collection with a key kept in AWS Secrets Manager. */
public class App {
  private final DocumentDbClient client;

  /**
   * Constructs the application with a client whose account URL and master key come from AWS
   * Secrets Manager.
   *
   * @param secretId the secret identifier to load from AWS Secrets Manager
   * @param databaseId database holding the collection
   * @param collectionId collection to query
   */
  public App(final String secretId, final String databaseId, final String collectionId) {
    this(
        DocumentDbClient.builder()
            .secretsManagerSecret(secretId)
            .databaseId(databaseId)
            .collectionId(collectionId)
            .userAgent("documentdb-query-app")
            .build());
  }

  /**
   * Constructs the application around an existing client.
   *
   * @param client client bound to a database and collection
   */
  public App(final DocumentDbClient client) {
    this.client = client;
  }

  /**
   * Entry point. Upserts a sample item, then prints the open items and their count.
   *
   * @param args optional secret id, database id and collection id
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {

    final var logger = System.getLogger(App.class.getName());

    final var app =
        new App(
            args.length > 0 ? args[0] : "documentdb/account",
            args.length > 1 ? args[1] : "ToDoList",
            args.length > 2 ? args[2] : "Items");

    app.addItem("1", "Buy milk", "home");
    final var items = app.openItems("home");
    logger.log(
        INFO,
        "Open items = {0} ({1} RU over {2} pages)",
        items.size(),
        items.requestCharge(),
        items.pageCount());
    logger.log(INFO, "Open item count = {0}", app.countOpenItems());
  }

  /**
   * Creates or replaces a to-do item.
   *
   * @param id item id
   * @param description item text
   * @param category partition key value
   * @throws IOException if the service cannot be reached
   */
  public void addItem(final String id, final String description, final String category)
      throws IOException {
    client.upsertDocument(
        Map.of("id", id, "description", description, "category", category, "isComplete", false),
        RequestOptions.builder().partitionKey(category).build());
  }

  /**
   * Reads every open item of one category, following continuation tokens.
   *
   * @param category partition key value
   * @return merged query result
   * @throws IOException if the service cannot be reached
   */
  public QueryResult openItems(final String category) throws IOException {
    return client.selectDocuments(
        "SELECT c.id, c.description FROM c WHERE c.isComplete = false",
        RequestOptions.builder().partitionKey(category).build());
  }

  /**
   * Counts open items across all partitions.
   *
   * @return number of open items
   * @throws IOException if the service cannot be reached
   */
  public long countOpenItems() throws IOException {
    return client.countDocuments("c.isComplete = false").count();
  }
}
