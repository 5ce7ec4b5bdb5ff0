package com.example.documentdb.core.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;

/** {@link HttpTransport} backed by the JDK {@link HttpClient}. */
public final class JdkHttpTransport implements HttpTransport {

  private final HttpClient client;
  private final Duration requestTimeout;

  public JdkHttpTransport(final HttpClient client, final Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  /**
   * Creates a transport with its own HTTP/1.1 client.
   *
   * @param requestTimeout timeout applied to connecting and to each request
   * @return new transport
   */
  public static JdkHttpTransport create(final Duration requestTimeout) {
    return new JdkHttpTransport(
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(requestTimeout)
            .build(),
        requestTimeout);
  }

  @Override
  public TransportResponse send(final TransportRequest request) throws IOException {
    final var builder = HttpRequest.newBuilder(request.uri()).timeout(requestTimeout);
    request
        .headers()
        .forEach(
            (name, value) -> {
              if (!value.isEmpty()) builder.header(name, value);
            });
    builder.method(
        request.method().name(),
        request.body() == null
            ? BodyPublishers.noBody()
            : BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8));

    try {
      final var response =
          client.send(builder.build(), BodyHandlers.ofString(StandardCharsets.UTF_8));
      final var headers = new LinkedHashMap<String, String>();
      response
          .headers()
          .map()
          .forEach(
              (name, values) -> {
                if (!values.isEmpty()) headers.put(name, values.get(0));
              });
      return new TransportResponse(response.statusCode(), headers, response.body());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      final var interrupted =
          new InterruptedIOException("Interrupted while waiting for " + request.uri());
      interrupted.initCause(e);
      throw interrupted;
    }
  }
}
