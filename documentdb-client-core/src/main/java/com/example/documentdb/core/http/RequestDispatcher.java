package com.example.documentdb.core.http;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.documentdb.core.QueryCancelledException;
import com.example.documentdb.core.QueryException;
import com.example.documentdb.core.RateLimitedException;
import com.example.documentdb.core.RemoteError;
import com.example.documentdb.core.auth.CredentialProvider;
import com.example.documentdb.core.auth.HttpDates;
import com.example.documentdb.core.auth.RequestSigner;
import com.example.documentdb.core.auth.SigningRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.lang.System.Logger;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Signs and sends {@link ResourceRequest}s.
 *
 * <p>Every attempt is signed with a fresh timestamp taken from the injected clock. Responses with
 * status 429 are retried after the delay the service asks for, as long as the {@link
 * RateLimitPolicy} allows it. A 401 is retried once if the {@link CredentialProvider} reports a
 * refreshed key. All other responses are handed back to the caller.
 */
public final class RequestDispatcher {

  private static final Logger logger = System.getLogger(RequestDispatcher.class.getName());

  static final int UNAUTHORIZED = 401;
  static final int TOO_MANY_REQUESTS = 429;

  private final String accountUrl;
  private final HttpTransport transport;
  private final CredentialProvider credentials;
  private final Clock clock;
  private final RateLimitPolicy rateLimitPolicy;
  private final Sleeper sleeper;
  private final ObjectMapper mapper;

  public RequestDispatcher(
      final String accountUrl,
      final HttpTransport transport,
      final CredentialProvider credentials,
      final Clock clock,
      final RateLimitPolicy rateLimitPolicy,
      final Sleeper sleeper,
      final ObjectMapper mapper) {
    this.accountUrl = stripTrailingSlashes(Objects.requireNonNull(accountUrl, "accountUrl"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.rateLimitPolicy = Objects.requireNonNull(rateLimitPolicy, "rateLimitPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Sends the request and returns the first response that is neither rate limited nor a
   * recoverable authorization failure.
   *
   * @param request request to send
   * @return response, successful or not
   * @throws IOException if the transport fails
   * @throws RateLimitedException if the rate-limit policy is exhausted
   * @throws QueryCancelledException if the deadline passed or the thread was interrupted
   */
  public TransportResponse send(final ResourceRequest request) throws IOException {
    var retries = 0;
    var waited = Duration.ZERO;
    var refreshed = false;

    while (true) {
      checkDeadline(request);
      final var response = transport.send(sign(request));
      logger.log(
          DEBUG, "{0} {1} -> {2}", request.verb(), request.path(), response.statusCode());

      if (response.statusCode() == TOO_MANY_REQUESTS) {
        final var retryAfter = retryAfter(response);
        if (!rateLimitPolicy.allowsRetry(retries, waited, retryAfter)) {
          logger.log(
              WARNING,
              "Giving up on {0} {1} after {2} rate-limited retries",
              request.verb(),
              request.path(),
              retries);
          throw new RateLimitedException(retries, retryAfter);
        }
        retries++;
        waited = waited.plus(retryAfter);
        logger.log(
            WARNING,
            "{0} {1} rate limited, retry {2} in {3} ms",
            request.verb(),
            request.path(),
            retries,
            retryAfter.toMillis());
        pause(retryAfter);
        continue;
      }

      if (response.statusCode() == UNAUTHORIZED && !refreshed && credentials.refresh()) {
        refreshed = true;
        logger.log(
            INFO, "{0} {1} unauthorized, retrying with refreshed key", request.verb(), request.path());
        continue;
      }

      return response;
    }
  }

  /**
   * Sends the request and fails unless the response is successful.
   *
   * @param request request to send
   * @return successful response
   * @throws IOException if the transport fails
   * @throws QueryException if the service answers with a non-2xx status
   */
  public TransportResponse execute(final ResourceRequest request) throws IOException {
    final var response = send(request);
    if (!response.isSuccess()) throw failure(response);
    return response;
  }

  /**
   * Translates a failed response into a {@link QueryException}.
   *
   * @param response non-successful response
   * @return exception carrying the decoded remote error
   */
  public QueryException failure(final TransportResponse response) {
    return new QueryException(
        response.statusCode(),
        RemoteError.decode(response.statusCode(), response.body(), mapper));
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  public String accountUrl() {
    return accountUrl;
  }

  TransportRequest sign(final ResourceRequest request) {
    final var date = HttpDates.now(clock);
    final var token =
        RequestSigner.sign(
            SigningRequest.master(
                request.verb(),
                request.resourceType(),
                request.resourceLink(),
                date,
                credentials.masterKey()));

    final var headers = new LinkedHashMap<String, String>();
    headers.put(DocumentDbHeaders.ACCEPT, DocumentDbHeaders.APPLICATION_JSON);
    headers.putAll(request.headers());
    headers.put(DocumentDbHeaders.AUTHORIZATION, token);
    headers.put(DocumentDbHeaders.DATE, date);
    headers.put(DocumentDbHeaders.VERSION, DocumentDbHeaders.API_VERSION);
    return new TransportRequest(request.verb(), uriFor(request.path()), headers, request.body());
  }

  private URI uriFor(final String path) {
    final var encoded =
        Arrays.stream(path.split("/"))
            .filter(segment -> !segment.isEmpty())
            .map(RequestSigner::percentEncode)
            .collect(Collectors.joining("/"));
    return URI.create(accountUrl + "/" + encoded);
  }

  private void checkDeadline(final ResourceRequest request) {
    if (request.deadline() != null && !clock.instant().isBefore(request.deadline()))
      throw new QueryCancelledException(
          "Deadline %s passed before %s %s could be sent"
              .formatted(request.deadline(), request.verb(), request.path()));
  }

  private void pause(final Duration duration) {
    if (duration.isZero()) return;
    try {
      sleeper.sleep(duration);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException("Interrupted while backing off from a rate limit", e);
    }
  }

  private static Duration retryAfter(final TransportResponse response) {
    return response
        .header(DocumentDbHeaders.RETRY_AFTER_MS)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(
            value -> {
              try {
                return Duration.ofMillis(Math.max(0L, (long) Double.parseDouble(value)));
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring unparseable retry delay: {0}", value);
                return Duration.ZERO;
              }
            })
        .orElse(Duration.ZERO);
  }

  private static String stripTrailingSlashes(final String url) {
    var result = url.trim();
    while (result.endsWith("/")) result = result.substring(0, result.length() - 1);
    if (result.isEmpty()) throw new IllegalArgumentException("accountUrl must not be blank");
    return result;
  }
}
