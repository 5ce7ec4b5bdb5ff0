package com.example.documentdb.core.http;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.documentdb.core.QueryException;
import com.example.documentdb.core.auth.CredentialProvider;
import com.example.documentdb.core.auth.HttpVerb;
import com.example.documentdb.core.auth.StaticCredentialProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RequestDispatcherTest {

  private static final String PRIMARY =
      "t0C36UstTJ4c6vdkFyImkaoB6L1yeQidadg6wasSwmaK2s8JxFbEXQ0e3AW9KE1xQqmOn0WtOi3lxloStmSeeg==";
  private static final String SECONDARY =
      "dsZQi3KtZmCv1ljt3VNWNm7sQUF1y5rJfC6kv5JiwvW0EndXdDku/dkKBp8/ufDToSxLzR4y+O/0H/t4bQtVNw==";

  private ScriptedTransport transport;
  private TestClock clock;

  @BeforeEach
  void setup() {
    transport = new ScriptedTransport();
    clock = new TestClock(Instant.parse("2017-04-27T00:51:12Z"));
  }

  private RequestDispatcher dispatcher(final CredentialProvider credentials) {
    return new RequestDispatcher(
        "https://acct.documents.azure.com//",
        transport,
        credentials,
        clock,
        RateLimitPolicy.defaults(),
        duration -> {},
        new ObjectMapper());
  }

  @Nested
  @DisplayName("Signing")
  class Signing {

    @Test
    @DisplayName("Should add common headers and the documented authorization token")
    void shouldSignWithCommonHeaders() {
      final var signed =
          dispatcher(new StaticCredentialProvider(PRIMARY))
              .sign(ResourceRequest.of(HttpVerb.GET, "dbs", "dbs/ToDoList", "dbs/ToDoList"));

      assertEquals(URI.create("https://acct.documents.azure.com/dbs/ToDoList"), signed.uri());
      assertEquals(
          List.of(
              DocumentDbHeaders.ACCEPT,
              DocumentDbHeaders.AUTHORIZATION,
              DocumentDbHeaders.DATE,
              DocumentDbHeaders.VERSION),
          List.copyOf(signed.headers().keySet()));
      assertEquals(
          "type%3dmaster%26ver%3d1.0%26sig%3dYmWrgx2T5omYhtVfCRiQk6ozkK2ll5kzw5MSEWSUj58%3D",
          signed.header(DocumentDbHeaders.AUTHORIZATION).orElseThrow());
      assertNull(signed.body());
    }

    @Test
    @DisplayName("Should percent-encode path segments")
    void shouldEncodePathSegments() {
      final var signed =
          dispatcher(new StaticCredentialProvider(PRIMARY))
              .sign(
                  ResourceRequest.of(
                      HttpVerb.GET,
                      "docs",
                      "dbs/db/colls/c/docs/a b",
                      "dbs/db/colls/c/docs/a b"));

      assertEquals(
          "https://acct.documents.azure.com/dbs/db/colls/c/docs/a%20b", signed.uri().toString());
    }

    @Test
    @DisplayName("Should reject a blank account URL")
    void shouldRejectBlankAccountUrl() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new RequestDispatcher(
                  "//",
                  transport,
                  new StaticCredentialProvider(PRIMARY),
                  clock,
                  RateLimitPolicy.defaults(),
                  duration -> {},
                  new ObjectMapper()));
    }
  }

  @Nested
  @DisplayName("Unauthorized responses")
  class Unauthorized {

    @Test
    @DisplayName("Should retry once with a refreshed key")
    void shouldRetryWithRefreshedKey() throws IOException {
      final var credentials = mock(CredentialProvider.class);
      when(credentials.masterKey()).thenReturn(PRIMARY, SECONDARY);
      when(credentials.refresh()).thenReturn(true);
      transport.respond(401, "{\"code\":\"Unauthorized\",\"message\":\"bad key\"}");
      transport.respond(200, Map.of(DocumentDbHeaders.REQUEST_CHARGE, "1"), "{}");

      final var response =
          dispatcher(credentials)
              .execute(ResourceRequest.of(HttpVerb.GET, "dbs", "dbs/ToDoList", "dbs/ToDoList"));

      assertEquals(200, response.statusCode());
      assertEquals(2, transport.requests().size());
      assertNotEquals(
          transport.request(0).header(DocumentDbHeaders.AUTHORIZATION),
          transport.request(1).header(DocumentDbHeaders.AUTHORIZATION));
      verify(credentials, times(1)).refresh();
    }

    @Test
    @DisplayName("Should not retry a second time")
    void shouldRetryOnlyOnce() {
      final var credentials = mock(CredentialProvider.class);
      when(credentials.masterKey()).thenReturn(PRIMARY);
      when(credentials.refresh()).thenReturn(true);
      transport.otherwise(
          request ->
              new TransportResponse(
                  401, Map.of(), "{\"code\":\"Unauthorized\",\"message\":\"bad key\"}"));

      final var exception =
          assertThrows(
              QueryException.class,
              () ->
                  dispatcher(credentials)
                      .execute(
                          ResourceRequest.of(HttpVerb.GET, "dbs", "dbs/ToDoList", "dbs/ToDoList")));

      assertEquals(401, exception.statusCode());
      assertEquals(2, transport.requests().size());
    }

    @Test
    @DisplayName("Should hand back a 401 when the key cannot be refreshed")
    void shouldReturnUnauthorizedWithoutRefresh() throws IOException {
      transport.respond(401, "{\"code\":\"Unauthorized\",\"message\":\"bad key\"}");

      final var response =
          dispatcher(new StaticCredentialProvider(PRIMARY))
              .send(ResourceRequest.of(HttpVerb.GET, "dbs", "dbs/ToDoList", "dbs/ToDoList"));

      assertEquals(401, response.statusCode());
      assertEquals(1, transport.requests().size());
    }
  }

  @Nested
  @DisplayName("Errors")
  class Errors {

    @Test
    @DisplayName("Should fall back to status and raw body for non-JSON errors")
    void shouldTranslateNonJsonError() {
      transport.respond(503, "Service Unavailable");

      final var exception =
          assertThrows(
              QueryException.class,
              () ->
                  dispatcher(new StaticCredentialProvider(PRIMARY))
                      .execute(ResourceRequest.of(HttpVerb.GET, "offers", "", "offers")));

      assertEquals("503", exception.error().code());
      assertEquals("Service Unavailable", exception.error().message());
    }

    @Test
    @DisplayName("Should not include the key or token in error messages")
    void shouldNotLeakSecrets() {
      transport.respond(403, "{\"code\":\"Forbidden\",\"message\":\"denied\"}");

      final var exception =
          assertThrows(
              QueryException.class,
              () ->
                  dispatcher(new StaticCredentialProvider(PRIMARY))
                      .execute(ResourceRequest.of(HttpVerb.GET, "offers", "", "offers")));

      assertFalse(exception.getMessage().contains(PRIMARY));
      assertFalse(exception.getMessage().contains("sig%3d"));
    }
  }
}
