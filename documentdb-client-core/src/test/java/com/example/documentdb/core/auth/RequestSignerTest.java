package com.example.documentdb.core.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.example.documentdb.core.AuthenticationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RequestSignerTest {

  private static final String DOCS_KEY =
      "dsZQi3KtZmCv1ljt3VNWNm7sQUF1y5rJfC6kv5JiwvW0EndXdDku/dkKBp8/ufDToSxLzR4y+O/0H/t4bQtVNw==";
  private static final String SAMPLE_KEY =
      "t0C36UstTJ4c6vdkFyImkaoB6L1yeQidadg6wasSwmaK2s8JxFbEXQ0e3AW9KE1xQqmOn0WtOi3lxloStmSeeg==";
  private static final String DATE = "Thu, 27 Apr 2017 00:51:12 GMT";

  @Nested
  @DisplayName("Known tokens")
  class KnownTokens {

    @Test
    @DisplayName("Should reproduce the documented token for GET dbs/ToDoList")
    void shouldReproduceDocumentedToken() {
      assertEquals(
          "type%3dmaster%26ver%3d1.0%26sig%3dc09PEVJrgp2uQRkr934kFbTqhByc7TVr3OHyqlu%2Bc%2Bc%3D",
          RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, DOCS_KEY));
    }

    @Test
    @DisplayName("Should sign another database link with the same key")
    void shouldSignOtherDatabase() {
      assertEquals(
          "type%3dmaster%26ver%3d1.0%26sig%3dn4zmA2qm8%2F9n8LOwUJa8chj%2BuWjrdioNOMhNJbe04B0%3D",
          RequestSigner.sign("GET", "dbs", "dbs/MyDatabase", DATE, DOCS_KEY));
    }

    @Test
    @DisplayName("Should sign account level requests with an empty resource link")
    void shouldSignEmptyResourceLink() {
      assertEquals(
          "type%3dmaster%26ver%3d1.0%26sig%3dqVLOmZckRJPb31xHCdjkZjNGdjDR07mdAmqFmpECH8k%3D",
          RequestSigner.sign("POST", "dbs", "", DATE, SAMPLE_KEY));
    }

    @Test
    @DisplayName("Should sign a query against a collection")
    void shouldSignCollectionQuery() {
      assertEquals(
          "type%3dmaster%26ver%3d1.0%26sig%3d2A%2BMrHhZT1p8H52gJQMEBeXASNXUusGc7JLiRPx%2Fsjk%3D",
          RequestSigner.sign(
              "POST",
              "docs",
              "dbs/ToDoList/colls/Items",
              "Tue, 01 Jan 2020 00:00:00 GMT",
              SAMPLE_KEY));
    }

    @Test
    @DisplayName("Should give the same token for a SigningRequest as for plain arguments")
    void shouldAcceptSigningRequest() {
      final var request =
          SigningRequest.master(HttpVerb.GET, "dbs", "dbs/ToDoList", DATE, DOCS_KEY);
      assertEquals(
          RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, DOCS_KEY),
          RequestSigner.sign(request));
    }
  }

  @Nested
  @DisplayName("Normalization")
  class Normalization {

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
      final var first = RequestSigner.sign("GET", "docs", "dbs/a/colls/b", DATE, SAMPLE_KEY);
      final var second = RequestSigner.sign("GET", "docs", "dbs/a/colls/b", DATE, SAMPLE_KEY);
      assertEquals(first, second);
    }

    @Test
    @DisplayName("Should ignore the case of verb, resource type and date")
    void shouldFoldCase() {
      assertEquals(
          RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, DOCS_KEY),
          RequestSigner.sign("get", "DBS", "dbs/ToDoList", DATE.toUpperCase(), DOCS_KEY));
    }

    @Test
    @DisplayName("Should keep the case of the resource link")
    void shouldKeepResourceLinkCase() {
      assertNotEquals(
          RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, DOCS_KEY),
          RequestSigner.sign("GET", "dbs", "dbs/todolist", DATE, DOCS_KEY));
    }

    @Test
    @DisplayName("Should lower-case only the token prefix")
    void shouldLowerCasePrefixOnly() {
      final var token = RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, DOCS_KEY);
      assertTrue(token.startsWith("type%3dmaster%26ver%3d1.0%26sig%3d"));
      assertTrue(token.endsWith("%3D"));
    }
  }

  @Nested
  @DisplayName("Percent encoding")
  class PercentEncoding {

    @Test
    @DisplayName("Should encode reserved characters with upper-case hex")
    void shouldEncodeReserved() {
      assertEquals("a%2Bb%2Fc%3D", RequestSigner.percentEncode("a+b/c="));
    }

    @Test
    @DisplayName("Should encode spaces and asterisks but keep unreserved characters")
    void shouldEncodeSpacesAndAsterisks() {
      assertEquals("a%20b%2Ac-d_e.f~g", RequestSigner.percentEncode("a b*c-d_e.f~g"));
    }
  }

  @Nested
  @DisplayName("Invalid input")
  class InvalidInput {

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "PATCH", "FETCH"})
    @DisplayName("Should reject empty or unknown verbs")
    void shouldRejectVerb(final String verb) {
      assertThrows(
          AuthenticationException.class,
          () -> RequestSigner.sign(verb, "dbs", "dbs/ToDoList", DATE, DOCS_KEY));
    }

    @Test
    @DisplayName("Should reject an empty resource type")
    void shouldRejectEmptyResourceType() {
      assertThrows(
          AuthenticationException.class,
          () -> RequestSigner.sign("GET", "", "dbs/ToDoList", DATE, DOCS_KEY));
    }

    @Test
    @DisplayName("Should reject an empty date")
    void shouldRejectEmptyDate() {
      assertThrows(
          AuthenticationException.class,
          () -> RequestSigner.sign("GET", "dbs", "dbs/ToDoList", "", DOCS_KEY));
    }

    @Test
    @DisplayName("Should reject an empty key")
    void shouldRejectEmptyKey() {
      assertThrows(
          AuthenticationException.class,
          () -> RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, ""));
    }

    @Test
    @DisplayName("Should reject a key that is not base64")
    void shouldRejectInvalidBase64() {
      final var exception =
          assertThrows(
              AuthenticationException.class,
              () -> RequestSigner.sign("GET", "dbs", "dbs/ToDoList", DATE, "not base64!"));
      assertFalse(exception.getMessage().contains("not base64!"));
    }

    @Test
    @DisplayName("Should not expose the key in SigningRequest#toString")
    void shouldMaskKey() {
      final var request = SigningRequest.master(HttpVerb.GET, "dbs", "", DATE, DOCS_KEY);
      assertFalse(request.toString().contains(DOCS_KEY));
    }
  }
}
