package com.example.documentdb.core.auth;

import com.example.documentdb.core.AuthenticationException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Computes the {@code authorization} header value of a DocumentDB request.
 *
 * <p>The string to sign is the lower-cased verb, the lower-cased resource type, the resource link
 * as given, the lower-cased date and an empty field, each followed by a newline. It is signed with
 * HMAC-SHA256 keyed by the decoded master key; the base64 digest is returned as {@code
 * type=master&ver=1.0&sig=<signature>}, percent-encoded, with only the prefix lower-cased.
 *
 * <p>Stateless and safe for concurrent use.
 */
public final class RequestSigner {

  private static final String HMAC_SHA256 = "HmacSHA256";

  private RequestSigner() {}

  /**
   * Signs a request with a master key.
   *
   * @param verb HTTP verb, case-insensitive
   * @param resourceType resource type, case-insensitive
   * @param resourceLink resource link, case preserved, may be empty
   * @param timestamp HTTP-date of the request, case-insensitive
   * @param secretKey base64 encoded master key
   * @return URL-encoded authorization token
   * @throws AuthenticationException if an input is empty or the key is not valid base64
   */
  public static String sign(
      final String verb,
      final String resourceType,
      final String resourceLink,
      final String timestamp,
      final String secretKey) {
    return sign(
        SigningRequest.master(HttpVerb.parse(verb), resourceType, resourceLink, timestamp, secretKey));
  }

  /**
   * Signs the given request.
   *
   * @param request signing inputs
   * @return URL-encoded authorization token
   * @throws AuthenticationException if the key is not valid base64
   */
  public static String sign(final SigningRequest request) {
    final var payload =
        String.join(
                "\n",
                request.verb().name().toLowerCase(Locale.ROOT),
                request.resourceType().toLowerCase(Locale.ROOT),
                request.resourceLink(),
                request.timestamp().toLowerCase(Locale.ROOT),
                "")
            + "\n";

    final var signature =
        Base64.getEncoder().encodeToString(hmacSha256(decodeKey(request.secretKey()), payload));

    final var prefix = "type=" + request.keyType() + "&ver=" + request.tokenVersion() + "&sig=";
    return percentEncode(prefix).toLowerCase(Locale.ROOT) + percentEncode(signature);
  }

  /**
   * Percent-encodes every character outside the RFC 3986 unreserved set, using upper-case hex.
   *
   * @param value text to encode
   * @return encoded text
   */
  public static String percentEncode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }

  private static byte[] decodeKey(final String secretKey) {
    final byte[] key;
    try {
      key = Base64.getDecoder().decode(secretKey.trim());
    } catch (final IllegalArgumentException e) {
      throw new AuthenticationException("Master key is not valid base64", e);
    }
    if (key.length == 0) throw new AuthenticationException("Master key decodes to no bytes");
    return key;
  }

  private static byte[] hmacSha256(final byte[] key, final String payload) {
    try {
      final var mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(key, HMAC_SHA256));
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (final InvalidKeyException e) {
      throw new AuthenticationException("Master key rejected by " + HMAC_SHA256, e);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException(HMAC_SHA256 + " is not available", e);
    }
  }
}
