package com.example.documentdb.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.*;
import org.mockito.MockedStatic;
import org.mockito.Mockito;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

class SecretsManagerProviderTest {

  private static final String SECRET_ID = "documentdb/account";

  private MockedStatic<SecretsManagerProvider> clientStaticMock;
  private SecretsManagerClient mockClient;

  @BeforeEach
  void setup() {
    clearAwsProps();
    SecretsManagerProvider.configureCacheForTests(0, null);
    SecretsManagerProvider.resetClient();

    mockClient = mock(SecretsManagerClient.class);
    clientStaticMock = Mockito.mockStatic(SecretsManagerProvider.class, Mockito.CALLS_REAL_METHODS);
    clientStaticMock.when(SecretsManagerProvider::getClient).thenReturn(mockClient);
  }

  @AfterEach
  void tearDown() {
    if (clientStaticMock != null) {
      clientStaticMock.close();
      clientStaticMock = null;
    }
    SecretsManagerProvider.configureCacheForTests(0, null);
    SecretsManagerProvider.resetClient();
    clearAwsProps();
  }

  private static void clearAwsProps() {
    System.clearProperty("aws.region");
    System.clearProperty("aws.sm.endpoint");
    System.clearProperty("aws.accessKeyId");
    System.clearProperty("aws.secretAccessKey");
  }

  @Test
  @DisplayName("Should call Secrets Manager on every read when the cache is disabled")
  void shouldReadThroughWithoutCache() {
    when(mockClient.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(response("value-1", "v1"))
        .thenReturn(response("value-2", "v2"));

    assertEquals("value-1", SecretsManagerProvider.getSecret(SECRET_ID));
    assertEquals("v2", SecretsManagerProvider.getSecretVersion(SECRET_ID));

    verify(mockClient, times(2)).getSecretValue(any(GetSecretValueRequest.class));
  }

  @Test
  @DisplayName("Should serve secret and version from one cached response within the TTL")
  void shouldServeFromCacheWithinTtl() {
    when(mockClient.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(response("cached", "v1"));
    SecretsManagerProvider.configureCacheForTests(1_000, Clock.systemUTC());

    assertEquals("cached", SecretsManagerProvider.getSecret(SECRET_ID));
    assertEquals("cached", SecretsManagerProvider.getSecret(SECRET_ID));

    verify(mockClient, times(1)).getSecretValue(any(GetSecretValueRequest.class));
  }

  @Test
  @DisplayName("Should fetch again once the cached entry expired")
  void shouldRefetchAfterExpiry() {
    when(mockClient.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(response("A", "v1"))
        .thenReturn(response("B", "v2"));
    final var base = Clock.fixed(Instant.parse("2020-01-01T00:00:00Z"), ZoneOffset.UTC);

    SecretsManagerProvider.configureCacheForTests(100, base);
    assertEquals("A", SecretsManagerProvider.getSecret(SECRET_ID));

    SecretsManagerProvider.configureCacheForTests(100, Clock.offset(base, Duration.ofMillis(200)));
    assertEquals("B", SecretsManagerProvider.getSecret(SECRET_ID));
  }

  @Test
  @DisplayName("Should drop one secret from the cache on invalidate")
  void shouldInvalidateSingleSecret() {
    when(mockClient.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(response("old", "v1"))
        .thenReturn(response("rotated", "v2"));
    SecretsManagerProvider.configureCacheForTests(60_000, Clock.systemUTC());

    assertEquals("old", SecretsManagerProvider.getSecret(SECRET_ID));
    SecretsManagerProvider.invalidate(SECRET_ID);
    assertEquals("rotated", SecretsManagerProvider.getSecret(SECRET_ID));
  }

  @Test
  @DisplayName("Should build a client from region, endpoint and credential properties")
  void shouldBuildClientFromProperties() {
    clientStaticMock.close();
    clientStaticMock = null;

    System.setProperty("aws.region", "us-west-2");
    System.setProperty("aws.sm.endpoint", "http://localhost:4566");
    System.setProperty("aws.accessKeyId", "test");
    System.setProperty("aws.secretAccessKey", "test");

    SecretsManagerProvider.resetClient();
    assertNotNull(SecretsManagerProvider.getClient());
  }

  private static GetSecretValueResponse response(final String value, final String version) {
    return GetSecretValueResponse.builder().secretString(value).versionId(version).build();
  }
}
