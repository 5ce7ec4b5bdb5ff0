package com.example.documentdb.core.secrets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.*;
import org.mockito.MockedStatic;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecretsManagerCredentialProviderTest {

  private static final String SECRET_ID = "documentdb/account";
  private static final String URL = "https://acct.documents.azure.com";

  private MockedStatic<SecretHelper> secretHelperMock;

  @BeforeEach
  void setUp() {
    secretHelperMock = mockStatic(SecretHelper.class);
    secretHelperMock.when(() -> SecretHelper.getSecretVersion(anyString())).thenReturn("v1");
    secretHelperMock
        .when(() -> SecretHelper.getAccountSecret(anyString()))
        .thenReturn(new AccountSecret(URL, "primary-1", "secondary-1"));
  }

  @AfterEach
  void tearDown() {
    if (secretHelperMock != null) secretHelperMock.close();
  }

  @Nested
  @DisplayName("Loading")
  class Loading {

    @Test
    @DisplayName("Should load the secret lazily and use the primary key")
    void shouldLoadLazily() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      secretHelperMock.verify(() -> SecretHelper.getAccountSecret(anyString()), never());

      assertEquals("primary-1", provider.masterKey());
      assertEquals(URL, provider.secret().accountUrl());
      secretHelperMock.verify(() -> SecretHelper.getAccountSecret(SECRET_ID), times(1));
    }

    @Test
    @DisplayName("Should fall back to the secondary key when no primary key is stored")
    void shouldUseSecondaryWithoutPrimary() {
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenReturn(new AccountSecret(URL, "", "secondary-1"));

      assertEquals("secondary-1", new SecretsManagerCredentialProvider(SECRET_ID).masterKey());
    }

    @Test
    @DisplayName("Should fail when the secret holds no key")
    void shouldFailWithoutKeys() {
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenReturn(new AccountSecret(URL, null, null));

      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      assertThrows(IllegalStateException.class, provider::masterKey);
    }

    @Test
    @DisplayName("Should reject a blank secret id")
    void shouldRejectBlankSecretId() {
      assertThrows(IllegalArgumentException.class, () -> new SecretsManagerCredentialProvider(" "));
    }

    @Test
    @DisplayName("Should not expose keys in toString")
    void shouldNotExposeKeys() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();
      assertFalse(provider.toString().contains("primary-1"));
    }
  }

  @Nested
  @DisplayName("Refresh")
  class Refresh {

    @Test
    @DisplayName("Should pick up a rotated primary key")
    void shouldPickUpRotatedPrimary() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      assertEquals("primary-1", provider.masterKey());

      secretHelperMock.when(() -> SecretHelper.getSecretVersion(anyString())).thenReturn("v2");
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenReturn(new AccountSecret(URL, "primary-2", "secondary-1"));

      assertTrue(provider.refresh());
      assertEquals("primary-2", provider.masterKey());
    }

    @Test
    @DisplayName("Should switch to the secondary key when the primary key did not change")
    void shouldSwitchToSecondary() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();

      assertTrue(provider.refresh());
      assertEquals("secondary-1", provider.masterKey());
    }

    @Test
    @DisplayName("Should report no change when there is nothing else to try")
    void shouldReportNoChange() {
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenReturn(new AccountSecret(URL, "primary-1", null));
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();

      assertFalse(provider.refresh());
      assertEquals("primary-1", provider.masterKey());
    }

    @Test
    @DisplayName("Should not go back to a primary key that was already rejected")
    void shouldNotReturnToRejectedPrimary() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();

      assertTrue(provider.refresh());
      assertEquals("secondary-1", provider.masterKey());

      assertFalse(provider.refresh());
    }

    @Test
    @DisplayName("Should accept a rotated primary key after both old keys were rejected")
    void shouldAcceptRotationAfterBothKeysRejected() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();
      assertTrue(provider.refresh());
      assertFalse(provider.refresh());

      secretHelperMock.when(() -> SecretHelper.getSecretVersion(anyString())).thenReturn("v2");
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenReturn(new AccountSecret(URL, "primary-2", "primary-1"));

      assertTrue(provider.refresh());
      assertEquals("primary-2", provider.masterKey());
    }

    @Test
    @DisplayName("Should report no change when Secrets Manager cannot be read")
    void shouldSurviveRefreshFailure() {
      final var provider = new SecretsManagerCredentialProvider(SECRET_ID);
      provider.masterKey();
      secretHelperMock
          .when(() -> SecretHelper.getAccountSecret(anyString()))
          .thenThrow(new IllegalStateException("unreachable"));

      assertFalse(provider.refresh());
      assertEquals("primary-1", provider.masterKey());
    }
  }
}
