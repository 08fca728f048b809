package com.codeheadsystems.coffer.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.config.RetryConfig;
import com.codeheadsystems.coffer.client.exceptions.ConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CofferClientBuilderTest {

  private static CofferClientBuilder valid() {
    return DisconnectedClient.builder()
        .baseUrl("https://coffer.example.com")
        .clientId("client-id")
        .clientSecret("client-secret");
  }

  @Test
  void build_missingBaseUrl_throwsMissingBaseUrl() {
    assertKind(() -> valid().baseUrl(null).build(), ConfigurationException.Kind.MISSING_BASE_URL);
  }

  @Test
  void build_missingClientId_throwsMissingClientId() {
    assertKind(() -> valid().clientId(" ").build(), ConfigurationException.Kind.MISSING_CLIENT_ID);
  }

  @Test
  void build_missingClientSecret_throwsMissingClientSecret() {
    assertKind(() -> valid().clientSecret("").build(), ConfigurationException.Kind.MISSING_CLIENT_SECRET);
  }

  @ParameterizedTest
  @ValueSource(strings = {"coffer.example.com", "ftp://coffer.example.com", "https://", "http://exa mple.com"})
  void build_invalidBaseUrl_throwsInvalidUrl(final String url) {
    assertKind(() -> valid().baseUrl(url).build(), ConfigurationException.Kind.INVALID_URL);
  }

  @Test
  void build_invalidRedirectUri_throwsInvalidUrl() {
    assertKind(() -> valid().redirectUri("not a url").build(), ConfigurationException.Kind.INVALID_URL);
  }

  @Test
  void build_nonPositiveChunkSize_throwsMissingArgument() {
    assertKind(() -> valid().chunkSize(0).build(), ConfigurationException.Kind.MISSING_ARGUMENT);
  }

  @Test
  void build_defaults_normalizesBaseAndDerivesRedirect() {
    CofferClientConfig config = valid().build().config();

    assertThat(config.baseUri().toString()).isEqualTo("https://coffer.example.com/");
    assertThat(config.redirectUri().toString()).isEqualTo("https://coffer.example.com/oauth/callback");
    assertThat(config.apiUri("user/account").toString()).isEqualTo("https://coffer.example.com/api/v4/user/account");
    assertThat(config.tokenRotation()).isEqualTo(1);
    assertThat(config.userAgent()).isEqualTo("coffer|1.0.0");
    assertThat(config.chunkSize()).isEqualTo(CofferClientConfig.DEFAULT_CHUNK_SIZE);
    assertThat(config.retryConfig()).isEqualTo(RetryConfig.defaults());
  }

  @Test
  void build_userAgentSuffix_isPrepended() {
    assertThat(valid().userAgentSuffix("sync-tool").build().config().userAgent()).isEqualTo("sync-tool|coffer|1.0.0");
  }

  @ParameterizedTest
  @CsvSource({"0, 1", "1, 1", "3, 3", "5, 5", "9, 5"})
  void build_tokenRotation_isClamped(final int requested, final int expected) {
    assertThat(valid().tokenRotation(requested).build().config().tokenRotation()).isEqualTo(expected);
  }

  @Test
  void build_retryBounds_areClamped() {
    RetryConfig retry = valid()
        .minRetryDelay(Duration.ofMillis(10))
        .maxRetryDelay(Duration.ofMinutes(5))
        .maxRetries(50)
        .build().config().retryConfig();

    assertThat(retry.minDelay()).isEqualTo(Duration.ofMillis(300));
    assertThat(retry.maxDelay()).isEqualTo(Duration.ofSeconds(20));
    assertThat(retry.maxAttempts()).isEqualTo(5);
  }

  @Test
  void authorizeUri_containsClientAndEncodedRedirect() {
    String uri = valid().build().authorizeUri().toString();

    assertThat(uri).startsWith("https://coffer.example.com/oauth/authorize?response_type=code&client_id=client-id");
    assertThat(uri).contains("redirect_uri=https%3A%2F%2Fcoffer.example.com%2Foauth%2Fcallback");
  }

  @Test
  void buildProvisioning_blankToken_throwsMissingArgument() {
    assertKind(() -> valid().buildProvisioning(" "), ConfigurationException.Kind.MISSING_ARGUMENT);
  }

  @Test
  void buildProvisioning_needsNoClientCredentials() {
    try (ProvisioningClient client = DisconnectedClient.builder()
        .baseUrl("https://coffer.example.com/")
        .buildProvisioning("service-token")) {
      assertThat(client.getServiceToken()).isEqualTo("service-token");
    }
  }

  private static void assertKind(final Runnable build, final ConfigurationException.Kind kind) {
    assertThatThrownBy(build::run)
        .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.kind()).isEqualTo(kind));
  }
}
