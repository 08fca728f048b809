package com.codeheadsystems.coffer.client.config;

import com.codeheadsystems.coffer.crypto.SecretValue;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Static configuration shared by every session state.
 * <p>
 * Built and validated by {@code CofferClientBuilder}; {@code baseUri} always ends with a slash so
 * relative API paths can be resolved against it.
 *
 * @param baseUri        the service base address
 * @param clientId       the OAuth client id
 * @param clientSecret   the OAuth client secret
 * @param redirectUri    the OAuth redirect target
 * @param userAgent      the User-Agent sent with every request
 * @param tokenRotation  size of the token rotation pool, 1 disables rotation
 * @param retryConfig    the retry bounds
 * @param connectTimeout the connect timeout
 * @param requestTimeout the per request timeout
 * @param chunkSize      the default transfer chunk size in bytes
 */
public record CofferClientConfig(URI baseUri,
                                 String clientId,
                                 SecretValue clientSecret,
                                 URI redirectUri,
                                 String userAgent,
                                 int tokenRotation,
                                 RetryConfig retryConfig,
                                 Duration connectTimeout,
                                 Duration requestTimeout,
                                 int chunkSize) {

  public static final String API_PREFIX = "api/v4/";
  public static final String APP_USER_AGENT = "coffer|1.0.0";
  public static final int DEFAULT_CHUNK_SIZE = 32 * 1024 * 1024;
  public static final int MIN_TOKEN_ROTATION = 1;
  public static final int MAX_TOKEN_ROTATION = 5;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);

  /**
   * Resolves a path below the REST API prefix, e.g. {@code nodes/files/uploads}.
   *
   * @param path the path without leading slash
   * @return the absolute uri
   */
  public URI apiUri(final String path) {
    return baseUri.resolve(API_PREFIX + path);
  }

  /**
   * Resolves a path directly below the base address, e.g. {@code oauth/token}.
   *
   * @param path the path without leading slash
   * @return the absolute uri
   */
  public URI baseRelative(final String path) {
    return baseUri.resolve(path);
  }

  /**
   * The URL a user opens in a browser to start the authorization code flow.
   *
   * @return the authorize uri
   */
  public URI authorizeUri() {
    return baseRelative("oauth/authorize?response_type=code&client_id="
        + URLEncoder.encode(clientId, StandardCharsets.UTF_8)
        + "&redirect_uri=" + URLEncoder.encode(redirectUri.toString(), StandardCharsets.UTF_8)
        + "&scope=all");
  }

  public boolean tokenRotationEnabled() {
    return tokenRotation > 1;
  }
}
