package com.codeheadsystems.coffer.client;

import com.codeheadsystems.coffer.client.accessor.ErrorResponseParser;
import com.codeheadsystems.coffer.client.accessor.RetryingHttpExecutor;
import com.codeheadsystems.coffer.client.accessor.Sleeper;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.config.RetryConfig;
import com.codeheadsystems.coffer.client.exceptions.ConfigurationException;
import com.codeheadsystems.coffer.client.manager.UploadStatusPoller;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the static configuration and wires a {@link DisconnectedClient} or a
 * {@link ProvisioningClient}.
 * <p>
 * Base URL, client id and client secret are required for {@link #build()}; retry bounds and the
 * rotation pool size are clamped to the service limits rather than rejected.
 */
public class CofferClientBuilder {

  private static final Logger log = LoggerFactory.getLogger(CofferClientBuilder.class);

  private String baseUrl;
  private String clientId;
  private String clientSecret;
  private String redirectUri;
  private String userAgentSuffix;
  private Integer tokenRotation;
  private Duration minRetryDelay;
  private Duration maxRetryDelay;
  private Integer maxRetries;
  private RetryConfig retryConfig;
  private Duration connectTimeout = CofferClientConfig.DEFAULT_CONNECT_TIMEOUT;
  private Duration requestTimeout = CofferClientConfig.DEFAULT_REQUEST_TIMEOUT;
  private int chunkSize = CofferClientConfig.DEFAULT_CHUNK_SIZE;
  private HttpClient httpClient;
  private Sleeper sleeper = Sleeper.SYSTEM;
  private Clock clock = Clock.systemUTC();

  CofferClientBuilder() {
  }

  public CofferClientBuilder baseUrl(final String value) {
    this.baseUrl = value;
    return this;
  }

  public CofferClientBuilder clientId(final String value) {
    this.clientId = value;
    return this;
  }

  public CofferClientBuilder clientSecret(final String value) {
    this.clientSecret = value;
    return this;
  }

  public CofferClientBuilder redirectUri(final String value) {
    this.redirectUri = value;
    return this;
  }

  /**
   * Prepended to the library's own User-Agent as {@code "{suffix}|coffer|{version}"}.
   *
   * @param value the application name
   * @return this builder
   */
  public CofferClientBuilder userAgentSuffix(final String value) {
    this.userAgentSuffix = value;
    return this;
  }

  /**
   * Size of the token rotation pool, clamped to [1, 5]. 1 disables rotation.
   *
   * @param value the pool size
   * @return this builder
   */
  public CofferClientBuilder tokenRotation(final int value) {
    this.tokenRotation = value;
    return this;
  }

  public CofferClientBuilder minRetryDelay(final Duration value) {
    this.minRetryDelay = value;
    return this;
  }

  public CofferClientBuilder maxRetryDelay(final Duration value) {
    this.maxRetryDelay = value;
    return this;
  }

  public CofferClientBuilder maxRetries(final int value) {
    this.maxRetries = value;
    return this;
  }

  /**
   * Uses the given retry config as is, bypassing the clamping. Meant for tests.
   *
   * @param value the retry config
   * @return this builder
   */
  public CofferClientBuilder retryConfig(final RetryConfig value) {
    this.retryConfig = value;
    return this;
  }

  public CofferClientBuilder connectTimeout(final Duration value) {
    this.connectTimeout = value;
    return this;
  }

  public CofferClientBuilder requestTimeout(final Duration value) {
    this.requestTimeout = value;
    return this;
  }

  public CofferClientBuilder chunkSize(final int value) {
    this.chunkSize = value;
    return this;
  }

  public CofferClientBuilder httpClient(final HttpClient value) {
    this.httpClient = value;
    return this;
  }

  public CofferClientBuilder sleeper(final Sleeper value) {
    this.sleeper = value;
    return this;
  }

  public CofferClientBuilder clock(final Clock value) {
    this.clock = value;
    return this;
  }

  // ── Build ─────────────────────────────────────────────────────────────────

  /**
   * Builds a disconnected client.
   *
   * @return the disconnected client
   * @throws ConfigurationException if a required value is missing or a URL is invalid
   */
  public DisconnectedClient build() {
    URI base = baseUri();
    if (isBlank(clientId)) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_CLIENT_ID, "Client id is required");
    }
    if (isBlank(clientSecret)) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_CLIENT_SECRET, "Client secret is required");
    }
    URI redirect = isBlank(redirectUri) ? base.resolve("oauth/callback") : parse(redirectUri);
    log.debug("build(baseUrl={}, clientId={})", base, clientId);
    return new DisconnectedClient(context(config(base, clientId, SecretValue.of(clientSecret), redirect)));
  }

  /**
   * Builds a provisioning client authenticated with a service token. Client id and secret are
   * not used.
   *
   * @param serviceToken the service token
   * @return the provisioning client
   */
  public ProvisioningClient buildProvisioning(final String serviceToken) {
    URI base = baseUri();
    if (isBlank(serviceToken)) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_ARGUMENT, "Service token is required");
    }
    log.debug("buildProvisioning(baseUrl={})", base);
    CofferClientConfig config = config(base, clientId, SecretValue.empty(), base.resolve("oauth/callback"));
    return new ProvisioningClient(context(config), SecretValue.of(serviceToken));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CofferClientConfig config(final URI base,
                                    final String id,
                                    final SecretValue secret,
                                    final URI redirect) {
    if (chunkSize <= 0) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_ARGUMENT,
          "Chunk size must be positive: " + chunkSize);
    }
    int rotation = tokenRotation == null ? CofferClientConfig.MIN_TOKEN_ROTATION
        : Math.max(CofferClientConfig.MIN_TOKEN_ROTATION, Math.min(CofferClientConfig.MAX_TOKEN_ROTATION, tokenRotation));
    RetryConfig retry = retryConfig != null ? retryConfig : RetryConfig.clamped(minRetryDelay, maxRetryDelay, maxRetries);
    String userAgent = isBlank(userAgentSuffix)
        ? CofferClientConfig.APP_USER_AGENT
        : userAgentSuffix + "|" + CofferClientConfig.APP_USER_AGENT;
    return new CofferClientConfig(base, id, secret, redirect, userAgent, rotation, retry,
        connectTimeout, requestTimeout, chunkSize);
  }

  private ClientContext context(final CofferClientConfig config) {
    HttpClient client = httpClient != null ? httpClient : HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    XmlMapper xmlMapper = new XmlMapper();
    xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    RetryingHttpExecutor executor = new RetryingHttpExecutor(client, objectMapper,
        new ErrorResponseParser(objectMapper, xmlMapper), config, sleeper);
    return ClientContext.create(config, executor, new UploadStatusPoller(sleeper), clock);
  }

  private URI baseUri() {
    if (isBlank(baseUrl)) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_BASE_URL, "Base URL is required");
    }
    String normalized = baseUrl.trim().endsWith("/") ? baseUrl.trim() : baseUrl.trim() + "/";
    return parse(normalized);
  }

  private static URI parse(final String value) {
    try {
      URI uri = new URI(value.trim());
      if (uri.getScheme() == null || uri.getHost() == null
          || !("https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme()))) {
        throw new ConfigurationException(ConfigurationException.Kind.INVALID_URL, "Not an http(s) URL: " + value);
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new ConfigurationException(ConfigurationException.Kind.INVALID_URL, "Invalid URL: " + value, e);
    }
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
