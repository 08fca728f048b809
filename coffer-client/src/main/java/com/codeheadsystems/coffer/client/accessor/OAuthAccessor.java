package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.model.auth.OAuth2TokenResponse;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the OAuth2 token and revoke endpoints.
 * <p>
 * All grants post {@code application/x-www-form-urlencoded} bodies to {@code oauth/token}.  The
 * password grant authenticates the client with HTTP Basic, the other grants send the client id
 * and secret as form fields.  An OAuth error body is surfaced as an
 * {@link com.codeheadsystems.coffer.client.exceptions.AuthenticationException}.
 */
@Singleton
public class OAuthAccessor {

  static final String TOKEN_PATH = "oauth/token";
  static final String REVOKE_PATH = "oauth/revoke";

  private static final Logger log = LoggerFactory.getLogger(OAuthAccessor.class);

  private final CofferClientConfig config;
  private final RetryingHttpExecutor executor;

  /**
   * Instantiates a new OAuth accessor.
   *
   * @param config   the config
   * @param executor the executor
   */
  @Inject
  public OAuthAccessor(final CofferClientConfig config, final RetryingHttpExecutor executor) {
    log.info("OAuthAccessor()");
    this.config = config;
    this.executor = executor;
  }

  // ── Grants ────────────────────────────────────────────────────────────────

  /**
   * Resource owner password grant.
   *
   * @param username the username
   * @param password the password
   * @return the token response
   */
  public OAuth2TokenResponse passwordGrant(final String username, final SecretValue password) {
    log.debug("passwordGrant(username={})", username);
    Map<String, String> form = new LinkedHashMap<>();
    form.put("username", username);
    form.put("password", password.expose());
    form.put("grant_type", "password");
    String credentials = config.clientId() + ":" + config.clientSecret().expose();
    String basic = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    return token(form, basic);
  }

  /**
   * Authorization code grant.
   *
   * @param code the code
   * @return the token response
   */
  public OAuth2TokenResponse authorizationCodeGrant(final SecretValue code) {
    log.debug("authorizationCodeGrant()");
    Map<String, String> form = clientForm();
    form.put("grant_type", "authorization_code");
    form.put("code", code.expose());
    form.put("redirect_uri", config.redirectUri().toString());
    return token(form, null);
  }

  /**
   * Refresh token grant.
   *
   * @param refreshToken the refresh token
   * @return the token response
   */
  public OAuth2TokenResponse refreshTokenGrant(final String refreshToken) {
    log.debug("refreshTokenGrant()");
    Map<String, String> form = clientForm();
    form.put("grant_type", "refresh_token");
    form.put("refresh_token", refreshToken);
    return token(form, null);
  }

  // ── Revocation ────────────────────────────────────────────────────────────

  /**
   * Revokes a token. A rejected revocation is logged and otherwise ignored: the token is
   * discarded locally either way.
   *
   * @param hint  which kind of token is revoked
   * @param token the token
   * @return true if the server confirmed the revocation
   */
  public boolean revoke(final TokenTypeHint hint, final String token) {
    log.debug("revoke(hint={})", hint);
    Map<String, String> form = clientForm();
    form.put("token_type_hint", hint.value());
    form.put("token", token);
    HttpResponse<String> response = executor.send(formRequest(config.baseRelative(REVOKE_PATH), form),
        HttpResponse.BodyHandlers.ofString());
    if (!RetryingHttpExecutor.isSuccess(response.statusCode())) {
      log.warn("revoke(hint={}): server returned HTTP {}", hint, response.statusCode());
      return false;
    }
    return true;
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private OAuth2TokenResponse token(final Map<String, String> form, final String basicAuth) {
    HttpRequest.Builder builder = formRequest(config.baseRelative(TOKEN_PATH), form);
    if (basicAuth != null) {
      builder.header("Authorization", basicAuth);
    }
    HttpResponse<String> response = executor.send(builder, HttpResponse.BodyHandlers.ofString());
    if (!RetryingHttpExecutor.isSuccess(response.statusCode())) {
      throw executor.errors().oauthError(response.statusCode(), response.body());
    }
    return executor.readJson(response.body(), OAuth2TokenResponse.class);
  }

  private Map<String, String> clientForm() {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("client_id", config.clientId());
    form.put("client_secret", config.clientSecret().expose());
    return form;
  }

  private static HttpRequest.Builder formRequest(final URI uri, final Map<String, String> form) {
    String body = form.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    return HttpRequest.newBuilder()
        .uri(uri)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body));
  }

  /**
   * The {@code token_type_hint} of a revocation.
   */
  public enum TokenTypeHint {
    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    TokenTypeHint(final String value) {
      this.value = value;
    }

    public String value() {
      return value;
    }
  }
}
