package com.codeheadsystems.coffer.model.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful response of {@code POST /oauth/token} for every grant type.
 * <p>
 * {@code refreshToken} may be absent for grants that do not issue one.  {@code expiresIn} is the
 * access token lifetime in seconds counted from the moment the response was received.
 *
 * @param accessToken       the bearer token
 * @param refreshToken      the refresh token, may be null
 * @param tokenType         usually {@code bearer}
 * @param expiresIn         access token lifetime in seconds
 * @param expiresInInactive lifetime of an idle token in seconds, optional
 * @param scope             granted scope, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuth2TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("expires_in_inactive") Long expiresInInactive,
    @JsonProperty("scope") String scope) {

  @Override
  public String toString() {
    return "OAuth2TokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", scope=" + scope + "]";
  }
}
