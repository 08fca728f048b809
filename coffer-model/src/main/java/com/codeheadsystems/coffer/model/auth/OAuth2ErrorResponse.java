package com.codeheadsystems.coffer.model.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the OAuth endpoints, e.g. {@code {"error":"invalid_grant"}}.
 *
 * @param error            the OAuth error code
 * @param errorDescription optional human readable description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuth2ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {

  /**
   * Synthetic error used when a refresh is attempted without a refresh token.
   *
   * @return the error
   */
  public static OAuth2ErrorResponse unauthorized() {
    return new OAuth2ErrorResponse("unauthorized", "No refresh token available");
  }

  @Override
  public String toString() {
    return errorDescription == null ? error : error + " (" + errorDescription + ")";
  }
}
