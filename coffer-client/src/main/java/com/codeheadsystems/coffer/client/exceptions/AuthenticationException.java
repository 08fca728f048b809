package com.codeheadsystems.coffer.client.exceptions;

import com.codeheadsystems.coffer.model.auth.OAuth2ErrorResponse;

/**
 * The authorization server rejected a grant or a refresh token. The caller has to authenticate
 * again; this failure is never retried.
 */
public class AuthenticationException extends CofferException {

  private final transient OAuth2ErrorResponse error;

  /**
   * Instantiates a new Authentication exception.
   *
   * @param error the error returned by the server
   */
  public AuthenticationException(final OAuth2ErrorResponse error) {
    super("Authentication failed: " + error);
    this.error = error;
  }

  public OAuth2ErrorResponse error() {
    return error;
  }
}
