package com.codeheadsystems.coffer.client.model;

import com.codeheadsystems.coffer.crypto.SecretValue;

/**
 * How a disconnected client obtains its first token.
 */
public interface OAuth2Flow {

  static OAuth2Flow password(final String username, final String password) {
    return new Password(username, SecretValue.of(password));
  }

  static OAuth2Flow authorizationCode(final String code) {
    return new AuthorizationCode(SecretValue.of(code));
  }

  static OAuth2Flow refreshToken(final String refreshToken) {
    return new RefreshToken(SecretValue.of(refreshToken));
  }

  /**
   * Uses an access token obtained elsewhere. No request is made, the token is assumed to never
   * expire and cannot be refreshed.
   *
   * @param accessToken the access token
   * @return the flow
   */
  static OAuth2Flow preIssued(final String accessToken) {
    return new PreIssued(SecretValue.of(accessToken));
  }

  /**
   * Resource owner password grant.
   *
   * @param username the username
   * @param password the password
   */
  record Password(String username, SecretValue password) implements OAuth2Flow {
  }

  /**
   * Authorization code grant.
   *
   * @param code the code received on the redirect target
   */
  record AuthorizationCode(SecretValue code) implements OAuth2Flow {
  }

  /**
   * Refresh token grant.
   *
   * @param refreshToken the refresh token
   */
  record RefreshToken(SecretValue refreshToken) implements OAuth2Flow {
  }

  /**
   * A pre-issued access token.
   *
   * @param accessToken the access token
   */
  record PreIssued(SecretValue accessToken) implements OAuth2Flow {
  }
}
