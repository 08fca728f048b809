package com.codeheadsystems.coffer.client.model;

/**
 * Which tokens to revoke on disconnect.
 *
 * @param revokeAccessToken  revoke the access tokens, default true
 * @param revokeRefreshToken revoke the refresh tokens, default false
 */
public record RevokeOptions(boolean revokeAccessToken, boolean revokeRefreshToken) {

  public static RevokeOptions defaults() {
    return new RevokeOptions(true, false);
  }

  public static RevokeOptions none() {
    return new RevokeOptions(false, false);
  }

  public static RevokeOptions all() {
    return new RevokeOptions(true, true);
  }
}
