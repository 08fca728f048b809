package com.codeheadsystems.coffer.client.model;

import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.model.auth.OAuth2TokenResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * One access/refresh token pair and the moment it was issued.
 * <p>
 * A connection is immutable: a refresh produces a new instance that replaces the old one, and
 * {@link #close()} erases both tokens.  A connection created from a pre-issued token has no
 * refresh token and never expires.
 */
public final class Connection implements AutoCloseable {

  /** Sentinel lifetime of tokens that never expire. */
  public static final long NEVER_EXPIRES = Long.MAX_VALUE;

  private final SecretValue accessToken;
  private final SecretValue refreshToken;
  private final long expiresIn;
  private final Instant issuedAt;

  /**
   * Instantiates a new Connection.
   *
   * @param accessToken  the access token
   * @param refreshToken the refresh token, empty if none was issued
   * @param expiresIn    lifetime in seconds, or {@link #NEVER_EXPIRES}
   * @param issuedAt     when the token was received
   */
  public Connection(final SecretValue accessToken,
                    final SecretValue refreshToken,
                    final long expiresIn,
                    final Instant issuedAt) {
    if (expiresIn < 0) {
      throw new IllegalArgumentException("expiresIn must not be negative: " + expiresIn);
    }
    this.accessToken = accessToken;
    this.refreshToken = refreshToken;
    this.expiresIn = expiresIn;
    this.issuedAt = issuedAt;
  }

  /**
   * Creates a connection from a token endpoint response.
   *
   * @param response the response
   * @param now      the time the response was received
   * @return the connection
   */
  public static Connection fromTokenResponse(final OAuth2TokenResponse response, final Instant now) {
    return new Connection(SecretValue.of(response.accessToken()), SecretValue.of(response.refreshToken()),
        response.expiresIn(), now);
  }

  /**
   * Creates a never expiring connection from a token obtained elsewhere.
   *
   * @param accessToken the access token
   * @param now         the current time
   * @return the connection
   */
  public static Connection preIssued(final SecretValue accessToken, final Instant now) {
    return new Connection(accessToken, SecretValue.empty(), NEVER_EXPIRES, now);
  }

  /**
   * Whether {@code now} lies beyond {@code issuedAt + expiresIn}. Always false for
   * {@link #NEVER_EXPIRES}.
   *
   * @param now the now
   * @return true if expired
   */
  public boolean isExpired(final Instant now) {
    if (expiresIn == NEVER_EXPIRES) {
      return false;
    }
    return Duration.between(issuedAt, now).compareTo(Duration.ofSeconds(expiresIn)) > 0;
  }

  public String authorizationHeader() {
    return "Bearer " + accessToken.expose();
  }

  public String exposeAccessToken() {
    return accessToken.expose();
  }

  public String exposeRefreshToken() {
    return refreshToken.expose();
  }

  public boolean hasRefreshToken() {
    return !refreshToken.isDestroyed() && !refreshToken.isEmpty();
  }

  public long expiresIn() {
    return expiresIn;
  }

  public Instant issuedAt() {
    return issuedAt;
  }

  public boolean isClosed() {
    return accessToken.isDestroyed();
  }

  @Override
  public void close() {
    accessToken.close();
    refreshToken.close();
  }

  @Override
  public String toString() {
    return "Connection[issuedAt=" + issuedAt + ", expiresIn="
        + (expiresIn == NEVER_EXPIRES ? "never" : expiresIn) + "]";
  }
}
