package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.AuthHeaderProvider;
import com.codeheadsystems.coffer.client.accessor.OAuthAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.exceptions.AuthenticationException;
import com.codeheadsystems.coffer.client.model.Connection;
import com.codeheadsystems.coffer.client.model.OAuth2Flow;
import com.codeheadsystems.coffer.client.model.RevokeOptions;
import com.codeheadsystems.coffer.client.model.TokenSlot;
import com.codeheadsystems.coffer.client.store.CredentialStore;
import com.codeheadsystems.coffer.model.auth.OAuth2ErrorResponse;
import com.codeheadsystems.coffer.model.auth.OAuth2TokenResponse;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link CredentialStore}: runs the grant flows, refreshes expired tokens and serves
 * the rotation pool.
 * <p>
 * A single lock guards the whole "read slot, check expiry, refresh, advance cursor" sequence, so
 * two callers can never refresh the same slot twice or both be served from one slot while another
 * is skipped.  The lock is held across the refresh round trip; callers waiting on it get the
 * refreshed token rather than starting a second refresh.
 * <p>
 * Rotation order with a pool of {@code N}: Main, Additional[0] .. Additional[N-2], Main, ...
 * An expired slot is refreshed in place and served without advancing the cursor.
 */
@Singleton
public class TokenLifecycleManager implements AuthHeaderProvider {

  private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

  private final CofferClientConfig config;
  private final OAuthAccessor oauthAccessor;
  private final CredentialStore store;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Instantiates a new Token lifecycle manager.
   *
   * @param config        the config
   * @param oauthAccessor the oauth accessor
   * @param store         the credential store
   * @param clock         the clock used for issuance and expiry
   */
  @Inject
  public TokenLifecycleManager(final CofferClientConfig config,
                               final OAuthAccessor oauthAccessor,
                               final CredentialStore store,
                               final Clock clock) {
    log.info("TokenLifecycleManager()");
    this.config = config;
    this.oauthAccessor = oauthAccessor;
    this.store = store;
    this.clock = clock;
  }

  // ── Connect ───────────────────────────────────────────────────────────────

  /**
   * Runs the grant flow and fills the store. With a rotation pool of {@code N > 1}, {@code N-1}
   * additional refresh exchanges are made with the refresh token just obtained; any failure
   * aborts the connect and erases every token obtained so far.
   *
   * @param flow the flow
   */
  public void connect(final OAuth2Flow flow) {
    log.debug("connect(flow={})", flow.getClass().getSimpleName());
    lock.lock();
    try {
      Connection main = acquire(flow);
      List<Connection> additional = new ArrayList<>();
      try {
        if (config.tokenRotationEnabled() && main.hasRefreshToken()) {
          for (int i = 1; i < config.tokenRotation(); i++) {
            log.debug("connect(): filling rotation slot {}", TokenSlot.additional(i - 1));
            additional.add(exchange(main.exposeRefreshToken()));
          }
        } else if (config.tokenRotationEnabled()) {
          log.info("connect(): no refresh token, rotation pool disabled for this session");
        }
      } catch (RuntimeException e) {
        main.close();
        additional.forEach(Connection::close);
        throw e;
      }
      store.initialize(main, additional);
    } finally {
      lock.unlock();
    }
  }

  private Connection acquire(final OAuth2Flow flow) {
    if (flow instanceof OAuth2Flow.Password password) {
      try {
        return Connection.fromTokenResponse(
            oauthAccessor.passwordGrant(password.username(), password.password()), clock.instant());
      } finally {
        password.password().close();
      }
    } else if (flow instanceof OAuth2Flow.AuthorizationCode code) {
      try {
        return Connection.fromTokenResponse(oauthAccessor.authorizationCodeGrant(code.code()), clock.instant());
      } finally {
        code.code().close();
      }
    } else if (flow instanceof OAuth2Flow.RefreshToken refresh) {
      try {
        return exchange(refresh.refreshToken().expose());
      } finally {
        refresh.refreshToken().close();
      }
    } else if (flow instanceof OAuth2Flow.PreIssued preIssued) {
      return Connection.preIssued(preIssued.accessToken(), clock.instant());
    }
    throw new IllegalArgumentException("Unsupported flow: " + flow.getClass().getName());
  }

  // ── Auth header ───────────────────────────────────────────────────────────

  @Override
  public String getAuthHeader() {
    lock.lock();
    try {
      if (store.size() <= 1) {
        Connection main = store.main();
        if (main.isExpired(clock.instant())) {
          log.debug("getAuthHeader(): main token expired, refreshing");
          main = refresh(TokenSlot.MAIN);
        }
        return main.authorizationHeader();
      }
      TokenSlot slot = store.currentSlot();
      Connection current = store.get(slot);
      if (current.isExpired(clock.instant())) {
        log.debug("getAuthHeader(): {} expired, refreshing", slot);
        return refresh(slot).authorizationHeader();
      }
      store.advance();
      return current.authorizationHeader();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the main refresh token, e.g. to persist it for a later refresh token flow.
   *
   * @return the refresh token, empty for a pre-issued token
   */
  public String refreshToken() {
    lock.lock();
    try {
      Connection main = store.main();
      return main.hasRefreshToken() ? main.exposeRefreshToken() : "";
    } finally {
      lock.unlock();
    }
  }

  public boolean isConnected() {
    lock.lock();
    try {
      return !store.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  // ── Disconnect ────────────────────────────────────────────────────────────

  /**
   * Revokes the selected tokens of every pooled connection and empties the store. The store is
   * emptied even when a revocation fails.
   *
   * @param options which tokens to revoke
   */
  public void disconnect(final RevokeOptions options) {
    log.debug("disconnect(options={})", options);
    lock.lock();
    try {
      for (Connection connection : store.all()) {
        if (options.revokeAccessToken()) {
          oauthAccessor.revoke(OAuthAccessor.TokenTypeHint.ACCESS_TOKEN, connection.exposeAccessToken());
        }
        if (options.revokeRefreshToken() && connection.hasRefreshToken()) {
          oauthAccessor.revoke(OAuthAccessor.TokenTypeHint.REFRESH_TOKEN, connection.exposeRefreshToken());
        }
      }
    } finally {
      store.clear();
      lock.unlock();
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private Connection refresh(final TokenSlot slot) {
    Connection current = store.get(slot);
    String refreshToken;
    if (current.hasRefreshToken()) {
      refreshToken = current.exposeRefreshToken();
    } else if (!slot.isMain() && store.main().hasRefreshToken()) {
      refreshToken = store.main().exposeRefreshToken();
    } else {
      log.warn("refresh({}): no refresh token available", slot);
      throw new AuthenticationException(OAuth2ErrorResponse.unauthorized());
    }
    Connection refreshed = exchange(refreshToken);
    store.replace(slot, refreshed);
    return refreshed;
  }

  private Connection exchange(final String refreshToken) {
    OAuth2TokenResponse response = oauthAccessor.refreshTokenGrant(refreshToken);
    return Connection.fromTokenResponse(response, clock.instant());
  }
}
