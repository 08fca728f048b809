package com.codeheadsystems.coffer.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.coffer.client.MutableClock;
import com.codeheadsystems.coffer.client.TestConfigs;
import com.codeheadsystems.coffer.client.accessor.OAuthAccessor;
import com.codeheadsystems.coffer.client.exceptions.AuthenticationException;
import com.codeheadsystems.coffer.client.model.OAuth2Flow;
import com.codeheadsystems.coffer.client.model.RevokeOptions;
import com.codeheadsystems.coffer.client.store.CredentialStore;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.model.auth.OAuth2ErrorResponse;
import com.codeheadsystems.coffer.model.auth.OAuth2TokenResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenLifecycleManagerTest {

  @Mock private OAuthAccessor oauthAccessor;

  private MutableClock clock;
  private CredentialStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    store = new CredentialStore();
  }

  // ── Connect ───────────────────────────────────────────────────────────────

  @Test
  void connect_password_withoutRotation_servesSameTokenWithoutNetwork() {
    TokenLifecycleManager manager = manager(1);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class))).thenReturn(token("at-main", 3600));

    manager.connect(OAuth2Flow.password("alice", "pw"));

    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-main");
    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-main");
    assertThat(store.size()).isEqualTo(1);
    verify(oauthAccessor, never()).refreshTokenGrant(anyString());
  }

  @Test
  void connect_withRotation_fillsPoolFromMainRefreshToken() {
    TokenLifecycleManager manager = manager(3);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class))).thenReturn(token("at-main", 3600));
    when(oauthAccessor.refreshTokenGrant("rt-at-main")).thenReturn(token("at-1", 3600), token("at-2", 3600));

    manager.connect(OAuth2Flow.password("alice", "pw"));

    assertThat(store.size()).isEqualTo(3);
    verify(oauthAccessor, times(2)).refreshTokenGrant("rt-at-main");
  }

  @Test
  void connect_poolRefreshFails_abortsAndErasesObtainedTokens() {
    TokenLifecycleManager manager = manager(3);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class))).thenReturn(token("at-main", 3600));
    when(oauthAccessor.refreshTokenGrant("rt-at-main"))
        .thenReturn(token("at-1", 3600))
        .thenThrow(new AuthenticationException(new OAuth2ErrorResponse("invalid_grant", "gone")));

    assertThatThrownBy(() -> manager.connect(OAuth2Flow.password("alice", "pw")))
        .isInstanceOf(AuthenticationException.class);
    assertThat(manager.isConnected()).isFalse();
  }

  @Test
  void connect_preIssued_makesNoRequestAndSkipsPool() {
    TokenLifecycleManager manager = manager(5);

    manager.connect(OAuth2Flow.preIssued("static-token"));
    clock.advance(Duration.ofDays(3650));

    assertThat(manager.getAuthHeader()).isEqualTo("Bearer static-token");
    assertThat(store.size()).isEqualTo(1);
    assertThat(manager.refreshToken()).isEmpty();
    verifyNoInteractions(oauthAccessor);
  }

  @Test
  void connect_refreshTokenFlow_exchangesGivenToken() {
    TokenLifecycleManager manager = manager(1);
    when(oauthAccessor.refreshTokenGrant("stored-rt")).thenReturn(token("at-main", 3600));

    manager.connect(OAuth2Flow.refreshToken("stored-rt"));

    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-main");
    assertThat(manager.refreshToken()).isEqualTo("rt-at-main");
  }

  // ── Rotation ──────────────────────────────────────────────────────────────

  @Test
  void getAuthHeader_rotation_visitsEverySlotOnceInOrder() {
    TokenLifecycleManager manager = connectedWithPool(3, 3600);

    List<String> headers = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      headers.add(manager.getAuthHeader());
    }

    assertThat(headers).containsExactly(
        "Bearer at-main", "Bearer at-1", "Bearer at-2",
        "Bearer at-main", "Bearer at-1", "Bearer at-2");
  }

  @Test
  void getAuthHeader_rotation_expiredSlotRefreshedWithoutAdvancing() {
    TokenLifecycleManager manager = connectedWithPool(3, 600);
    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-main");
    clock.advance(Duration.ofSeconds(601));
    when(oauthAccessor.refreshTokenGrant("rt-at-1")).thenReturn(token("at-1b", 600));

    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-1b");
    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-1b");

    verify(oauthAccessor).refreshTokenGrant("rt-at-1");
    verify(oauthAccessor, never()).refreshTokenGrant("rt-at-2");
  }

  @Test
  void getAuthHeader_noRotation_expiredTokenRefreshedInPlace() {
    TokenLifecycleManager manager = manager(1);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class))).thenReturn(token("at-main", 60));
    manager.connect(OAuth2Flow.password("alice", "pw"));
    clock.advance(Duration.ofSeconds(61));
    when(oauthAccessor.refreshTokenGrant("rt-at-main")).thenReturn(token("at-new", 60));

    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-new");
    assertThat(manager.getAuthHeader()).isEqualTo("Bearer at-new");
    assertThat(store.size()).isEqualTo(1);
    verify(oauthAccessor, times(1)).refreshTokenGrant(anyString());
  }

  @Test
  void getAuthHeader_expiredWithoutRefreshToken_throwsAuthenticationException() {
    TokenLifecycleManager manager = manager(1);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class)))
        .thenReturn(new OAuth2TokenResponse("at-main", null, "bearer", 60, null, "all"));
    manager.connect(OAuth2Flow.password("alice", "pw"));
    clock.advance(Duration.ofSeconds(61));

    assertThatThrownBy(manager::getAuthHeader)
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.error().error()).isEqualTo("unauthorized"));
  }

  @Test
  void getAuthHeader_beforeConnect_throws() {
    assertThatThrownBy(manager(1)::getAuthHeader).isInstanceOf(IllegalStateException.class);
  }

  // ── Disconnect ────────────────────────────────────────────────────────────

  static Stream<RevokeOptions> revokeOptions() {
    return Stream.of(RevokeOptions.none(), RevokeOptions.defaults(), RevokeOptions.all(),
        new RevokeOptions(false, true));
  }

  @ParameterizedTest
  @MethodSource("revokeOptions")
  void disconnect_alwaysEmptiesStore(final RevokeOptions options) {
    TokenLifecycleManager manager = connectedWithPool(2, 3600);

    manager.disconnect(options);

    assertThat(store.isEmpty()).isTrue();
    assertThat(manager.isConnected()).isFalse();
    int accessRevocations = options.revokeAccessToken() ? 2 : 0;
    int refreshRevocations = options.revokeRefreshToken() ? 2 : 0;
    verify(oauthAccessor, times(accessRevocations)).revoke(eq(OAuthAccessor.TokenTypeHint.ACCESS_TOKEN), anyString());
    verify(oauthAccessor, times(refreshRevocations)).revoke(eq(OAuthAccessor.TokenTypeHint.REFRESH_TOKEN), anyString());
  }

  @Test
  void disconnect_revokeFails_stillEmptiesStore() {
    TokenLifecycleManager manager = connectedWithPool(1, 3600);
    when(oauthAccessor.revoke(any(), anyString())).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> manager.disconnect(RevokeOptions.defaults())).isInstanceOf(IllegalStateException.class);
    assertThat(store.isEmpty()).isTrue();
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private TokenLifecycleManager manager(final int rotation) {
    return new TokenLifecycleManager(TestConfigs.config(rotation, 1024), oauthAccessor, store, clock);
  }

  private TokenLifecycleManager connectedWithPool(final int rotation, final long expiresIn) {
    TokenLifecycleManager manager = manager(rotation);
    when(oauthAccessor.passwordGrant(eq("alice"), any(SecretValue.class))).thenReturn(token("at-main", expiresIn));
    if (rotation > 1) {
      List<OAuth2TokenResponse> pool = new ArrayList<>();
      for (int i = 1; i < rotation; i++) {
        pool.add(token("at-" + i, expiresIn));
      }
      when(oauthAccessor.refreshTokenGrant("rt-at-main"))
          .thenReturn(pool.get(0), pool.subList(1, pool.size()).toArray(new OAuth2TokenResponse[0]));
    }
    manager.connect(OAuth2Flow.password("alice", "pw"));
    return manager;
  }

  private static OAuth2TokenResponse token(final String accessToken, final long expiresIn) {
    return new OAuth2TokenResponse(accessToken, "rt-" + accessToken, "bearer", expiresIn, null, "all");
  }
}
