package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.model.keys.UserKeyPairContainer;
import java.net.http.HttpRequest;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The user account accessor.
 */
@Singleton
public class UserAccountAccessor {

  private static final Logger log = LoggerFactory.getLogger(UserAccountAccessor.class);

  private final CofferClientConfig config;
  private final RetryingHttpExecutor executor;
  private final AuthHeaderProvider authHeaderProvider;

  @Inject
  public UserAccountAccessor(final CofferClientConfig config,
                             final RetryingHttpExecutor executor,
                             final AuthHeaderProvider authHeaderProvider) {
    log.info("UserAccountAccessor()");
    this.config = config;
    this.executor = executor;
    this.authHeaderProvider = authHeaderProvider;
  }

  /**
   * Fetches the caller's stored key pair, private key still encrypted.
   *
   * @return the user key pair container
   */
  public UserKeyPairContainer getUserKeyPair() {
    log.debug("getUserKeyPair()");
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri("user/account/keypair"))
        .header("Authorization", authHeaderProvider.getAuthHeader())
        .GET(), UserKeyPairContainer.class);
  }

  /**
   * Stores a new key pair for the caller.  The server rejects this while another pair exists.
   *
   * @param container the key pair, private key encrypted with the user's secret
   */
  public void setUserKeyPair(final UserKeyPairContainer container) {
    log.debug("setUserKeyPair(version={})", container.publicKeyContainer().version());
    executor.sendForSuccess(HttpRequest.newBuilder(config.apiUri("user/account/keypair"))
        .header("Authorization", authHeaderProvider.getAuthHeader())
        .header("Content-Type", "application/json")
        .POST(executor.json(container)));
  }
}
