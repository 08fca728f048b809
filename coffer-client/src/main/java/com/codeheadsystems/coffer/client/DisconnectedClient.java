package com.codeheadsystems.coffer.client;

import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.client.accessor.UserAccountAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.manager.DownloadManager;
import com.codeheadsystems.coffer.client.manager.FileKeyDistributor;
import com.codeheadsystems.coffer.client.manager.KeyPairManager;
import com.codeheadsystems.coffer.client.manager.PublicShareDownloadManager;
import com.codeheadsystems.coffer.client.manager.PublicShareUploadManager;
import com.codeheadsystems.coffer.client.manager.TokenLifecycleManager;
import com.codeheadsystems.coffer.client.manager.UploadManager;
import com.codeheadsystems.coffer.client.model.OAuth2Flow;
import com.codeheadsystems.coffer.client.store.CredentialStore;
import com.codeheadsystems.coffer.model.system.SystemInfo;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A client that holds only static configuration.  The only way to reach authenticated operations
 * is {@link #connect(OAuth2Flow)}, which returns a {@link ConnectedClient}.
 * <p>
 * Anonymous operations (system info, public share uploads) are available here.
 */
public final class DisconnectedClient {

  private static final Logger log = LoggerFactory.getLogger(DisconnectedClient.class);

  private final ClientContext context;

  DisconnectedClient(final ClientContext context) {
    log.info("DisconnectedClient()");
    this.context = context;
  }

  public static CofferClientBuilder builder() {
    return new CofferClientBuilder();
  }

  /**
   * Runs the grant flow and returns the connected session. The secrets held by the flow are
   * erased once used, so a flow instance cannot be reused.
   *
   * @param flow the flow
   * @return the connected client
   */
  public ConnectedClient connect(final OAuth2Flow flow) {
    log.debug("connect()");
    CofferClientConfig config = context.config();
    TokenLifecycleManager tokens = new TokenLifecycleManager(config, context.oauthAccessor(),
        new CredentialStore(), context.clock());
    tokens.connect(flow);
    NodesAccessor nodes = new NodesAccessor(config, context.executor(), tokens);
    KeyPairManager keyPairs = new KeyPairManager(new UserAccountAccessor(config, context.executor(), tokens));
    FileKeyDistributor distributor = new FileKeyDistributor(nodes);
    UploadManager uploads = new UploadManager(config, nodes, context.publicAccessor(), context.chunkedTransfer(),
        context.poller(), keyPairs, distributor);
    DownloadManager downloads = new DownloadManager(config, nodes, context.contentAccessor(), keyPairs);
    return new ConnectedClient(context, tokens, keyPairs, uploads, downloads, distributor);
  }

  /**
   * The URL to open in a browser to obtain a code for {@link OAuth2Flow#authorizationCode(String)}.
   *
   * @return the authorize uri
   */
  public URI authorizeUri() {
    return context.config().authorizeUri();
  }

  public SystemInfo getSystemInfo() {
    return context.publicAccessor().getSystemInfo();
  }

  public PublicShareUploadManager publicUploads() {
    return context.publicShareUploadManager();
  }

  public PublicShareDownloadManager publicDownloads() {
    return context.publicShareDownloadManager();
  }

  public CofferClientConfig config() {
    return context.config();
  }
}
