package com.codeheadsystems.coffer.client;

import com.codeheadsystems.coffer.client.manager.DownloadManager;
import com.codeheadsystems.coffer.client.manager.FileKeyDistributor;
import com.codeheadsystems.coffer.client.manager.KeyPairManager;
import com.codeheadsystems.coffer.client.manager.PublicShareDownloadManager;
import com.codeheadsystems.coffer.client.manager.PublicShareUploadManager;
import com.codeheadsystems.coffer.client.manager.TokenLifecycleManager;
import com.codeheadsystems.coffer.client.manager.UploadManager;
import com.codeheadsystems.coffer.client.model.RevokeOptions;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.model.system.SystemInfo;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An authenticated session.
 * <p>
 * {@link #disconnect(RevokeOptions)} consumes this instance: it erases every token and the
 * unlocked key pair and returns a new {@link DisconnectedClient}.  Any later call on this
 * instance fails with {@link IllegalStateException}.
 */
public final class ConnectedClient {

  private static final Logger log = LoggerFactory.getLogger(ConnectedClient.class);

  private final ClientContext context;
  private final TokenLifecycleManager tokens;
  private final KeyPairManager keyPairs;
  private final UploadManager uploads;
  private final DownloadManager downloads;
  private final FileKeyDistributor fileKeys;
  private final AtomicBoolean connected = new AtomicBoolean(true);

  ConnectedClient(final ClientContext context,
                  final TokenLifecycleManager tokens,
                  final KeyPairManager keyPairs,
                  final UploadManager uploads,
                  final DownloadManager downloads,
                  final FileKeyDistributor fileKeys) {
    log.info("ConnectedClient()");
    this.context = context;
    this.tokens = tokens;
    this.keyPairs = keyPairs;
    this.uploads = uploads;
    this.downloads = downloads;
    this.fileKeys = fileKeys;
  }

  /**
   * A valid {@code Bearer} header for calls made outside this library. May refresh a token.
   *
   * @return the header value
   */
  public String getAuthHeader() {
    return checked().tokens.getAuthHeader();
  }

  public String refreshToken() {
    return checked().tokens.refreshToken();
  }

  public boolean isConnected() {
    return connected.get() && tokens.isConnected();
  }

  public SystemInfo getSystemInfo() {
    return checked().context.publicAccessor().getSystemInfo();
  }

  /**
   * Unlocks the key pair for encrypted transfers, or returns the already unlocked pair.
   *
   * @param secret the encryption secret, ignored once unlocked
   * @return the unlocked key pair
   */
  public UnlockedKeyPair unlockKeyPair(final String secret) {
    checked();
    if (secret == null) {
      return keyPairs.getUnlockedKeyPair(null);
    }
    try (SecretValue value = SecretValue.of(secret)) {
      return keyPairs.getUnlockedKeyPair(value);
    }
  }

  public UploadManager uploads() {
    return checked().uploads;
  }

  public DownloadManager downloads() {
    return checked().downloads;
  }

  public KeyPairManager keyPairs() {
    return checked().keyPairs;
  }

  public FileKeyDistributor fileKeys() {
    return checked().fileKeys;
  }

  public PublicShareUploadManager publicUploads() {
    return checked().context.publicShareUploadManager();
  }

  public PublicShareDownloadManager publicDownloads() {
    return checked().context.publicShareDownloadManager();
  }

  // ── Disconnect ────────────────────────────────────────────────────────────

  public DisconnectedClient disconnect() {
    return disconnect(RevokeOptions.defaults());
  }

  /**
   * Revokes the selected tokens, erases every secret and returns to the disconnected state.
   *
   * @param options which tokens to revoke
   * @return the disconnected client
   */
  public DisconnectedClient disconnect(final RevokeOptions options) {
    if (!connected.compareAndSet(true, false)) {
      throw new IllegalStateException("Client already disconnected");
    }
    log.debug("disconnect(options={})", options);
    try {
      tokens.disconnect(options);
    } finally {
      keyPairs.close();
    }
    return new DisconnectedClient(context);
  }

  private ConnectedClient checked() {
    if (!connected.get()) {
      throw new IllegalStateException("Client is disconnected");
    }
    return this;
  }
}
