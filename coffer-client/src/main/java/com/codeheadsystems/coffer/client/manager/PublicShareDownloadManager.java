package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.accessor.PublicAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.exceptions.ConfigurationException;
import com.codeheadsystems.coffer.client.exceptions.MissingEncryptionSecretException;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.crypto.UserKeyPairCrypto;
import com.codeheadsystems.coffer.model.keys.UserKeyPairContainer;
import com.codeheadsystems.coffer.model.share.PublicDownloadShare;
import java.io.OutputStream;
import java.net.URI;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Anonymous download from a download share.
 * <p>
 * One download URL serves every range.  The share password doubles as the encryption secret of
 * encrypted shares: it unlocks the share's own private key, which unwraps the file key.  Decrypted
 * content is held in memory and written only once the authentication tag verified.
 */
@Singleton
public class PublicShareDownloadManager {

  private static final Logger log = LoggerFactory.getLogger(PublicShareDownloadManager.class);

  private final CofferClientConfig config;
  private final PublicAccessor publicAccessor;
  private final ContentAccessor contentAccessor;

  @Inject
  public PublicShareDownloadManager(final CofferClientConfig config,
                                    final PublicAccessor publicAccessor,
                                    final ContentAccessor contentAccessor) {
    log.info("PublicShareDownloadManager()");
    this.config = config;
    this.publicAccessor = publicAccessor;
    this.contentAccessor = contentAccessor;
  }

  public PublicDownloadShare getShare(final String accessKey) {
    return publicAccessor.getDownloadShare(accessKey);
  }

  /**
   * Downloads the shared file into {@code out}.  The output is not closed.
   *
   * @param accessKey the share access key
   * @param share     the share as returned by {@link #getShare(String)}
   * @param password  the share password, required for protected and encrypted shares
   * @param out       the output
   * @param listener  progress, called after every range
   * @param chunkSize range size override, null for the configured default
   * @throws ConfigurationException          if the share needs a password and none was given
   * @throws MissingEncryptionSecretException if an encrypted share carries no key material
   */
  public void download(final String accessKey,
                       final PublicDownloadShare share,
                       final SecretValue password,
                       final OutputStream out,
                       final ProgressListener listener,
                       final Integer chunkSize) {
    log.debug("download(fileName={}, protected={}, encrypted={})",
        share.fileName(), share.passwordProtected(), share.encrypted());
    boolean hasPassword = password != null && !password.isEmpty();
    if (!hasPassword && (share.passwordProtected() || share.encrypted())) {
      throw new ConfigurationException(ConfigurationException.Kind.MISSING_ARGUMENT,
          "A password is required for protected or encrypted download shares");
    }
    if (share.encrypted() && (share.fileKey() == null || share.privateKeyContainer() == null)) {
      throw new MissingEncryptionSecretException();
    }
    long rangeSize = RangedDownload.checkRangeSize(chunkSize, config.chunkSize());
    URI url = URI.create(publicAccessor.generateDownloadUrl(accessKey,
        share.passwordProtected() ? password.expose() : null).downloadUrl());
    long total = share.size() != null ? share.size() : contentAccessor.fetchTotalSize(url).orElse(0L);
    RangedDownload ranges = new RangedDownload(contentAccessor, "share file " + share.fileName(), total,
        rangeSize, listener);
    if (!share.encrypted()) {
      ranges.plain(offset -> url, out);
      return;
    }
    UserKeyPairContainer container = new UserKeyPairContainer(share.privateKeyContainer(), null);
    try (UnlockedKeyPair keyPair = UserKeyPairCrypto.unlock(container, password);
         PlainFileKey plainKey = FileKeyCrypto.decryptFileKey(share.fileKey(), keyPair)) {
      ranges.decrypting(offset -> url, plainKey, out);
    }
  }
}
