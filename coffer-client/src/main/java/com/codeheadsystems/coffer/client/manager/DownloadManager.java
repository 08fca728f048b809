package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.node.Node;
import java.io.OutputStream;
import java.net.URI;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a file with sequential ranged GETs.
 * <p>
 * Download URLs are short lived: the first range uses the URL obtained up front, every later
 * range asks for a fresh one.  Plain content is written to the output as each range arrives.
 * Encrypted content is decrypted range by range into memory and only written once the
 * authentication tag has been verified, so nothing unauthenticated ever reaches the output.
 */
@Singleton
public class DownloadManager {

  private static final Logger log = LoggerFactory.getLogger(DownloadManager.class);

  private final CofferClientConfig config;
  private final NodesAccessor nodesAccessor;
  private final ContentAccessor contentAccessor;
  private final KeyPairManager keyPairManager;

  /**
   * Instantiates a new Download manager.
   *
   * @param config          the config
   * @param nodesAccessor   the nodes accessor
   * @param contentAccessor the content accessor
   * @param keyPairManager  the key pair manager
   */
  @Inject
  public DownloadManager(final CofferClientConfig config,
                         final NodesAccessor nodesAccessor,
                         final ContentAccessor contentAccessor,
                         final KeyPairManager keyPairManager) {
    log.info("DownloadManager()");
    this.config = config;
    this.nodesAccessor = nodesAccessor;
    this.contentAccessor = contentAccessor;
    this.keyPairManager = keyPairManager;
  }

  public void download(final Node node, final OutputStream out) {
    download(node, out, ProgressListener.NONE, null);
  }

  /**
   * Downloads the node's content into {@code out}.  The output is not closed.
   *
   * @param node      the file node; a null size is resolved with a one byte range request
   * @param out       the output
   * @param listener  progress, called after every range
   * @param chunkSize range size override, null for the configured default
   */
  public void download(final Node node,
                       final OutputStream out,
                       final ProgressListener listener,
                       final Integer chunkSize) {
    log.debug("download(nodeId={}, encrypted={})", node.id(), node.encrypted());
    long rangeSize = RangedDownload.checkRangeSize(chunkSize, config.chunkSize());
    URI firstUrl = URI.create(nodesAccessor.getDownloadUrl(node.id()).downloadUrl());
    long total = node.size() != null ? node.size() : contentAccessor.fetchTotalSize(firstUrl).orElse(0L);
    RangedDownload ranges = new RangedDownload(contentAccessor, "node " + node.id(), total, rangeSize, listener);
    RangedDownload.UrlSource urls = offset -> offset == 0
        ? firstUrl : URI.create(nodesAccessor.getDownloadUrl(node.id()).downloadUrl());
    if (!node.encrypted()) {
      ranges.plain(urls, out);
      return;
    }
    UnlockedKeyPair keyPair = keyPairManager.getUnlockedKeyPair(null);
    FileKey wrapped = nodesAccessor.getUserFileKey(node.id());
    try (PlainFileKey plainKey = FileKeyCrypto.decryptFileKey(wrapped, keyPair)) {
      ranges.decrypting(urls, plainKey, out);
    }
  }
}
