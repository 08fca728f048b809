package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.client.accessor.PublicAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.client.model.TransferChunkPlan;
import com.codeheadsystems.coffer.client.model.UploadDescriptor;
import com.codeheadsystems.coffer.crypto.FileEncrypter;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.node.Node;
import com.codeheadsystems.coffer.model.upload.CompleteS3FileUploadRequest;
import com.codeheadsystems.coffer.model.upload.CompleteUploadRequest;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadRequest;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadResponse;
import com.codeheadsystems.coffer.model.upload.GeneratePresignedUrlsRequest;
import com.codeheadsystems.coffer.model.upload.PresignedUrlList;
import com.codeheadsystems.coffer.model.upload.S3FileUploadPart;
import com.codeheadsystems.coffer.model.upload.S3FileUploadStatus;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads a file into a parent node.
 * <p>
 * The path is picked from two facts: whether the service stores content in object storage
 * ({@code useS3Storage} from the system info) and whether the parent is encrypted.
 * <ul>
 *   <li>object storage, plain: pre-signed part uploads, finalize, poll.</li>
 *   <li>object storage, encrypted: as above with the ciphertext and the caller's wrapped file
 *       key, then missing keys are distributed once the server reports {@code done}.</li>
 *   <li>proxy, plain: Content-Range chunks to the upload URL, then finalize.</li>
 *   <li>proxy, encrypted: as above with the ciphertext, missing keys distributed right after
 *       finalize.</li>
 * </ul>
 * Encrypted uploads hold the whole file in memory; the key pair must already be unlocked through
 * {@link KeyPairManager}.
 */
@Singleton
public class UploadManager {

  private static final Logger log = LoggerFactory.getLogger(UploadManager.class);

  private final CofferClientConfig config;
  private final NodesAccessor nodesAccessor;
  private final PublicAccessor publicAccessor;
  private final ChunkedTransfer chunkedTransfer;
  private final UploadStatusPoller poller;
  private final KeyPairManager keyPairManager;
  private final FileKeyDistributor fileKeyDistributor;

  /**
   * Instantiates a new Upload manager.
   *
   * @param config             the config
   * @param nodesAccessor      the nodes accessor
   * @param publicAccessor     the public accessor, for the system info
   * @param chunkedTransfer    the chunked transfer
   * @param poller             the poller
   * @param keyPairManager     the key pair manager
   * @param fileKeyDistributor the file key distributor
   */
  @Inject
  public UploadManager(final CofferClientConfig config,
                       final NodesAccessor nodesAccessor,
                       final PublicAccessor publicAccessor,
                       final ChunkedTransfer chunkedTransfer,
                       final UploadStatusPoller poller,
                       final KeyPairManager keyPairManager,
                       final FileKeyDistributor fileKeyDistributor) {
    log.info("UploadManager()");
    this.config = config;
    this.nodesAccessor = nodesAccessor;
    this.publicAccessor = publicAccessor;
    this.chunkedTransfer = chunkedTransfer;
    this.poller = poller;
    this.keyPairManager = keyPairManager;
    this.fileKeyDistributor = fileKeyDistributor;
  }

  public Node upload(final Node parent, final UploadDescriptor descriptor, final InputStream source) {
    return upload(parent, descriptor, source, ProgressListener.NONE, null);
  }

  /**
   * Uploads {@code descriptor.size()} bytes from the source into the parent.
   *
   * @param parent     the parent room or folder
   * @param descriptor the file description
   * @param source     the content
   * @param listener   progress, called after every chunk
   * @param chunkSize  chunk size override, null for the configured default
   * @return the created node
   */
  public Node upload(final Node parent,
                     final UploadDescriptor descriptor,
                     final InputStream source,
                     final ProgressListener listener,
                     final Integer chunkSize) {
    boolean objectStorage = publicAccessor.getSystemInfo().useS3Storage();
    boolean encrypted = parent.encrypted();
    log.debug("upload(parentId={}, name={}, size={}, objectStorage={}, encrypted={})",
        parent.id(), descriptor.name(), descriptor.size(), objectStorage, encrypted);
    TransferChunkPlan plan = TransferChunkPlan.of(descriptor.size(), chunkSize == null ? config.chunkSize() : chunkSize);
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    if (!encrypted) {
      return objectStorage
          ? uploadToObjectStorage(parent, descriptor, source, plan, progress, null)
          : uploadToProxy(parent, descriptor, source, plan, progress, null);
    }
    UnlockedKeyPair keyPair = keyPairManager.getUnlockedKeyPair(null);
    byte[] plainText = ChunkedTransfer.readFully(source, descriptor.size());
    FileEncrypter.EncryptedContent content = FileEncrypter.encryptAll(plainText);
    Arrays.fill(plainText, (byte) 0);
    try (PlainFileKey plainKey = content.fileKey()) {
      FileKey ownKey = FileKeyCrypto.encryptFileKey(plainKey, keyPair.publicKeyContainer());
      InputStream cipherSource = new ByteArrayInputStream(content.cipherText());
      Node node = objectStorage
          ? uploadToObjectStorage(parent, descriptor, cipherSource, plan, progress, ownKey)
          : uploadToProxy(parent, descriptor, cipherSource, plan, progress, ownKey);
      int distributed = fileKeyDistributor.distribute(node.id(), plainKey);
      log.debug("upload(nodeId={}): distributed {} missing keys", node.id(), distributed);
      return node;
    }
  }

  // ── Paths ─────────────────────────────────────────────────────────────────

  private Node uploadToObjectStorage(final Node parent,
                                     final UploadDescriptor descriptor,
                                     final InputStream source,
                                     final TransferChunkPlan plan,
                                     final ProgressListener listener,
                                     final FileKey fileKey) {
    CreateFileUploadResponse channel = nodesAccessor.createUploadChannel(channelRequest(parent, descriptor, true));
    String uploadId = channel.uploadId();
    List<S3FileUploadPart> parts = chunkedTransfer.toObjectStorage(source, plan,
        (partNumber, partSize) -> presignedUrl(uploadId, partNumber, partSize), listener);
    nodesAccessor.finalizeS3Upload(uploadId, new CompleteS3FileUploadRequest(parts,
        descriptor.resolutionStrategy(), descriptor.name(), descriptor.keepShareLinks(), fileKey));
    S3FileUploadStatus status = poller.await(uploadId, () -> nodesAccessor.getS3UploadStatus(uploadId));
    if (status.node() == null) {
      throw new CofferException("Upload " + uploadId + " finished without a node");
    }
    return status.node();
  }

  private Node uploadToProxy(final Node parent,
                             final UploadDescriptor descriptor,
                             final InputStream source,
                             final TransferChunkPlan plan,
                             final ProgressListener listener,
                             final FileKey fileKey) {
    CreateFileUploadResponse channel = nodesAccessor.createUploadChannel(channelRequest(parent, descriptor, false));
    chunkedTransfer.toProxy(URI.create(channel.uploadUrl()), source, plan, listener);
    return nodesAccessor.finalizeProxyUpload(channel.token(), new CompleteUploadRequest(
        descriptor.resolutionStrategy(), descriptor.name(), descriptor.keepShareLinks(), fileKey));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI presignedUrl(final String uploadId, final int partNumber, final long partSize) {
    PresignedUrlList urls = nodesAccessor.createS3UploadUrls(uploadId,
        GeneratePresignedUrlsRequest.singlePart(partSize, partNumber));
    if (urls.urls() == null || urls.urls().isEmpty()) {
      throw new CofferException("No pre-signed URL issued for part " + partNumber + " of upload " + uploadId);
    }
    return URI.create(urls.urls().get(0).url());
  }

  private static CreateFileUploadRequest channelRequest(final Node parent,
                                                        final UploadDescriptor descriptor,
                                                        final boolean directS3Upload) {
    return new CreateFileUploadRequest(parent.id(), descriptor.name(), descriptor.size(),
        descriptor.classification(), descriptor.expiration(), directS3Upload ? Boolean.TRUE : null,
        iso(descriptor.timestampCreation()), iso(descriptor.timestampModification()));
  }

  static String iso(final Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
