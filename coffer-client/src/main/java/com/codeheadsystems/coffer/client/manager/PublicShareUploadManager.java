package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.PublicAccessor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.client.model.TransferChunkPlan;
import com.codeheadsystems.coffer.client.model.UploadDescriptor;
import com.codeheadsystems.coffer.crypto.FileEncrypter;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.model.keys.UserUserPublicKey;
import com.codeheadsystems.coffer.model.share.CompleteS3ShareUploadRequest;
import com.codeheadsystems.coffer.model.share.CreateShareUploadChannelRequest;
import com.codeheadsystems.coffer.model.share.PublicUploadShare;
import com.codeheadsystems.coffer.model.share.PublicUploadedFileData;
import com.codeheadsystems.coffer.model.share.S3ShareUploadStatus;
import com.codeheadsystems.coffer.model.share.UserFileKey;
import com.codeheadsystems.coffer.model.share.UserFileKeyList;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadResponse;
import com.codeheadsystems.coffer.model.upload.GeneratePresignedUrlsRequest;
import com.codeheadsystems.coffer.model.upload.PresignedUrlList;
import com.codeheadsystems.coffer.model.upload.S3FileUploadPart;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Anonymous upload into an upload share.
 * <p>
 * Uses the same four paths as {@link UploadManager}.  For an encrypted share the file key is
 * wrapped for every public key the share lists and sent with the finalize call; nobody else is
 * missing a key afterwards, so there is no distribution step.
 */
@Singleton
public class PublicShareUploadManager {

  private static final Logger log = LoggerFactory.getLogger(PublicShareUploadManager.class);

  private final CofferClientConfig config;
  private final PublicAccessor publicAccessor;
  private final ChunkedTransfer chunkedTransfer;
  private final UploadStatusPoller poller;

  @Inject
  public PublicShareUploadManager(final CofferClientConfig config,
                                  final PublicAccessor publicAccessor,
                                  final ChunkedTransfer chunkedTransfer,
                                  final UploadStatusPoller poller) {
    log.info("PublicShareUploadManager()");
    this.config = config;
    this.publicAccessor = publicAccessor;
    this.chunkedTransfer = chunkedTransfer;
    this.poller = poller;
  }

  public PublicUploadShare getShare(final String accessKey) {
    return publicAccessor.getUploadShare(accessKey);
  }

  /**
   * Uploads {@code descriptor.size()} bytes into the share.
   *
   * @param accessKey  the share access key
   * @param share      the share as returned by {@link #getShare(String)}
   * @param descriptor the file description, only name, size and timestamps apply
   * @param password   the share password, null for unprotected shares
   * @param source     the content
   * @param listener   progress, called after every chunk
   * @param chunkSize  chunk size override, null for the configured default
   * @return the stored file
   */
  public PublicUploadedFileData upload(final String accessKey,
                                       final PublicUploadShare share,
                                       final UploadDescriptor descriptor,
                                       final SecretValue password,
                                       final InputStream source,
                                       final ProgressListener listener,
                                       final Integer chunkSize) {
    boolean objectStorage = publicAccessor.getSystemInfo().useS3Storage();
    log.debug("upload(name={}, size={}, objectStorage={}, encrypted={})",
        descriptor.name(), descriptor.size(), objectStorage, share.encrypted());
    TransferChunkPlan plan = TransferChunkPlan.of(descriptor.size(), chunkSize == null ? config.chunkSize() : chunkSize);
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    CreateShareUploadChannelRequest request = new CreateShareUploadChannelRequest(descriptor.name(),
        descriptor.size(), password == null ? null : password.expose(), objectStorage ? Boolean.TRUE : null,
        UploadManager.iso(descriptor.timestampCreation()), UploadManager.iso(descriptor.timestampModification()));
    if (!share.encrypted()) {
      return objectStorage
          ? uploadToObjectStorage(accessKey, request, source, plan, progress, null)
          : uploadToProxy(accessKey, request, source, plan, progress, null);
    }
    byte[] plainText = ChunkedTransfer.readFully(source, descriptor.size());
    FileEncrypter.EncryptedContent content = FileEncrypter.encryptAll(plainText);
    Arrays.fill(plainText, (byte) 0);
    try (PlainFileKey plainKey = content.fileKey()) {
      UserFileKeyList keys = wrapForShare(share, plainKey);
      InputStream cipherSource = new ByteArrayInputStream(content.cipherText());
      return objectStorage
          ? uploadToObjectStorage(accessKey, request, cipherSource, plan, progress, keys)
          : uploadToProxy(accessKey, request, cipherSource, plan, progress, keys);
    }
  }

  private PublicUploadedFileData uploadToObjectStorage(final String accessKey,
                                                       final CreateShareUploadChannelRequest request,
                                                       final InputStream source,
                                                       final TransferChunkPlan plan,
                                                       final ProgressListener listener,
                                                       final UserFileKeyList keys) {
    CreateFileUploadResponse channel = publicAccessor.createUploadChannel(accessKey, request);
    String uploadId = channel.uploadId();
    List<S3FileUploadPart> parts = chunkedTransfer.toObjectStorage(source, plan,
        (partNumber, partSize) -> {
          PresignedUrlList urls = publicAccessor.createS3UploadUrls(accessKey, uploadId,
              GeneratePresignedUrlsRequest.singlePart(partSize, partNumber));
          if (urls.urls() == null || urls.urls().isEmpty()) {
            throw new CofferException("No pre-signed URL issued for part " + partNumber + " of upload " + uploadId);
          }
          return URI.create(urls.urls().get(0).url());
        }, listener);
    publicAccessor.finalizeS3Upload(accessKey, uploadId, new CompleteS3ShareUploadRequest(parts, keys));
    S3ShareUploadStatus status = poller.await(uploadId, () -> publicAccessor.getS3UploadStatus(accessKey, uploadId));
    return new PublicUploadedFileData(status.fileName(), status.size(), null);
  }

  private PublicUploadedFileData uploadToProxy(final String accessKey,
                                               final CreateShareUploadChannelRequest request,
                                               final InputStream source,
                                               final TransferChunkPlan plan,
                                               final ProgressListener listener,
                                               final UserFileKeyList keys) {
    CreateFileUploadResponse channel = publicAccessor.createUploadChannel(accessKey, request);
    chunkedTransfer.toProxy(URI.create(channel.uploadUrl()), source, plan, listener);
    return publicAccessor.finalizeProxyUpload(accessKey, channel.uploadId(), keys);
  }

  private static UserFileKeyList wrapForShare(final PublicUploadShare share, final PlainFileKey plainKey) {
    List<UserFileKey> items = new ArrayList<>();
    for (UserUserPublicKey recipient : share.publicKeys()) {
      items.add(new UserFileKey(recipient.id(), FileKeyCrypto.encryptFileKey(plainKey, recipient.publicKeyContainer())));
    }
    if (items.isEmpty()) {
      throw new CofferException("Encrypted share lists no public keys");
    }
    return new UserFileKeyList(items);
  }
}
