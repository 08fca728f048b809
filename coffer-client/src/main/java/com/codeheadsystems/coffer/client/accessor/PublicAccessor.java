package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.model.download.DownloadUrlResponse;
import com.codeheadsystems.coffer.model.share.CompleteS3ShareUploadRequest;
import com.codeheadsystems.coffer.model.share.CreateShareUploadChannelRequest;
import com.codeheadsystems.coffer.model.share.PublicDownloadShare;
import com.codeheadsystems.coffer.model.share.PublicDownloadTokenGenerateRequest;
import com.codeheadsystems.coffer.model.share.PublicUploadShare;
import com.codeheadsystems.coffer.model.share.PublicUploadedFileData;
import com.codeheadsystems.coffer.model.share.S3ShareUploadStatus;
import com.codeheadsystems.coffer.model.share.UserFileKeyList;
import com.codeheadsystems.coffer.model.system.SystemInfo;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadResponse;
import com.codeheadsystems.coffer.model.upload.GeneratePresignedUrlsRequest;
import com.codeheadsystems.coffer.model.upload.PresignedUrlList;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the anonymous {@code public} endpoints: system information, uploads to upload
 * shares and downloads from download shares, both identified by their access key.
 */
@Singleton
public class PublicAccessor {

  private static final Logger log = LoggerFactory.getLogger(PublicAccessor.class);

  private final CofferClientConfig config;
  private final RetryingHttpExecutor executor;

  /**
   * Instantiates a new Public accessor.
   *
   * @param config   the config
   * @param executor the executor
   */
  @Inject
  public PublicAccessor(final CofferClientConfig config, final RetryingHttpExecutor executor) {
    log.info("PublicAccessor()");
    this.config = config;
    this.executor = executor;
  }

  public SystemInfo getSystemInfo() {
    log.debug("getSystemInfo()");
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri("public/system/info")).GET(),
        SystemInfo.class);
  }

  public PublicUploadShare getUploadShare(final String accessKey) {
    log.debug("getUploadShare()");
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri(sharePath(accessKey))).GET(),
        PublicUploadShare.class);
  }

  public CreateFileUploadResponse createUploadChannel(final String accessKey,
                                                      final CreateShareUploadChannelRequest request) {
    log.debug("createUploadChannel(name={})", request.name());
    return executor.sendForJson(jsonRequest(sharePath(accessKey)).POST(executor.json(request)),
        CreateFileUploadResponse.class);
  }

  public PresignedUrlList createS3UploadUrls(final String accessKey,
                                             final String uploadId,
                                             final GeneratePresignedUrlsRequest request) {
    log.debug("createS3UploadUrls(uploadId={}, part={})", uploadId, request.firstPartNumber());
    return executor.sendForJson(jsonRequest(sharePath(accessKey) + "/" + uploadId + "/s3_urls")
        .POST(executor.json(request)), PresignedUrlList.class);
  }

  public void finalizeS3Upload(final String accessKey,
                               final String uploadId,
                               final CompleteS3ShareUploadRequest request) {
    log.debug("finalizeS3Upload(uploadId={}, parts={})", uploadId, request.parts().size());
    executor.sendForSuccess(jsonRequest(sharePath(accessKey) + "/" + uploadId + "/s3")
        .PUT(executor.json(request)));
  }

  public S3ShareUploadStatus getS3UploadStatus(final String accessKey, final String uploadId) {
    log.debug("getS3UploadStatus(uploadId={})", uploadId);
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri(sharePath(accessKey) + "/" + uploadId)).GET(),
        S3ShareUploadStatus.class);
  }

  /**
   * Finalizes a proxy upload to a share.
   *
   * @param accessKey the share access key
   * @param uploadId  the upload id
   * @param keys      wrapped keys for encrypted shares, null otherwise
   * @return the stored file
   */
  public PublicUploadedFileData finalizeProxyUpload(final String accessKey,
                                                    final String uploadId,
                                                    final UserFileKeyList keys) {
    log.debug("finalizeProxyUpload(uploadId={})", uploadId);
    HttpRequest.Builder builder = jsonRequest(sharePath(accessKey) + "/" + uploadId);
    builder = keys == null ? builder.PUT(HttpRequest.BodyPublishers.noBody()) : builder.PUT(executor.json(keys));
    return executor.sendForJson(builder, PublicUploadedFileData.class);
  }

  // ── Download shares ───────────────────────────────────────────────────────

  public PublicDownloadShare getDownloadShare(final String accessKey) {
    log.debug("getDownloadShare()");
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri(downloadSharePath(accessKey))).GET(),
        PublicDownloadShare.class);
  }

  /**
   * Asks for a download URL.  Protected shares need the password, others are sent without a body.
   *
   * @param accessKey the share access key
   * @param password  the share password, null for unprotected shares
   * @return the download url
   */
  public DownloadUrlResponse generateDownloadUrl(final String accessKey, final String password) {
    log.debug("generateDownloadUrl(withPassword={})", password != null);
    HttpRequest.Builder builder = jsonRequest(downloadSharePath(accessKey));
    builder = password == null
        ? builder.POST(HttpRequest.BodyPublishers.noBody())
        : builder.POST(executor.json(new PublicDownloadTokenGenerateRequest(password)));
    return executor.sendForJson(builder, DownloadUrlResponse.class);
  }

  private HttpRequest.Builder jsonRequest(final String path) {
    return HttpRequest.newBuilder(config.apiUri(path)).header("Content-Type", "application/json");
  }

  private static String sharePath(final String accessKey) {
    return "public/shares/uploads/" + URLEncoder.encode(accessKey, StandardCharsets.UTF_8);
  }

  private static String downloadSharePath(final String accessKey) {
    return "public/shares/downloads/" + URLEncoder.encode(accessKey, StandardCharsets.UTF_8);
  }
}
