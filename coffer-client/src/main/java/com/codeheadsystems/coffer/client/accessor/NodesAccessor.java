package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.model.download.DownloadUrlResponse;
import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.keys.MissingKeysResponse;
import com.codeheadsystems.coffer.model.keys.UserFileKeySetBatchRequest;
import com.codeheadsystems.coffer.model.node.Node;
import com.codeheadsystems.coffer.model.upload.CompleteS3FileUploadRequest;
import com.codeheadsystems.coffer.model.upload.CompleteUploadRequest;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadRequest;
import com.codeheadsystems.coffer.model.upload.CreateFileUploadResponse;
import com.codeheadsystems.coffer.model.upload.GeneratePresignedUrlsRequest;
import com.codeheadsystems.coffer.model.upload.PresignedUrlList;
import com.codeheadsystems.coffer.model.upload.S3FileUploadStatus;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the authenticated node endpoints used by uploads, downloads and key
 * distribution.  Every call except the proxy finalize asks the {@link AuthHeaderProvider} for a
 * fresh Authorization header.
 */
@Singleton
public class NodesAccessor {

  private static final Logger log = LoggerFactory.getLogger(NodesAccessor.class);

  private final CofferClientConfig config;
  private final RetryingHttpExecutor executor;
  private final AuthHeaderProvider authHeaderProvider;

  /**
   * Instantiates a new Nodes accessor.
   *
   * @param config             the config
   * @param executor           the executor
   * @param authHeaderProvider the auth header provider
   */
  @Inject
  public NodesAccessor(final CofferClientConfig config,
                       final RetryingHttpExecutor executor,
                       final AuthHeaderProvider authHeaderProvider) {
    log.info("NodesAccessor()");
    this.config = config;
    this.executor = executor;
    this.authHeaderProvider = authHeaderProvider;
  }

  // ── Upload ────────────────────────────────────────────────────────────────

  public CreateFileUploadResponse createUploadChannel(final CreateFileUploadRequest request) {
    log.debug("createUploadChannel(parentId={}, name={})", request.parentId(), request.name());
    return executor.sendForJson(authenticated(config.apiUri("nodes/files/uploads"))
        .POST(executor.json(request)), CreateFileUploadResponse.class);
  }

  public PresignedUrlList createS3UploadUrls(final String uploadId, final GeneratePresignedUrlsRequest request) {
    log.debug("createS3UploadUrls(uploadId={}, part={})", uploadId, request.firstPartNumber());
    return executor.sendForJson(authenticated(config.apiUri("nodes/files/uploads/" + uploadId + "/s3_urls"))
        .POST(executor.json(request)), PresignedUrlList.class);
  }

  /**
   * Finalizes an object storage upload. The server assembles the parts asynchronously, poll
   * {@link #getS3UploadStatus(String)} for the result.
   *
   * @param uploadId the upload id
   * @param request  the parts and options
   */
  public void finalizeS3Upload(final String uploadId, final CompleteS3FileUploadRequest request) {
    log.debug("finalizeS3Upload(uploadId={}, parts={})", uploadId, request.parts().size());
    executor.sendForSuccess(authenticated(config.apiUri("nodes/files/uploads/" + uploadId + "/s3"))
        .PUT(executor.json(request)));
  }

  public S3FileUploadStatus getS3UploadStatus(final String uploadId) {
    log.debug("getS3UploadStatus(uploadId={})", uploadId);
    return executor.sendForJson(authenticated(config.apiUri("nodes/files/uploads/" + uploadId)).GET(),
        S3FileUploadStatus.class);
  }

  /**
   * Finalizes a proxy upload. The upload token authorizes the call, no bearer token is sent.
   *
   * @param token   the upload token
   * @param request the options
   * @return the created node
   */
  public Node finalizeProxyUpload(final String token, final CompleteUploadRequest request) {
    log.debug("finalizeProxyUpload()");
    return executor.sendForJson(HttpRequest.newBuilder(config.apiUri("uploads/" + token))
        .header("Content-Type", "application/json")
        .PUT(executor.json(request)), Node.class);
  }

  // ── Download ──────────────────────────────────────────────────────────────

  public DownloadUrlResponse getDownloadUrl(final long nodeId) {
    log.debug("getDownloadUrl(nodeId={})", nodeId);
    return executor.sendForJson(authenticated(config.apiUri("nodes/files/" + nodeId + "/downloads"))
        .POST(HttpRequest.BodyPublishers.noBody()), DownloadUrlResponse.class);
  }

  public FileKey getUserFileKey(final long nodeId) {
    log.debug("getUserFileKey(nodeId={})", nodeId);
    return executor.sendForJson(authenticated(config.apiUri("nodes/files/" + nodeId + "/user_file_key")).GET(),
        FileKey.class);
  }

  // ── Keys ──────────────────────────────────────────────────────────────────

  /**
   * Fetches one page of users lacking a file key.
   *
   * @param fileId restrict to one file, null for every file the caller can distribute
   * @param limit  the page size
   * @param offset the page offset
   * @return the missing keys response
   */
  public MissingKeysResponse getMissingFileKeys(final Long fileId, final int limit, final long offset) {
    log.debug("getMissingFileKeys(fileId={}, limit={}, offset={})", fileId, limit, offset);
    StringBuilder query = new StringBuilder("nodes/missingFileKeys?limit=").append(limit)
        .append("&offset=").append(offset);
    if (fileId != null) {
      query.append("&file_id=").append(URLEncoder.encode(fileId.toString(), StandardCharsets.UTF_8));
    }
    return executor.sendForJson(authenticated(config.apiUri(query.toString())).GET(), MissingKeysResponse.class);
  }

  public void setFileKeys(final UserFileKeySetBatchRequest request) {
    log.debug("setFileKeys(items={})", request.items().size());
    executor.sendForSuccess(authenticated(config.apiUri("nodes/files/keys")).POST(executor.json(request)));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest.Builder authenticated(final URI uri) {
    return HttpRequest.newBuilder(uri)
        .header("Authorization", authHeaderProvider.getAuthHeader())
        .header("Content-Type", "application/json");
  }
}
