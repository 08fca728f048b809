package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.exceptions.CofferException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves raw bytes to and from the URLs handed out by the API: pre-signed object storage URLs,
 * proxy upload URLs and download URLs.  None of these carry a bearer token.
 */
@Singleton
public class ContentAccessor {

  private static final Logger log = LoggerFactory.getLogger(ContentAccessor.class);

  private final RetryingHttpExecutor executor;

  /**
   * Instantiates a new Content accessor.
   *
   * @param executor the executor
   */
  @Inject
  public ContentAccessor(final RetryingHttpExecutor executor) {
    log.info("ContentAccessor()");
    this.executor = executor;
  }

  /**
   * Uploads one part to a pre-signed URL.
   *
   * @param url  the pre-signed url
   * @param part the part bytes
   * @return the ETag of the stored part, without surrounding quotes
   */
  public String putPart(final URI url, final byte[] part) {
    log.debug("putPart(length={})", part.length);
    HttpResponse<byte[]> response = executor.sendForContent(HttpRequest.newBuilder(url)
        .header("Content-Type", "application/octet-stream")
        .PUT(HttpRequest.BodyPublishers.ofByteArray(part)));
    return response.headers().firstValue("ETag")
        .map(ContentAccessor::trimQuotes)
        .orElseThrow(() -> new CofferException("Object storage response carries no ETag"));
  }

  /**
   * Uploads one chunk to a proxy upload URL.
   * <p>
   * A chunk of {@code n} bytes at {@code start} is sent as {@code bytes start-min(start+n,total)/total},
   * the form the upload proxy accepts.  An empty file is sent as {@code bytes 0-0/0}.
   *
   * @param url   the upload url
   * @param chunk the chunk bytes
   * @param start the offset of the chunk
   * @param total the total size
   */
  public void postChunk(final URI url, final byte[] chunk, final long start, final long total) {
    String range = contentRange(start, chunk.length, total);
    log.debug("postChunk({})", range);
    executor.sendForContent(HttpRequest.newBuilder(url)
        .header("Content-Type", "application/octet-stream")
        .header("Content-Range", range)
        .POST(HttpRequest.BodyPublishers.ofByteArray(chunk)));
  }

  /**
   * Fetches an inclusive byte range.
   *
   * @param url   the download url
   * @param start first byte
   * @param end   last byte, inclusive
   * @return the bytes
   */
  public byte[] getRange(final URI url, final long start, final long end) {
    log.debug("getRange(bytes={}-{})", start, end);
    return executor.sendForContent(HttpRequest.newBuilder(url)
        .header("Range", "bytes=" + start + "-" + end)
        .GET()).body();
  }

  /**
   * Asks for the first byte only and reads the total size from the Content-Range header.
   *
   * @param url the download url
   * @return the total size, empty when the server does not report one
   */
  public Optional<Long> fetchTotalSize(final URI url) {
    log.debug("fetchTotalSize()");
    HttpResponse<byte[]> response = executor.sendForContent(HttpRequest.newBuilder(url)
        .header("Range", "bytes=0-0")
        .GET());
    return response.headers().firstValue("Content-Range").flatMap(ContentAccessor::totalFromContentRange);
  }

  static String contentRange(final long start, final long length, final long total) {
    long end = length == 0 ? start : Math.min(start + length, total);
    return "bytes " + start + "-" + end + "/" + total;
  }

  static Optional<Long> totalFromContentRange(final String header) {
    int slash = header.lastIndexOf('/');
    if (slash < 0 || slash == header.length() - 1) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(header.substring(slash + 1).trim()));
    } catch (NumberFormatException e) {
      log.warn("fetchTotalSize(): unparsable Content-Range {}", header);
      return Optional.empty();
    }
  }

  private static String trimQuotes(final String etag) {
    String trimmed = etag.trim();
    if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
      return trimmed.substring(1, trimmed.length() - 1);
    }
    return trimmed;
  }
}
