package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.client.model.TransferChunkPlan;
import com.codeheadsystems.coffer.model.upload.S3FileUploadPart;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a source into the parts of a {@link TransferChunkPlan} and pushes them either to
 * pre-signed object storage URLs or to a proxy upload URL.  Shared by node and share uploads.
 */
@Singleton
public class ChunkedTransfer {

  private static final Logger log = LoggerFactory.getLogger(ChunkedTransfer.class);

  private final ContentAccessor contentAccessor;

  @Inject
  public ChunkedTransfer(final ContentAccessor contentAccessor) {
    log.info("ChunkedTransfer()");
    this.contentAccessor = contentAccessor;
  }

  /**
   * Uploads every part to its own single-part pre-signed URL.
   *
   * @param source   the source, positioned at the first byte
   * @param plan     the plan
   * @param urls     issues the pre-signed URL of a part
   * @param listener the progress listener
   * @return part numbers and ETags, in part order
   */
  public List<S3FileUploadPart> toObjectStorage(final InputStream source,
                                                final TransferChunkPlan plan,
                                                final PresignedUrlSource urls,
                                                final ProgressListener listener) {
    log.debug("toObjectStorage(size={}, parts={})", plan.totalSize(), plan.parts());
    List<S3FileUploadPart> parts = new ArrayList<>(plan.parts());
    long transferred = 0;
    for (int partNumber = 1; partNumber <= plan.parts(); partNumber++) {
      long partSize = plan.partSize(partNumber);
      byte[] part = read(source, partSize, plan.offset(partNumber));
      URI url = urls.urlFor(partNumber, partSize);
      String etag = contentAccessor.putPart(url, part);
      parts.add(new S3FileUploadPart(partNumber, etag));
      transferred += partSize;
      listener.onProgress(transferred, plan.totalSize());
    }
    return parts;
  }

  /**
   * Posts every part to the proxy upload URL with a Content-Range header.
   *
   * @param uploadUrl the upload url
   * @param source    the source, positioned at the first byte
   * @param plan      the plan
   * @param listener  the progress listener
   */
  public void toProxy(final URI uploadUrl,
                      final InputStream source,
                      final TransferChunkPlan plan,
                      final ProgressListener listener) {
    log.debug("toProxy(size={}, parts={})", plan.totalSize(), plan.parts());
    long transferred = 0;
    for (int partNumber = 1; partNumber <= plan.parts(); partNumber++) {
      long offset = plan.offset(partNumber);
      byte[] chunk = read(source, plan.partSize(partNumber), offset);
      contentAccessor.postChunk(uploadUrl, chunk, offset, plan.totalSize());
      transferred += chunk.length;
      listener.onProgress(transferred, plan.totalSize());
    }
  }

  /**
   * Reads exactly {@code size} bytes.
   *
   * @param source the source
   * @param size   the number of bytes
   * @return the bytes
   */
  public static byte[] readFully(final InputStream source, final long size) {
    return read(source, size, 0);
  }

  private static byte[] read(final InputStream source, final long size, final long offset) {
    if (size > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException("Cannot buffer " + size + " bytes");
    }
    try {
      byte[] bytes = source.readNBytes((int) size);
      if (bytes.length != size) {
        throw new CofferException("Source ended after " + (offset + bytes.length)
            + " bytes, expected " + (offset + size));
      }
      return bytes;
    } catch (IOException e) {
      throw new CofferException("Unable to read upload source at offset " + offset, e);
    }
  }

  /**
   * Issues the pre-signed URL of one part.
   */
  @FunctionalInterface
  public interface PresignedUrlSource {

    /**
     * Url for uri.
     *
     * @param partNumber the 1-based part number
     * @param partSize   the exact size of the part
     * @return the pre-signed url
     */
    URI urlFor(int partNumber, long partSize);
  }
}
