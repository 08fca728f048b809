package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.model.ProgressListener;
import com.codeheadsystems.coffer.crypto.FileDecrypter;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.Arrays;

/**
 * Sequential ranged GETs for one file, shared by the node and public share download paths.
 */
final class RangedDownload {

  private final ContentAccessor contentAccessor;
  private final String subject;
  private final long total;
  private final long rangeSize;
  private final ProgressListener listener;

  /**
   * Instantiates a new Ranged download.
   *
   * @param contentAccessor the content accessor
   * @param subject         names the file in error messages
   * @param total           the total size in bytes
   * @param rangeSize       bytes per range, positive
   * @param listener        progress, called after every range
   */
  RangedDownload(final ContentAccessor contentAccessor,
                 final String subject,
                 final long total,
                 final long rangeSize,
                 final ProgressListener listener) {
    this.contentAccessor = contentAccessor;
    this.subject = subject;
    this.total = total;
    this.rangeSize = rangeSize;
    this.listener = listener == null ? ProgressListener.NONE : listener;
  }

  static long checkRangeSize(final Integer chunkSize, final int defaultSize) {
    long rangeSize = chunkSize == null ? defaultSize : chunkSize;
    if (rangeSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + rangeSize);
    }
    return rangeSize;
  }

  /**
   * Writes every range to {@code out} as it arrives.
   *
   * @param urls the url for each range offset
   * @param out  the output
   */
  void plain(final UrlSource urls, final OutputStream out) {
    read(urls, out::write);
  }

  /**
   * Decrypts every range into memory and writes the plain text once the tag verified.
   *
   * @param urls     the url for each range offset
   * @param plainKey the unwrapped file key
   * @param out      the output
   */
  void decrypting(final UrlSource urls, final PlainFileKey plainKey, final OutputStream out) {
    if (total > Integer.MAX_VALUE - 8) {
      throw new CofferException("Encrypted file of " + total + " bytes is too large to decrypt in memory");
    }
    FileDecrypter decrypter = FileDecrypter.create(plainKey);
    ByteArrayOutputStream plainText = new ByteArrayOutputStream((int) total);
    read(urls, range -> plainText.writeBytes(decrypter.update(range, 0, range.length)));
    plainText.writeBytes(decrypter.doFinal());
    byte[] result = plainText.toByteArray();
    try {
      out.write(result);
    } catch (IOException e) {
      throw new CofferException("Unable to write download of " + subject, e);
    } finally {
      Arrays.fill(result, (byte) 0);
    }
  }

  private void read(final UrlSource urls, final RangeSink sink) {
    long downloaded = 0;
    while (downloaded < total) {
      URI url = urls.urlFor(downloaded);
      long end = Math.min(downloaded + rangeSize - 1, total - 1);
      byte[] range = contentAccessor.getRange(url, downloaded, end);
      if (range.length == 0) {
        throw new CofferException("Empty range " + downloaded + "-" + end + " for " + subject);
      }
      try {
        sink.accept(range);
      } catch (IOException e) {
        throw new CofferException("Unable to write download of " + subject, e);
      }
      downloaded += range.length;
      listener.onProgress(downloaded, total);
    }
  }

  /**
   * Supplies the URL for the range starting at {@code offset}.
   */
  @FunctionalInterface
  interface UrlSource {
    URI urlFor(long offset);
  }

  @FunctionalInterface
  private interface RangeSink {
    void accept(byte[] range) throws IOException;
  }
}
