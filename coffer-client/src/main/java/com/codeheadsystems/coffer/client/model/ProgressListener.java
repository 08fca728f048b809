package com.codeheadsystems.coffer.client.model;

/**
 * Receives transfer progress after every processed chunk.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (bytesSoFar, total) -> { };

  /**
   * Called after a chunk was transferred.
   *
   * @param bytesSoFar bytes transferred so far
   * @param total      total bytes of the transfer
   */
  void onProgress(long bytesSoFar, long total);
}
