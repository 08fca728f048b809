package com.codeheadsystems.coffer.client.model;

/**
 * How a transfer of {@code totalSize} bytes is cut into parts of {@code chunkSize} bytes.
 * <p>
 * Every part but the last has {@code chunkSize} bytes.  A size that is an exact multiple of the
 * chunk size ends with a full part, never an empty one, and an empty transfer still has one part
 * of zero bytes.
 *
 * @param totalSize    the total size
 * @param chunkSize    the chunk size
 * @param parts        the number of parts
 * @param lastPartSize the size of the last part
 */
public record TransferChunkPlan(long totalSize, long chunkSize, int parts, long lastPartSize) {

  /**
   * Computes the plan.
   *
   * @param totalSize the total size
   * @param chunkSize the chunk size
   * @return the transfer chunk plan
   */
  public static TransferChunkPlan of(final long totalSize, final long chunkSize) {
    if (totalSize < 0) {
      throw new IllegalArgumentException("totalSize must not be negative: " + totalSize);
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (totalSize == 0) {
      return new TransferChunkPlan(0, chunkSize, 1, 0);
    }
    long full = totalSize / chunkSize;
    long remainder = totalSize % chunkSize;
    long parts = remainder == 0 ? full : full + 1;
    if (parts > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Too many parts for chunk size " + chunkSize);
    }
    return new TransferChunkPlan(totalSize, chunkSize, (int) parts, remainder == 0 ? chunkSize : remainder);
  }

  /**
   * The size of a part.
   *
   * @param partNumber 1-based part number
   * @return the size
   */
  public long partSize(final int partNumber) {
    checkPart(partNumber);
    return partNumber == parts ? lastPartSize : chunkSize;
  }

  /**
   * Offset of the first byte of a part.
   *
   * @param partNumber 1-based part number
   * @return the offset
   */
  public long offset(final int partNumber) {
    checkPart(partNumber);
    return (partNumber - 1) * chunkSize;
  }

  private void checkPart(final int partNumber) {
    if (partNumber < 1 || partNumber > parts) {
      throw new IllegalArgumentException("Part " + partNumber + " outside 1.." + parts);
    }
  }
}
