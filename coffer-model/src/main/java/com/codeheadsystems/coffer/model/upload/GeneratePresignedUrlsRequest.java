package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requests presigned URLs for the parts {@code firstPartNumber..lastPartNumber}, each of
 * {@code size} bytes.
 *
 * @param size            the part size in bytes
 * @param firstPartNumber the first part number, 1-based
 * @param lastPartNumber  the last part number, inclusive
 */
public record GeneratePresignedUrlsRequest(
    @JsonProperty("size") long size,
    @JsonProperty("firstPartNumber") int firstPartNumber,
    @JsonProperty("lastPartNumber") int lastPartNumber) {

  public static GeneratePresignedUrlsRequest singlePart(final long size, final int partNumber) {
    return new GeneratePresignedUrlsRequest(size, partNumber, partNumber);
  }
}
