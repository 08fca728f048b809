package com.codeheadsystems.coffer.client.exceptions;

import com.codeheadsystems.coffer.model.error.ApiErrorResponse;

/**
 * The server reported that assembling a finalized upload failed.
 */
public class UploadFailedException extends HttpApiException {

  private final String uploadId;

  /**
   * Instantiates a new Upload failed exception.
   *
   * @param uploadId the upload id
   * @param error    the error details from the status document
   */
  public UploadFailedException(final String uploadId, final ApiErrorResponse error) {
    super(error);
    this.uploadId = uploadId;
  }

  public String uploadId() {
    return uploadId;
  }
}
