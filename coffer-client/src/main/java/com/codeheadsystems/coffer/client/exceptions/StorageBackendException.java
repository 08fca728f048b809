package com.codeheadsystems.coffer.client.exceptions;

import com.codeheadsystems.coffer.model.error.S3ErrorResponse;

/**
 * The object storage rejected a part upload or a ranged download.
 */
public class StorageBackendException extends CofferException {

  private final int statusCode;
  private final transient S3ErrorResponse error;

  /**
   * Instantiates a new Storage backend exception.
   *
   * @param statusCode the HTTP status
   * @param error      the parsed XML error
   */
  public StorageBackendException(final int statusCode, final S3ErrorResponse error) {
    super("Storage backend error: " + error + " (" + statusCode + ")");
    this.statusCode = statusCode;
    this.error = error;
  }

  public int statusCode() {
    return statusCode;
  }

  public S3ErrorResponse error() {
    return error;
  }

  public boolean isUnauthorized() {
    return statusCode == 401;
  }

  public boolean isForbidden() {
    return statusCode == 403;
  }

  public boolean isNotFound() {
    return statusCode == 404;
  }

  public boolean isBadRequest() {
    return statusCode == 400;
  }

  public boolean isPaymentRequired() {
    return statusCode == 402;
  }

  public boolean isConflict() {
    return statusCode == 409;
  }

  public boolean isPreconditionFailed() {
    return statusCode == 412;
  }

  public boolean isTooManyRequests() {
    return statusCode == 429;
  }

  public boolean isServerError() {
    return statusCode >= 500;
  }

  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }
}
