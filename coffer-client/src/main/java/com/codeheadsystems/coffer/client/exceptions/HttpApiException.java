package com.codeheadsystems.coffer.client.exceptions;

import com.codeheadsystems.coffer.model.error.ApiErrorResponse;

/**
 * The REST API answered with a 4xx or 5xx status.
 */
public class HttpApiException extends CofferException {

  private final transient ApiErrorResponse error;

  /**
   * Instantiates a new Http api exception.
   *
   * @param error the parsed or synthesized error body
   */
  public HttpApiException(final ApiErrorResponse error) {
    super(error.toString());
    this.error = error;
  }

  public ApiErrorResponse error() {
    return error;
  }

  public int statusCode() {
    return error.code();
  }

  public boolean isBadRequest() {
    return error.isBadRequest();
  }

  public boolean isUnauthorized() {
    return error.isUnauthorized();
  }

  public boolean isPaymentRequired() {
    return error.isPaymentRequired();
  }

  public boolean isForbidden() {
    return error.isForbidden();
  }

  public boolean isNotFound() {
    return error.isNotFound();
  }

  public boolean isConflict() {
    return error.isConflict();
  }

  public boolean isPreconditionFailed() {
    return error.isPreconditionFailed();
  }

  public boolean isTooManyRequests() {
    return error.isTooManyRequests();
  }

  public boolean isServerError() {
    return error.isServerError();
  }

  public boolean isClientError() {
    return error.isClientError();
  }
}
