package com.codeheadsystems.coffer.model.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured JSON error body returned by the REST API for any 4xx/5xx response.
 * <p>
 * The recognizer methods let callers branch on the failure class without comparing raw numbers.
 *
 * @param code      the HTTP status code
 * @param message   the error message
 * @param debugInfo optional debug information
 * @param errorCode optional service specific error code
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiErrorResponse(
    @JsonProperty("code") int code,
    @JsonProperty("message") String message,
    @JsonProperty("debugInfo") String debugInfo,
    @JsonProperty("errorCode") Integer errorCode) {

  /**
   * Builds an error for a response whose body could not be parsed.
   *
   * @param status the HTTP status
   * @param note   what went wrong while reading the body
   * @return the api error response
   */
  public static ApiErrorResponse fallback(final int status, final String note) {
    return new ApiErrorResponse(status, "HTTP " + status, note, null);
  }

  public boolean isBadRequest() {
    return code == 400;
  }

  public boolean isUnauthorized() {
    return code == 401;
  }

  public boolean isPaymentRequired() {
    return code == 402;
  }

  public boolean isForbidden() {
    return code == 403;
  }

  public boolean isNotFound() {
    return code == 404;
  }

  public boolean isConflict() {
    return code == 409;
  }

  public boolean isPreconditionFailed() {
    return code == 412;
  }

  public boolean isTooManyRequests() {
    return code == 429;
  }

  public boolean isServerError() {
    return code >= 500;
  }

  public boolean isClientError() {
    return code >= 400 && code < 500;
  }

  @Override
  public String toString() {
    return code + " " + message + " - " + (debugInfo == null ? "No details" : debugInfo)
        + " (" + (errorCode == null ? 0 : errorCode) + ")";
  }
}
