package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.exceptions.AuthenticationException;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.exceptions.HttpApiException;
import com.codeheadsystems.coffer.client.exceptions.StorageBackendException;
import com.codeheadsystems.coffer.model.auth.OAuth2ErrorResponse;
import com.codeheadsystems.coffer.model.error.ApiErrorResponse;
import com.codeheadsystems.coffer.model.error.S3ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns error responses into typed exceptions.
 * <p>
 * A body that cannot be parsed, including a literal JSON {@code null}, never hides the failure: a
 * fallback error is built from the status code and a short note instead.
 */
@Singleton
public class ErrorResponseParser {

  static final String PARSE_FAILURE = "failed to parse error body";

  private static final Logger log = LoggerFactory.getLogger(ErrorResponseParser.class);

  private final ObjectMapper objectMapper;
  private final XmlMapper xmlMapper;

  /**
   * Instantiates a new Error response parser.
   *
   * @param objectMapper the object mapper
   * @param xmlMapper    the xml mapper
   */
  @Inject
  public ErrorResponseParser(final ObjectMapper objectMapper, final XmlMapper xmlMapper) {
    log.info("ErrorResponseParser()");
    this.objectMapper = objectMapper;
    this.xmlMapper = xmlMapper;
  }

  /**
   * Parses a JSON API error body.
   *
   * @param status the status
   * @param body   the body
   * @return the http api exception
   */
  public HttpApiException apiError(final int status, final String body) {
    if (body == null || body.isBlank()) {
      return new HttpApiException(ApiErrorResponse.fallback(status, PARSE_FAILURE));
    }
    try {
      ApiErrorResponse parsed = objectMapper.readValue(body, ApiErrorResponse.class);
      if (parsed == null) {
        return new HttpApiException(ApiErrorResponse.fallback(status, PARSE_FAILURE));
      }
      if (parsed.code() != status) {
        parsed = new ApiErrorResponse(status, parsed.message(), parsed.debugInfo(), parsed.errorCode());
      }
      return new HttpApiException(parsed);
    } catch (IOException e) {
      log.debug("apiError(status={}): unparsable body", status, e);
      return new HttpApiException(ApiErrorResponse.fallback(status, PARSE_FAILURE));
    }
  }

  /**
   * Parses an S3 XML error document.
   *
   * @param status the status
   * @param body   the body
   * @return the storage backend exception
   */
  public StorageBackendException storageError(final int status, final String body) {
    if (body != null && !body.isBlank()) {
      try {
        S3ErrorResponse parsed = xmlMapper.readValue(body, S3ErrorResponse.class);
        if (parsed != null) {
          return new StorageBackendException(status, parsed);
        }
      } catch (IOException e) {
        log.debug("storageError(status={}): unparsable body", status, e);
      }
    }
    return new StorageBackendException(status,
        new S3ErrorResponse(null, "HTTP " + status + ": " + PARSE_FAILURE, null, null, null));
  }

  /**
   * Parses the error of a content transfer, which is XML when it comes from object storage and
   * JSON when it comes from the API itself.
   *
   * @param status the status
   * @param body   the body
   * @return the exception
   */
  public CofferException contentError(final int status, final String body) {
    if (body != null && body.stripLeading().startsWith("<")) {
      return storageError(status, body);
    }
    return apiError(status, body);
  }

  /**
   * Parses the error of an OAuth endpoint.
   *
   * @param status the status
   * @param body   the body
   * @return an {@link AuthenticationException} for an OAuth error body, otherwise an api error
   */
  public CofferException oauthError(final int status, final String body) {
    if (body != null && !body.isBlank()) {
      try {
        OAuth2ErrorResponse error = objectMapper.readValue(body, OAuth2ErrorResponse.class);
        if (error != null && error.error() != null) {
          return new AuthenticationException(error);
        }
      } catch (IOException e) {
        log.debug("oauthError(status={}): not an OAuth error body", status, e);
      }
    }
    return apiError(status, body);
  }
}
