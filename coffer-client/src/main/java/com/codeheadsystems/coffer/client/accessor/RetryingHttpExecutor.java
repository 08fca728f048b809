package com.codeheadsystems.coffer.client.accessor;

import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.config.RetryConfig;
import com.codeheadsystems.coffer.client.exceptions.CofferException;
import com.codeheadsystems.coffer.client.exceptions.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends requests through the JDK {@link HttpClient} with the client's retry policy.
 * <p>
 * I/O failures, 429 and 5xx responses are retried with exponential backoff plus up to 10% jitter
 * until {@link RetryConfig#maxAttempts()} calls were made.  After that an I/O failure surfaces as
 * a {@link TransportException} and an error response is returned to the caller unchanged, to be
 * turned into a typed exception by its status check.  Every request carries the configured
 * User-Agent and request timeout.
 * <p>
 * URIs in log lines and exception messages go through {@link #loggable(URI)}: presigned query
 * strings and path tokens grant access on their own and never leave the process.
 */
@Singleton
public class RetryingHttpExecutor {

  private static final Logger log = LoggerFactory.getLogger(RetryingHttpExecutor.class);

  private static final String[] TOKEN_SEGMENTS = {"/uploads/", "/downloads/"};
  private static final String REDACTED = "***";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ErrorResponseParser errors;
  private final CofferClientConfig config;
  private final Sleeper sleeper;

  /**
   * Instantiates a new Retrying http executor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param errors       the error parser
   * @param config       the client config
   * @param sleeper      the sleeper used between attempts
   */
  @Inject
  public RetryingHttpExecutor(final HttpClient httpClient,
                              final ObjectMapper objectMapper,
                              final ErrorResponseParser errors,
                              final CofferClientConfig config,
                              final Sleeper sleeper) {
    log.info("RetryingHttpExecutor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.errors = errors;
    this.config = config;
    this.sleeper = sleeper;
  }

  public ErrorResponseParser errors() {
    return errors;
  }

  // ── Raw dispatch ──────────────────────────────────────────────────────────

  /**
   * Sends the request, retrying as configured. The final response is returned whatever its status.
   *
   * @param builder the request builder
   * @param handler the body handler
   * @param <T>     the body type
   * @return the last response
   */
  public <T> HttpResponse<T> send(final HttpRequest.Builder builder, final HttpResponse.BodyHandler<T> handler) {
    HttpRequest request = builder
        .setHeader("User-Agent", config.userAgent())
        .timeout(config.requestTimeout())
        .build();
    RetryConfig retry = config.retryConfig();
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        HttpResponse<T> response = httpClient.send(request, handler);
        if (!isRetryable(response.statusCode()) || attempt >= retry.maxAttempts()) {
          return response;
        }
        log.warn("send({} {}): HTTP {} on attempt {}/{}, retrying", request.method(),
            loggable(request.uri()), response.statusCode(), attempt, retry.maxAttempts());
      } catch (IOException e) {
        if (attempt >= retry.maxAttempts()) {
          log.error("send({} {}): giving up after {} attempts", request.method(),
              loggable(request.uri()), attempt, e);
          throw transportFailure(request, e);
        }
        log.warn("send({} {}): {} on attempt {}/{}, retrying", request.method(), loggable(request.uri()),
            e.getClass().getSimpleName(), attempt, retry.maxAttempts());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportException(TransportException.Kind.UNKNOWN,
            "HTTP request interrupted for: " + loggable(request.uri()), e);
      }
      pause(retry, attempt, request);
    }
  }

  // ── Typed helpers ─────────────────────────────────────────────────────────

  /**
   * Sends the request and parses a JSON response body.
   *
   * @param builder      the request builder
   * @param responseType the response type
   * @param <T>          the response type
   * @return the parsed body
   */
  public <T> T sendForJson(final HttpRequest.Builder builder, final Class<T> responseType) {
    HttpResponse<String> response = send(builder.header("Accept", "application/json"),
        HttpResponse.BodyHandlers.ofString());
    checkStatus(response);
    return readJson(response.body(), responseType);
  }

  /**
   * Sends the request and only checks for a success status.
   *
   * @param builder the request builder
   */
  public void sendForSuccess(final HttpRequest.Builder builder) {
    checkStatus(send(builder, HttpResponse.BodyHandlers.ofString()));
  }

  /**
   * Sends a content request. Failures are parsed as object storage XML or API JSON.
   *
   * @param builder the request builder
   * @return the response with the raw body
   */
  public HttpResponse<byte[]> sendForContent(final HttpRequest.Builder builder) {
    HttpResponse<byte[]> response = send(builder, HttpResponse.BodyHandlers.ofByteArray());
    if (!isSuccess(response.statusCode())) {
      byte[] body = response.body();
      throw errors.contentError(response.statusCode(),
          body == null ? null : new String(body, StandardCharsets.UTF_8));
    }
    return response;
  }

  /**
   * Serializes a request body.
   *
   * @param body the body
   * @return the body publisher
   */
  public HttpRequest.BodyPublisher json(final Object body) {
    try {
      return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
    } catch (JsonProcessingException e) {
      throw new CofferException("Unable to serialize request body: " + body.getClass().getSimpleName(), e);
    }
  }

  /**
   * Parses a JSON body.
   *
   * @param body         the body
   * @param responseType the response type
   * @param <T>          the type
   * @return the value
   */
  public <T> T readJson(final String body, final Class<T> responseType) {
    T value;
    try {
      value = objectMapper.readValue(body, responseType);
    } catch (IOException e) {
      throw new CofferException("Unable to parse " + responseType.getSimpleName() + " response", e);
    }
    if (value == null) {
      throw new CofferException("Empty " + responseType.getSimpleName() + " response");
    }
    return value;
  }

  public static boolean isSuccess(final int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  static boolean isRetryable(final int statusCode) {
    return statusCode == 429 || statusCode >= 500;
  }

  private void checkStatus(final HttpResponse<String> response) {
    if (!isSuccess(response.statusCode())) {
      throw errors.apiError(response.statusCode(), response.body());
    }
  }

  private void pause(final RetryConfig retry, final int attempt, final HttpRequest request) {
    Duration delay = retry.backoff(attempt);
    long jitter = delay.toMillis() < 10 ? 0 : ThreadLocalRandom.current().nextLong(delay.toMillis() / 10);
    try {
      sleeper.sleep(delay.plusMillis(jitter));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(TransportException.Kind.UNKNOWN,
          "Interrupted while waiting to retry: " + loggable(request.uri()), e);
    }
  }

  private static TransportException transportFailure(final HttpRequest request, final IOException e) {
    if (e instanceof HttpTimeoutException) {
      return new TransportException(TransportException.Kind.TIMEOUT, "Timeout: " + loggable(request.uri()), e);
    }
    if (e instanceof ConnectException) {
      return new TransportException(TransportException.Kind.CONNECTION_FAILED,
          "Connection failed: " + loggable(request.uri()), e);
    }
    return new TransportException(TransportException.Kind.UNKNOWN,
        "HTTP request failed for: " + loggable(request.uri()), e);
  }

  /**
   * Renders a URI for logs and messages. The query and fragment are dropped and any path below an
   * {@code uploads} or {@code downloads} segment is replaced by {@value #REDACTED}.
   *
   * @param uri the uri
   * @return the printable form
   */
  static String loggable(final URI uri) {
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    for (String segment : TOKEN_SEGMENTS) {
      int index = path.indexOf(segment);
      if (index >= 0 && index + segment.length() < path.length()) {
        path = path.substring(0, index + segment.length()) + REDACTED;
        break;
      }
    }
    StringBuilder out = new StringBuilder();
    if (uri.getScheme() != null) {
      out.append(uri.getScheme()).append("://");
    }
    if (uri.getHost() != null) {
      out.append(uri.getHost());
      if (uri.getPort() >= 0) {
        out.append(':').append(uri.getPort());
      }
    }
    return out.append(path).toString();
  }
}
