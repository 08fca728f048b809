package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.Sleeper;
import com.codeheadsystems.coffer.client.exceptions.TransportException;
import com.codeheadsystems.coffer.client.exceptions.UploadFailedException;
import com.codeheadsystems.coffer.model.error.ApiErrorResponse;
import com.codeheadsystems.coffer.model.upload.UploadState;
import com.codeheadsystems.coffer.model.upload.UploadStatusResponse;
import java.time.Duration;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls an upload status endpoint until the server reports {@code done} or {@code error}.
 * <p>
 * The delay starts at {@link #INITIAL_DELAY} and doubles after every non-terminal answer.  There
 * is no upper bound on the number of polls; callers needing bounded latency wrap the upload in
 * their own timeout.
 */
@Singleton
public class UploadStatusPoller {

  public static final Duration INITIAL_DELAY = Duration.ofMillis(300);

  private static final Logger log = LoggerFactory.getLogger(UploadStatusPoller.class);

  private final Sleeper sleeper;

  @Inject
  public UploadStatusPoller(final Sleeper sleeper) {
    log.info("UploadStatusPoller()");
    this.sleeper = sleeper;
  }

  /**
   * Polls until a terminal state.
   *
   * @param uploadId the upload id, for error reporting
   * @param status   fetches the current status
   * @param <T>      the status type
   * @return the {@code done} status
   * @throws UploadFailedException if the server reports {@code error}
   */
  public <T extends UploadStatusResponse> T await(final String uploadId, final Supplier<T> status) {
    log.debug("await(uploadId={})", uploadId);
    Duration delay = INITIAL_DELAY;
    while (true) {
      T response = status.get();
      UploadState state = response.status();
      if (state != null && state.isTerminal()) {
        if (state == UploadState.DONE) {
          return response;
        }
        ApiErrorResponse details = response.errorDetails() != null
            ? response.errorDetails()
            : ApiErrorResponse.fallback(500, "upload reported error without details");
        log.error("await(uploadId={}): upload failed: {}", uploadId, details);
        throw new UploadFailedException(uploadId, details);
      }
      log.debug("await(uploadId={}): {}, next poll in {}", uploadId, state, delay);
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportException(TransportException.Kind.UNKNOWN,
            "Interrupted while waiting for upload " + uploadId, e);
      }
      delay = delay.multipliedBy(2);
    }
  }
}
