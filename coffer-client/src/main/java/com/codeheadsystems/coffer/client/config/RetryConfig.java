package com.codeheadsystems.coffer.client.config;

import java.time.Duration;

/**
 * Retry bounds for transient failures, 429 and 5xx responses.
 * <p>
 * Values outside the service limits are clamped: the minimum delay to [300 ms, 600 ms], the
 * maximum delay to [minimum delay, 20 s] and the attempt count to [1, 5].  Use
 * {@link #forTesting(int)} to disable waiting entirely.
 *
 * @param minDelay    the delay before the second attempt
 * @param maxDelay    the upper bound of any single delay, before jitter
 * @param maxAttempts total number of attempts, including the first
 */
public record RetryConfig(Duration minDelay, Duration maxDelay, int maxAttempts) {

  public static final Duration MIN_RETRY_DELAY_FLOOR = Duration.ofMillis(300);
  public static final Duration DEFAULT_MIN_RETRY_DELAY = Duration.ofMillis(600);
  public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(20);
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  /**
   * Creates the default retry config.
   *
   * @return the retry config
   */
  public static RetryConfig defaults() {
    return new RetryConfig(DEFAULT_MIN_RETRY_DELAY, DEFAULT_MAX_RETRY_DELAY, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Creates a retry config from user supplied values, clamped to the service limits.
   *
   * @param minDelay    the min delay, null for the default
   * @param maxDelay    the max delay, null for the default
   * @param maxAttempts the max attempts, null for the default
   * @return the retry config
   */
  public static RetryConfig clamped(final Duration minDelay, final Duration maxDelay, final Integer maxAttempts) {
    Duration min = clamp(minDelay == null ? DEFAULT_MIN_RETRY_DELAY : minDelay,
        MIN_RETRY_DELAY_FLOOR, DEFAULT_MIN_RETRY_DELAY);
    Duration max = clamp(maxDelay == null ? DEFAULT_MAX_RETRY_DELAY : maxDelay, min, DEFAULT_MAX_RETRY_DELAY);
    int attempts = Math.max(1, Math.min(DEFAULT_MAX_ATTEMPTS, maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts));
    return new RetryConfig(min, max, attempts);
  }

  /**
   * Test-only config: retries without waiting.  Do not use in production.
   *
   * @param maxAttempts the max attempts
   * @return the retry config
   */
  public static RetryConfig forTesting(final int maxAttempts) {
    return new RetryConfig(Duration.ZERO, Duration.ZERO, maxAttempts);
  }

  /**
   * The backoff before attempt {@code attempt + 1}, without jitter.
   *
   * @param attempt the attempt that just failed, 1-based
   * @return the delay
   */
  public Duration backoff(final int attempt) {
    long base = minDelay.toMillis();
    long factor = 1L << Math.min(attempt - 1, 30);
    long delay = base > maxDelay.toMillis() / factor ? maxDelay.toMillis() : base * factor;
    return Duration.ofMillis(Math.min(delay, maxDelay.toMillis()));
  }

  private static Duration clamp(final Duration value, final Duration lower, final Duration upper) {
    if (value.compareTo(lower) < 0) {
      return lower;
    }
    return value.compareTo(upper) > 0 ? upper : value;
  }
}
