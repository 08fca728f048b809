package com.codeheadsystems.coffer.client.accessor;

/**
 * Supplies the Authorization header value for authenticated API calls.
 */
@FunctionalInterface
public interface AuthHeaderProvider {

  /**
   * Returns a header for a token that is not expired, refreshing it first if needed.
   *
   * @return e.g. {@code Bearer abc}
   */
  String getAuthHeader();
}
