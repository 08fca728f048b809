package com.codeheadsystems.coffer.client.exceptions;

/**
 * Invalid or incomplete client configuration. Raised while building a client and never retried.
 */
public class ConfigurationException extends CofferException {

  private final Kind kind;

  /**
   * Instantiates a new Configuration exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public ConfigurationException(final Kind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final Kind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * What is wrong with the configuration.
   */
  public enum Kind {
    MISSING_BASE_URL,
    MISSING_CLIENT_ID,
    MISSING_CLIENT_SECRET,
    INVALID_URL,
    MISSING_ARGUMENT
  }
}
