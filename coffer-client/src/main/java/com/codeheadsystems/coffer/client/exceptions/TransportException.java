package com.codeheadsystems.coffer.client.exceptions;

/**
 * The request never produced an HTTP response. Raised only after the retry policy gave up.
 */
public class TransportException extends CofferException {

  private final Kind kind;

  /**
   * Instantiates a new Transport exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public TransportException(final Kind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * The transport failure class.
   */
  public enum Kind {
    TIMEOUT,
    CONNECTION_FAILED,
    UNKNOWN
  }
}
