package com.codeheadsystems.coffer.client.exceptions;

/**
 * Base type of every failure raised by the client.
 */
public class CofferException extends RuntimeException {

  /**
   * Instantiates a new Coffer exception.
   *
   * @param message the message
   */
  public CofferException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Coffer exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CofferException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
