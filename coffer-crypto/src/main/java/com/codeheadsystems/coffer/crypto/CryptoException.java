package com.codeheadsystems.coffer.crypto;

/**
 * Raised when encryption, decryption, key wrapping or key parsing fails. Content guarded by the
 * failing operation must not be trusted.
 */
public class CryptoException extends RuntimeException {

  /**
   * Instantiates a new Crypto exception.
   *
   * @param message the message
   */
  public CryptoException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Crypto exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
