package com.codeheadsystems.coffer.client.exceptions;

/**
 * An encrypted operation needs the user's key pair, it is not unlocked yet and no secret was
 * supplied.
 */
public class MissingEncryptionSecretException extends CofferException {

  public MissingEncryptionSecretException() {
    super("Encryption secret required to unlock the key pair");
  }
}
