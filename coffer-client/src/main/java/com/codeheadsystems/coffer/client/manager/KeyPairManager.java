package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.UserAccountAccessor;
import com.codeheadsystems.coffer.client.exceptions.MissingEncryptionSecretException;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.crypto.UserKeyPairCrypto;
import com.codeheadsystems.coffer.model.keys.UserKeyPairContainer;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unlocks the user's key pair once per session and keeps it in memory until {@link #close()}.
 * Users without a key pair create one with {@link #setUpKeyPair(String, SecretValue)}.
 */
@Singleton
public class KeyPairManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KeyPairManager.class);

  private final UserAccountAccessor userAccountAccessor;
  private final ReentrantLock lock = new ReentrantLock();
  private UnlockedKeyPair keyPair;

  @Inject
  public KeyPairManager(final UserAccountAccessor userAccountAccessor) {
    log.info("KeyPairManager()");
    this.userAccountAccessor = userAccountAccessor;
  }

  /**
   * Returns the cached key pair, or fetches and unlocks it with the given secret.
   *
   * @param secret the encryption secret, may be null once the pair is unlocked
   * @return the unlocked key pair
   * @throws MissingEncryptionSecretException if nothing is cached and no secret was given
   */
  public UnlockedKeyPair getUnlockedKeyPair(final SecretValue secret) {
    lock.lock();
    try {
      if (keyPair != null && !keyPair.isClosed()) {
        return keyPair;
      }
      if (secret == null || secret.isDestroyed() || secret.isEmpty()) {
        throw new MissingEncryptionSecretException();
      }
      log.debug("getUnlockedKeyPair(): unlocking");
      UserKeyPairContainer container = userAccountAccessor.getUserKeyPair();
      keyPair = UserKeyPairCrypto.unlock(container, secret);
      return keyPair;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Generates a key pair, stores it server side and keeps it unlocked for this session.
   *
   * @param version {@link com.codeheadsystems.coffer.crypto.FileKeyCrypto#KEYPAIR_VERSION_2048} or
   *                {@link com.codeheadsystems.coffer.crypto.FileKeyCrypto#KEYPAIR_VERSION_4096}
   * @param secret  the encryption secret protecting the private key
   * @return the unlocked key pair
   * @throws MissingEncryptionSecretException if no secret was given
   */
  public UnlockedKeyPair setUpKeyPair(final String version, final SecretValue secret) {
    if (secret == null || secret.isDestroyed() || secret.isEmpty()) {
      throw new MissingEncryptionSecretException();
    }
    lock.lock();
    try {
      log.debug("setUpKeyPair(version={})", version);
      UserKeyPairContainer container = UserKeyPairCrypto.generate(version, secret);
      userAccountAccessor.setUserKeyPair(container);
      UnlockedKeyPair unlocked = UserKeyPairCrypto.unlock(container, secret);
      if (keyPair != null) {
        keyPair.close();
      }
      keyPair = unlocked;
      return keyPair;
    } finally {
      lock.unlock();
    }
  }

  public boolean isUnlocked() {
    lock.lock();
    try {
      return keyPair != null && !keyPair.isClosed();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (keyPair != null) {
        log.debug("close(): erasing unlocked key pair");
        keyPair.close();
        keyPair = null;
      }
    } finally {
      lock.unlock();
    }
  }
}
