package com.codeheadsystems.coffer.crypto;

import com.codeheadsystems.coffer.model.keys.PublicKeyContainer;
import java.io.IOException;
import java.util.Arrays;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.util.PrivateKeyFactory;

/**
 * A user's key pair with the private key already decrypted.
 * <p>
 * The private key is held in its encoded PKCS#8 form inside a {@link SecretValue} and decoded on
 * every use, so {@link #close()} really erases it.
 */
public final class UnlockedKeyPair implements AutoCloseable {

  private final SecretValue privateKeyInfo;
  private final PublicKeyContainer publicKeyContainer;
  private final String version;

  /**
   * Instantiates a new Unlocked key pair.
   *
   * @param privateKeyInfo     DER encoded PKCS#8 private key
   * @param publicKeyContainer the public key
   * @param version            the key pair version
   */
  public UnlockedKeyPair(final SecretValue privateKeyInfo,
                         final PublicKeyContainer publicKeyContainer,
                         final String version) {
    this.privateKeyInfo = privateKeyInfo;
    this.publicKeyContainer = publicKeyContainer;
    this.version = version;
  }

  public PublicKeyContainer publicKeyContainer() {
    return publicKeyContainer;
  }

  public String version() {
    return version;
  }

  AsymmetricKeyParameter privateKey() {
    byte[] encoded = privateKeyInfo.exposeBytes();
    try {
      return PrivateKeyFactory.createKey(encoded);
    } catch (IOException e) {
      throw new CryptoException("Unable to decode private key", e);
    } finally {
      Arrays.fill(encoded, (byte) 0);
    }
  }

  public boolean isClosed() {
    return privateKeyInfo.isDestroyed();
  }

  @Override
  public void close() {
    privateKeyInfo.close();
  }

  @Override
  public String toString() {
    return "UnlockedKeyPair[version=" + version + "]";
  }
}
