package com.codeheadsystems.coffer.crypto;

import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.keys.PublicKeyContainer;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.crypto.AsymmetricBlockCipher;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.encodings.OAEPEncoding;
import org.bouncycastle.crypto.engines.RSAEngine;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.crypto.util.PublicKeyFactory;
import org.bouncycastle.openssl.PEMParser;

/**
 * Wraps and unwraps content keys with RSA-OAEP.
 * <p>
 * Two key pair versions exist.  {@code A} is RSA-2048 with OAEP(SHA-256, MGF1-SHA-1) and produces
 * file keys of version {@code A}.  {@code RSA-4096} uses OAEP(SHA-256, MGF1-SHA-256) and produces
 * file keys of version {@code RSA-4096/AES-256-GCM}.
 */
public class FileKeyCrypto {

  public static final String KEYPAIR_VERSION_2048 = "A";
  public static final String KEYPAIR_VERSION_4096 = "RSA-4096";
  public static final String FILE_KEY_VERSION_2048 = "A";
  public static final String FILE_KEY_VERSION_4096 = "RSA-4096/AES-256-GCM";

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private FileKeyCrypto() {
  }

  /**
   * Wraps the content key for the owner of the given public key.
   *
   * @param plainFileKey the content key, including its tag
   * @param recipient    the recipient's public key
   * @return the file key
   */
  public static FileKey encryptFileKey(final PlainFileKey plainFileKey, final PublicKeyContainer recipient) {
    if (!plainFileKey.hasTag()) {
      throw new CryptoException("Cannot wrap a file key before encryption has finished");
    }
    String fileKeyVersion = fileKeyVersionFor(recipient.version());
    AsymmetricBlockCipher oaep = oaep(fileKeyVersion);
    oaep.init(true, new ParametersWithRandom(parsePublicKey(recipient.publicKey())));
    byte[] raw = plainFileKey.key().exposeBytes();
    try {
      byte[] wrapped = oaep.processBlock(raw, 0, raw.length);
      return new FileKey(B64.encodeToString(wrapped),
          B64.encodeToString(plainFileKey.iv()),
          fileKeyVersion,
          B64.encodeToString(plainFileKey.tag()));
    } catch (InvalidCipherTextException e) {
      throw new CryptoException("Failed to wrap file key", e);
    } finally {
      Arrays.fill(raw, (byte) 0);
    }
  }

  /**
   * Unwraps a file key with the caller's private key.
   *
   * @param fileKey the wrapped key
   * @param keyPair the unlocked key pair the key was wrapped for
   * @return the plain file key; the caller closes it
   */
  public static PlainFileKey decryptFileKey(final FileKey fileKey, final UnlockedKeyPair keyPair) {
    if (keyPair.isClosed()) {
      throw new CryptoException("Key pair has been closed");
    }
    AsymmetricBlockCipher oaep = oaep(fileKey.version());
    oaep.init(false, keyPair.privateKey());
    byte[] raw = null;
    try {
      byte[] wrapped = decode(fileKey.key(), "key");
      raw = oaep.processBlock(wrapped, 0, wrapped.length);
      return new PlainFileKey(SecretValue.of(raw), decode(fileKey.iv(), "iv"),
          fileKey.tag() == null ? null : decode(fileKey.tag(), "tag"), PlainFileKey.VERSION);
    } catch (InvalidCipherTextException e) {
      throw new CryptoException("Failed to unwrap file key, it was not wrapped for this key pair", e);
    } finally {
      if (raw != null) {
        Arrays.fill(raw, (byte) 0);
      }
    }
  }

  static String fileKeyVersionFor(final String keyPairVersion) {
    if (KEYPAIR_VERSION_2048.equals(keyPairVersion)) {
      return FILE_KEY_VERSION_2048;
    }
    if (KEYPAIR_VERSION_4096.equals(keyPairVersion)) {
      return FILE_KEY_VERSION_4096;
    }
    throw new CryptoException("Unsupported key pair version: " + keyPairVersion);
  }

  static AsymmetricKeyParameter parsePublicKey(final String pem) {
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object object = parser.readObject();
      if (!(object instanceof SubjectPublicKeyInfo info)) {
        throw new CryptoException("Not a PEM encoded public key");
      }
      return PublicKeyFactory.createKey(info);
    } catch (IOException e) {
      throw new CryptoException("Unable to read public key", e);
    }
  }

  private static AsymmetricBlockCipher oaep(final String fileKeyVersion) {
    Digest mgfDigest;
    if (FILE_KEY_VERSION_2048.equals(fileKeyVersion)) {
      mgfDigest = new SHA1Digest();
    } else if (FILE_KEY_VERSION_4096.equals(fileKeyVersion)) {
      mgfDigest = new SHA256Digest();
    } else {
      throw new CryptoException("Unsupported file key version: " + fileKeyVersion);
    }
    return new OAEPEncoding(new RSAEngine(), new SHA256Digest(), mgfDigest, null);
  }

  private static byte[] decode(final String value, final String fieldName) {
    if (value == null || value.isBlank()) {
      throw new CryptoException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new CryptoException("Invalid base64 in field: " + fieldName, e);
    }
  }
}
