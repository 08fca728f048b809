package com.codeheadsystems.coffer.crypto;

import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Streaming AES-256-GCM encrypter for file content.
 * <p>
 * The ciphertext has exactly the plaintext length: the 16-byte GCM tag is not appended to the
 * content but stored in the {@link PlainFileKey} returned by {@link #doFinal()}, and later travels
 * inside every wrapped file key.
 */
public final class FileEncrypter {

  private final GCMModeCipher cipher;
  private final PlainFileKey fileKey;
  private PlainFileKey finishedKey;

  private FileEncrypter(final PlainFileKey fileKey) {
    this.fileKey = fileKey;
    this.cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    byte[] raw = fileKey.key().exposeBytes();
    try {
      cipher.init(true, new AEADParameters(new KeyParameter(raw), PlainFileKey.TAG_LENGTH * 8, fileKey.iv()));
    } finally {
      Arrays.fill(raw, (byte) 0);
    }
  }

  /**
   * Creates an encrypter with a freshly generated content key.
   *
   * @return the file encrypter
   */
  public static FileEncrypter create() {
    return new FileEncrypter(PlainFileKey.generate());
  }

  /**
   * Encrypts the whole buffer in one pass.
   *
   * @param plainText the plaintext
   * @return the ciphertext and the tagged content key
   */
  public static EncryptedContent encryptAll(final byte[] plainText) {
    FileEncrypter encrypter = create();
    byte[] head = encrypter.update(plainText, 0, plainText.length);
    byte[] tail = encrypter.doFinal();
    byte[] cipherText = new byte[head.length + tail.length];
    System.arraycopy(head, 0, cipherText, 0, head.length);
    System.arraycopy(tail, 0, cipherText, head.length, tail.length);
    return new EncryptedContent(cipherText, encrypter.fileKey());
  }

  /**
   * Encrypts the next slice of plaintext.
   *
   * @param in     the input
   * @param offset the offset
   * @param length the length
   * @return the ciphertext produced so far, possibly shorter than the input
   */
  public byte[] update(final byte[] in, final int offset, final int length) {
    if (finishedKey != null) {
      throw new IllegalStateException("Encrypter already finished");
    }
    byte[] out = new byte[cipher.getUpdateOutputSize(length)];
    int written = cipher.processBytes(in, offset, length, out, 0);
    return written == out.length ? out : Arrays.copyOf(out, written);
  }

  /**
   * Flushes the remaining ciphertext and captures the tag.
   *
   * @return the last ciphertext bytes, without the tag
   */
  public byte[] doFinal() {
    if (finishedKey != null) {
      throw new IllegalStateException("Encrypter already finished");
    }
    byte[] out = new byte[cipher.getOutputSize(0)];
    try {
      int written = cipher.doFinal(out, 0);
      finishedKey = fileKey.withTag(cipher.getMac());
      fileKey.close();
      return Arrays.copyOf(out, written - PlainFileKey.TAG_LENGTH);
    } catch (InvalidCipherTextException e) {
      throw new CryptoException("Failed to finish encryption", e);
    }
  }

  /**
   * The content key including the tag. Only available after {@link #doFinal()}.
   *
   * @return the plain file key
   */
  public PlainFileKey fileKey() {
    if (finishedKey == null) {
      throw new IllegalStateException("Encrypter not finished, tag is not known yet");
    }
    return finishedKey;
  }

  /**
   * Ciphertext with the key that decrypts it.
   *
   * @param cipherText the cipher text
   * @param fileKey    the file key
   */
  public record EncryptedContent(byte[] cipherText, PlainFileKey fileKey) {
  }
}
