package com.codeheadsystems.coffer.crypto;

import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Streaming AES-256-GCM decrypter, the counterpart of {@link FileEncrypter}.
 * <p>
 * Plaintext returned by {@link #update} is not authenticated until {@link #doFinal()} returns
 * without throwing. Callers must not release any of it before that.
 */
public final class FileDecrypter {

  private final GCMModeCipher cipher;
  private final byte[] tag;
  private boolean finished;

  private FileDecrypter(final PlainFileKey fileKey) {
    if (!fileKey.hasTag()) {
      throw new CryptoException("File key has no tag, content cannot be authenticated");
    }
    this.tag = fileKey.tag();
    this.cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    byte[] raw = fileKey.key().exposeBytes();
    try {
      cipher.init(false, new AEADParameters(new KeyParameter(raw), PlainFileKey.TAG_LENGTH * 8, fileKey.iv()));
    } finally {
      Arrays.fill(raw, (byte) 0);
    }
  }

  public static FileDecrypter create(final PlainFileKey fileKey) {
    return new FileDecrypter(fileKey);
  }

  /**
   * Decrypts a whole buffer.
   *
   * @param cipherText the cipher text
   * @param fileKey    the file key
   * @return the plaintext
   */
  public static byte[] decryptAll(final byte[] cipherText, final PlainFileKey fileKey) {
    FileDecrypter decrypter = create(fileKey);
    byte[] head = decrypter.update(cipherText, 0, cipherText.length);
    byte[] tail = decrypter.doFinal();
    byte[] plainText = new byte[head.length + tail.length];
    System.arraycopy(head, 0, plainText, 0, head.length);
    System.arraycopy(tail, 0, plainText, head.length, tail.length);
    return plainText;
  }

  /**
   * Decrypts the next slice of ciphertext.
   *
   * @param in     the input
   * @param offset the offset
   * @param length the length
   * @return the plaintext produced so far
   */
  public byte[] update(final byte[] in, final int offset, final int length) {
    if (finished) {
      throw new IllegalStateException("Decrypter already finished");
    }
    byte[] out = new byte[cipher.getUpdateOutputSize(length)];
    int written = cipher.processBytes(in, offset, length, out, 0);
    return written == out.length ? out : Arrays.copyOf(out, written);
  }

  /**
   * Verifies the tag and flushes the remaining plaintext.
   *
   * @return the last plaintext bytes
   * @throws CryptoException if the content or the tag was tampered with
   */
  public byte[] doFinal() {
    if (finished) {
      throw new IllegalStateException("Decrypter already finished");
    }
    finished = true;
    byte[] out = new byte[cipher.getOutputSize(tag.length)];
    try {
      int written = cipher.processBytes(tag, 0, tag.length, out, 0);
      written += cipher.doFinal(out, written);
      return Arrays.copyOf(out, written);
    } catch (InvalidCipherTextException e) {
      throw new CryptoException("Content authentication failed", e);
    }
  }
}
