package com.codeheadsystems.coffer.crypto;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * An unwrapped AES-256-GCM content key together with the nonce and, once encryption has
 * finished, the authentication tag of the file it protects.
 */
public final class PlainFileKey implements AutoCloseable {

  public static final String VERSION = "A";
  static final int KEY_LENGTH = 32;
  static final int IV_LENGTH = 12;
  static final int TAG_LENGTH = 16;

  private static final SecureRandom RANDOM = new SecureRandom();

  private final SecretValue key;
  private final byte[] iv;
  private final byte[] tag;
  private final String version;

  /**
   * Instantiates a new Plain file key.
   *
   * @param key     the raw AES key
   * @param iv      the GCM nonce
   * @param tag     the GCM tag, null until the content is encrypted
   * @param version the content cipher version
   */
  public PlainFileKey(final SecretValue key, final byte[] iv, final byte[] tag, final String version) {
    if (key.length() != KEY_LENGTH) {
      throw new CryptoException("Content key must be " + KEY_LENGTH + " bytes, got " + key.length());
    }
    if (iv == null || iv.length != IV_LENGTH) {
      throw new CryptoException("IV must be " + IV_LENGTH + " bytes");
    }
    if (tag != null && tag.length != TAG_LENGTH) {
      throw new CryptoException("Tag must be " + TAG_LENGTH + " bytes");
    }
    this.key = key;
    this.iv = iv.clone();
    this.tag = tag == null ? null : tag.clone();
    this.version = version;
  }

  /**
   * Generates a fresh random key and nonce.
   *
   * @return the plain file key, without tag
   */
  public static PlainFileKey generate() {
    byte[] raw = new byte[KEY_LENGTH];
    byte[] iv = new byte[IV_LENGTH];
    RANDOM.nextBytes(raw);
    RANDOM.nextBytes(iv);
    try {
      return new PlainFileKey(SecretValue.of(raw), iv, null, VERSION);
    } finally {
      Arrays.fill(raw, (byte) 0);
    }
  }

  PlainFileKey withTag(final byte[] newTag) {
    return new PlainFileKey(SecretValue.of(key.exposeBytes()), iv, newTag, version);
  }

  SecretValue key() {
    return key;
  }

  public byte[] iv() {
    return iv.clone();
  }

  public byte[] tag() {
    return tag == null ? null : tag.clone();
  }

  public boolean hasTag() {
    return tag != null;
  }

  public String version() {
    return version;
  }

  @Override
  public void close() {
    key.close();
  }

  @Override
  public String toString() {
    return "PlainFileKey[version=" + version + ", key=" + key + "]";
  }
}
