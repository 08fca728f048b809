package com.codeheadsystems.coffer.crypto;

import com.fasterxml.jackson.annotation.JsonIgnoreType;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Holder for secret material: tokens, passphrases, content keys and decoded private keys.
 * <p>
 * The value is kept as a private byte array that is overwritten with zeros by {@link #close()}.
 * {@link #toString()} never reveals the value and Jackson will not serialize it.  Read the value
 * only through {@link #expose()} or {@link #exposeBytes()} and keep the result in scope as short
 * as possible.
 */
@JsonIgnoreType
public final class SecretValue implements AutoCloseable {

  private static final byte[] NONE = new byte[0];

  private final byte[] value;
  private volatile boolean destroyed;

  private SecretValue(final byte[] value) {
    this.value = value;
  }

  /**
   * Wraps the UTF-8 bytes of a string. A null string becomes an empty secret.
   *
   * @param value the value
   * @return the secret value
   */
  public static SecretValue of(final String value) {
    return new SecretValue(value == null ? NONE.clone() : value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Wraps a copy of the given bytes. The caller remains responsible for its own array.
   *
   * @param value the value
   * @return the secret value
   */
  public static SecretValue of(final byte[] value) {
    return new SecretValue(value == null ? NONE.clone() : value.clone());
  }

  public static SecretValue empty() {
    return new SecretValue(NONE.clone());
  }

  /**
   * Returns the value as a string.
   *
   * @return the value
   * @throws IllegalStateException once the secret was closed
   */
  public String expose() {
    checkNotDestroyed();
    return new String(value, StandardCharsets.UTF_8);
  }

  /**
   * Returns the value as chars, for APIs that accept a char[] password.
   *
   * @return a fresh copy the caller should clear
   */
  public char[] exposeChars() {
    return expose().toCharArray();
  }

  /**
   * Returns a copy of the raw value.
   *
   * @return a fresh copy the caller should clear
   */
  public byte[] exposeBytes() {
    checkNotDestroyed();
    return value.clone();
  }

  public boolean isEmpty() {
    return value.length == 0;
  }

  public int length() {
    return value.length;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public void close() {
    Arrays.fill(value, (byte) 0);
    destroyed = true;
  }

  private void checkNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Secret value has been destroyed");
    }
  }

  @Override
  public String toString() {
    return "SecretValue[***]";
  }
}
