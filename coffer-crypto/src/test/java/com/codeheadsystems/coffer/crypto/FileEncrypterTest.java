package com.codeheadsystems.coffer.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.security.SecureRandom;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

class FileEncrypterTest {

  private static final int CHUNK = 1024;
  private static final SecureRandom RANDOM = new SecureRandom();

  static Stream<Integer> lengths() {
    return Stream.of(0, 1, CHUNK - 1, CHUNK, CHUNK + 1);
  }

  @ParameterizedTest
  @MethodSource("lengths")
  void encryptAll_thenDecryptAll_restoresPlaintext(final int length) {
    byte[] plain = randomBytes(length);

    FileEncrypter.EncryptedContent encrypted = FileEncrypter.encryptAll(plain);

    assertThat(encrypted.cipherText()).hasSize(length);
    assertThat(encrypted.fileKey().tag()).hasSize(16);
    assertThat(FileDecrypter.decryptAll(encrypted.cipherText(), encrypted.fileKey())).isEqualTo(plain);
  }

  @ParameterizedTest
  @MethodSource("lengths")
  void chunkedStreaming_matchesOnePass(final int length) {
    byte[] plain = randomBytes(length);
    FileEncrypter encrypter = FileEncrypter.create();
    ByteArrayOutputStream cipher = new ByteArrayOutputStream();
    for (int offset = 0; offset < length; offset += 100) {
      cipher.writeBytes(encrypter.update(plain, offset, Math.min(100, length - offset)));
    }
    cipher.writeBytes(encrypter.doFinal());
    byte[] cipherText = cipher.toByteArray();

    FileDecrypter decrypter = FileDecrypter.create(encrypter.fileKey());
    ByteArrayOutputStream restored = new ByteArrayOutputStream();
    for (int offset = 0; offset < length; offset += 333) {
      restored.writeBytes(decrypter.update(cipherText, offset, Math.min(333, length - offset)));
    }
    restored.writeBytes(decrypter.doFinal());

    assertThat(cipherText).hasSize(length);
    assertThat(restored.toByteArray()).isEqualTo(plain);
  }

  @Test
  void decrypt_tamperedContent_throwsCryptoException() {
    byte[] plain = randomBytes(64);
    FileEncrypter.EncryptedContent encrypted = FileEncrypter.encryptAll(plain);
    byte[] tampered = encrypted.cipherText().clone();
    tampered[10] ^= 0x01;

    assertThatThrownBy(() -> FileDecrypter.decryptAll(tampered, encrypted.fileKey()))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("authentication");
  }

  @Test
  void fileKey_beforeDoFinal_throws() {
    FileEncrypter encrypter = FileEncrypter.create();
    encrypter.update(new byte[] {1, 2, 3}, 0, 3);

    assertThatThrownBy(encrypter::fileKey).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void decrypter_requiresTag() {
    try (PlainFileKey key = PlainFileKey.generate()) {
      assertThatThrownBy(() -> FileDecrypter.create(key))
          .isInstanceOf(CryptoException.class)
          .hasMessageContaining("tag");
    }
  }

  @Test
  void freshKeys_areUnique() {
    assertThat(IntStream.range(0, 5)
        .mapToObj(i -> FileEncrypter.encryptAll(new byte[0]).fileKey().iv())
        .map(java.util.Arrays::toString)
        .distinct()
        .count()).isEqualTo(5);
  }

  private static byte[] randomBytes(final int length) {
    byte[] bytes = new byte[length];
    RANDOM.nextBytes(bytes);
    return bytes;
  }
}
