package com.codeheadsystems.coffer.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class SecretValueTest {

  @Test
  void toString_neverRevealsValue() {
    SecretValue secret = SecretValue.of("hunter2");

    assertThat(secret.toString()).doesNotContain("hunter2");
    assertThat(String.valueOf(secret)).isEqualTo("SecretValue[***]");
  }

  @Test
  void close_zeroesAndBlocksAccess() {
    byte[] source = {1, 2, 3};
    SecretValue secret = SecretValue.of(source);

    secret.close();

    assertThat(secret.isDestroyed()).isTrue();
    assertThat(source).containsExactly(1, 2, 3);
    assertThatThrownBy(secret::expose).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(secret::exposeBytes).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void nullString_isEmpty() {
    assertThat(SecretValue.of((String) null).isEmpty()).isTrue();
    assertThat(SecretValue.empty().expose()).isEmpty();
  }

  @Test
  void jackson_skipsSecretFields() throws Exception {
    String json = new ObjectMapper().writeValueAsString(new Holder("visible", SecretValue.of("hidden")));

    assertThat(json).contains("visible").doesNotContain("hidden");
  }

  record Holder(String name, SecretValue secret) {
  }
}
