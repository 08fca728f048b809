package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user's private key as stored by the server: a passphrase encrypted PKCS#8 PEM document.
 *
 * @param version    {@code A} (RSA-2048) or {@code RSA-4096}
 * @param privateKey the encrypted PEM
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrivateKeyContainer(
    @JsonProperty("version") String version,
    @JsonProperty("privateKey") String privateKey) {

  @Override
  public String toString() {
    return "PrivateKeyContainer[version=" + version + "]";
  }
}
