package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user's public key.
 *
 * @param version   {@code A} (RSA-2048) or {@code RSA-4096}
 * @param publicKey the PEM encoded public key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicKeyContainer(
    @JsonProperty("version") String version,
    @JsonProperty("publicKey") String publicKey) {
}
