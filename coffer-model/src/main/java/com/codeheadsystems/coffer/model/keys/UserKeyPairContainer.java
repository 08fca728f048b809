package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The stored key pair of the current user.
 * <p>
 * Used by: {@code GET api/v4/user/account/keypair}
 *
 * @param privateKeyContainer the encrypted private key
 * @param publicKeyContainer  the public key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserKeyPairContainer(
    @JsonProperty("privateKeyContainer") PrivateKeyContainer privateKeyContainer,
    @JsonProperty("publicKeyContainer") PublicKeyContainer publicKeyContainer) {
}
