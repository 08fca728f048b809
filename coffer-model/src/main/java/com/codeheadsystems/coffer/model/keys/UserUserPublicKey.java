package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user id with its public key.
 *
 * @param id                 the user id
 * @param publicKeyContainer the public key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserUserPublicKey(
    @JsonProperty("id") long id,
    @JsonProperty("publicKeyContainer") PublicKeyContainer publicKeyContainer) {
}
