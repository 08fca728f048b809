package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file's content key wrapped under one recipient's public key.
 * <p>
 * {@code key} is the base64 RSA-OAEP ciphertext of the AES-256 key.  {@code iv} and {@code tag}
 * are the base64 GCM nonce and authentication tag of the file content and are the same for every
 * recipient of the file.
 *
 * @param key     base64 wrapped content key
 * @param iv      base64 GCM nonce
 * @param version wrapping algorithm, e.g. {@code A} or {@code RSA-4096/AES-256-GCM}
 * @param tag     base64 GCM tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileKey(
    @JsonProperty("key") String key,
    @JsonProperty("iv") String iv,
    @JsonProperty("version") String version,
    @JsonProperty("tag") String tag) {
}
