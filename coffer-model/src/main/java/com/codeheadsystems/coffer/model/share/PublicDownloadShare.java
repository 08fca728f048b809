package com.codeheadsystems.coffer.model.share;

import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.keys.PrivateKeyContainer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A download share as seen by an anonymous recipient.
 * <p>
 * Encrypted shares carry their own key pair: the private key is encrypted with the share password
 * and {@code fileKey} is the file's content key wrapped for that pair.
 * <p>
 * Used by: {@code GET api/v4/public/shares/downloads/{accessKey}}
 *
 * @param name                the share name
 * @param fileName            the shared file's name
 * @param size                the file size in bytes
 * @param isProtected         whether a password is required
 * @param isEncrypted         whether the content is encrypted
 * @param limitReached        whether the download limit is exhausted
 * @param privateKeyContainer the share key pair's private key, encrypted shares only
 * @param fileKey             the wrapped content key, encrypted shares only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicDownloadShare(
    @JsonProperty("name") String name,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("size") Long size,
    @JsonProperty("isProtected") Boolean isProtected,
    @JsonProperty("isEncrypted") Boolean isEncrypted,
    @JsonProperty("limitReached") Boolean limitReached,
    @JsonProperty("privateKeyContainer") PrivateKeyContainer privateKeyContainer,
    @JsonProperty("fileKey") FileKey fileKey) {

  public boolean passwordProtected() {
    return Boolean.TRUE.equals(isProtected);
  }

  public boolean encrypted() {
    return Boolean.TRUE.equals(isEncrypted);
  }
}
