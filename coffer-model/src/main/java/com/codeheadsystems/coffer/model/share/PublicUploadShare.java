package com.codeheadsystems.coffer.model.share;

import com.codeheadsystems.coffer.model.keys.UserUserPublicKey;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * An upload share as seen by an anonymous uploader.
 * <p>
 * Used by: {@code GET api/v4/public/shares/uploads/{accessKey}}
 *
 * @param name                   the share name
 * @param isProtected            whether a password is required
 * @param isEncrypted            whether uploads must be encrypted
 * @param userUserPublicKeyList  the public keys of every user the file key is wrapped for
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicUploadShare(
    @JsonProperty("name") String name,
    @JsonProperty("isProtected") Boolean isProtected,
    @JsonProperty("isEncrypted") Boolean isEncrypted,
    @JsonProperty("userUserPublicKeyList") UserUserPublicKeyList userUserPublicKeyList) {

  public boolean encrypted() {
    return Boolean.TRUE.equals(isEncrypted);
  }

  public List<UserUserPublicKey> publicKeys() {
    return userUserPublicKeyList == null || userUserPublicKeyList.items() == null
        ? List.of() : userUserPublicKeyList.items();
  }

  /**
   * The public key list wrapper.
   *
   * @param items the items
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record UserUserPublicKeyList(@JsonProperty("items") List<UserUserPublicKey> items) {
  }
}
