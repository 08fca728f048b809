package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Expiration policy of an uploaded node.
 *
 * @param enableExpiration whether the node expires
 * @param expireAt         ISO-8601 expiry timestamp
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectExpiration(
    @JsonProperty("enableExpiration") boolean enableExpiration,
    @JsonProperty("expireAt") String expireAt) {

  public static ObjectExpiration never() {
    return new ObjectExpiration(false, null);
  }
}
