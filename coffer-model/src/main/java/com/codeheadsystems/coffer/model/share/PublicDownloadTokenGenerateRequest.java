package com.codeheadsystems.coffer.model.share;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks for a download URL of a protected download share.
 * <p>
 * Used by: {@code POST api/v4/public/shares/downloads/{accessKey}}
 *
 * @param password the share password
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicDownloadTokenGenerateRequest(@JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "PublicDownloadTokenGenerateRequest[password=***]";
  }
}
