package com.codeheadsystems.coffer.model.share;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opens an upload channel on an upload share.
 *
 * @param name                  the file name
 * @param size                  the size in bytes
 * @param password              the share password, protected shares only
 * @param directS3Upload        true to receive presigned part URLs
 * @param timestampCreation     optional ISO-8601 creation time
 * @param timestampModification optional ISO-8601 modification time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateShareUploadChannelRequest(
    @JsonProperty("name") String name,
    @JsonProperty("size") Long size,
    @JsonProperty("password") String password,
    @JsonProperty("directS3Upload") Boolean directS3Upload,
    @JsonProperty("timestampCreation") String timestampCreation,
    @JsonProperty("timestampModification") String timestampModification) {

  @Override
  public String toString() {
    return "CreateShareUploadChannelRequest[name=" + name + ", size=" + size + "]";
  }
}
