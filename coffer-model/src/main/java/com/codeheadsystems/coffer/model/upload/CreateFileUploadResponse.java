package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The opened upload channel.
 *
 * @param uploadId  the id used for presigned URLs, finalize and status calls
 * @param uploadUrl the proxy URL chunks are POSTed to
 * @param token     the token that scopes the proxy finalize call
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateFileUploadResponse(
    @JsonProperty("uploadId") String uploadId,
    @JsonProperty("uploadUrl") String uploadUrl,
    @JsonProperty("token") String token) {
}
