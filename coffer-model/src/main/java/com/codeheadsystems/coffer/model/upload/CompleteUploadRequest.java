package com.codeheadsystems.coffer.model.upload;

import com.codeheadsystems.coffer.model.keys.FileKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Finalizes a proxy upload.
 * <p>
 * Used by: {@code PUT api/v4/uploads/{token}}
 *
 * @param resolutionStrategy name collision policy
 * @param fileName           optional final name
 * @param keepShareLinks     keep share links of an overwritten node
 * @param fileKey            the uploader's wrapped file key, encrypted targets only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompleteUploadRequest(
    @JsonProperty("resolutionStrategy") ResolutionStrategy resolutionStrategy,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("keepShareLinks") Boolean keepShareLinks,
    @JsonProperty("fileKey") FileKey fileKey) {
}
