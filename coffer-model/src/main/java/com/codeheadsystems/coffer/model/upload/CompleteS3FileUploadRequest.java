package com.codeheadsystems.coffer.model.upload;

import com.codeheadsystems.coffer.model.keys.FileKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Finalizes an object storage upload.
 * <p>
 * Used by: {@code PUT api/v4/nodes/files/uploads/{uploadId}/s3}
 *
 * @param parts              every uploaded part in order
 * @param resolutionStrategy name collision policy
 * @param fileName           optional final name
 * @param keepShareLinks     keep share links of an overwritten node
 * @param fileKey            the uploader's wrapped file key, encrypted targets only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompleteS3FileUploadRequest(
    @JsonProperty("parts") List<S3FileUploadPart> parts,
    @JsonProperty("resolutionStrategy") ResolutionStrategy resolutionStrategy,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("keepShareLinks") Boolean keepShareLinks,
    @JsonProperty("fileKey") FileKey fileKey) {
}
