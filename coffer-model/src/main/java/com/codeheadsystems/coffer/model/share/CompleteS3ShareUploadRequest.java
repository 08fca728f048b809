package com.codeheadsystems.coffer.model.share;

import com.codeheadsystems.coffer.model.upload.S3FileUploadPart;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Finalizes an object storage upload on an upload share.
 *
 * @param parts           the uploaded parts
 * @param userFileKeyList wrapped keys for the share recipients, encrypted shares only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompleteS3ShareUploadRequest(
    @JsonProperty("parts") List<S3FileUploadPart> parts,
    @JsonProperty("userFileKeyList") UserFileKeyList userFileKeyList) {
}
