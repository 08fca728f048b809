package com.codeheadsystems.coffer.model.upload;

import com.codeheadsystems.coffer.model.error.ApiErrorResponse;
import com.codeheadsystems.coffer.model.node.Node;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of a finalized object storage upload.
 * <p>
 * Used by: {@code GET api/v4/nodes/files/uploads/{uploadId}}
 *
 * @param status       the state
 * @param node         the created node once {@code done}
 * @param errorDetails the failure once {@code error}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3FileUploadStatus(
    @JsonProperty("status") UploadState status,
    @JsonProperty("node") Node node,
    @JsonProperty("errorDetails") ApiErrorResponse errorDetails) implements UploadStatusResponse {
}
