package com.codeheadsystems.coffer.model.share;

import com.codeheadsystems.coffer.model.error.ApiErrorResponse;
import com.codeheadsystems.coffer.model.upload.UploadState;
import com.codeheadsystems.coffer.model.upload.UploadStatusResponse;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of a finalized share upload.
 *
 * @param status       the state
 * @param fileName     the stored file name once {@code done}
 * @param size         the stored size
 * @param errorDetails the failure once {@code error}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record S3ShareUploadStatus(
    @JsonProperty("status") UploadState status,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("size") Long size,
    @JsonProperty("errorDetails") ApiErrorResponse errorDetails) implements UploadStatusResponse {
}
