package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opens an upload channel below {@code parentId}.
 * <p>
 * Used by: {@code POST api/v4/nodes/files/uploads}
 *
 * @param parentId              the target parent node
 * @param name                  the file name
 * @param size                  the declared size in bytes
 * @param classification        classification level 1..4
 * @param expiration            optional expiration
 * @param directS3Upload        true to receive presigned part URLs instead of a proxy URL
 * @param timestampCreation     optional ISO-8601 creation time
 * @param timestampModification optional ISO-8601 modification time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateFileUploadRequest(
    @JsonProperty("parentId") long parentId,
    @JsonProperty("name") String name,
    @JsonProperty("size") Long size,
    @JsonProperty("classification") Integer classification,
    @JsonProperty("expiration") ObjectExpiration expiration,
    @JsonProperty("directS3Upload") Boolean directS3Upload,
    @JsonProperty("timestampCreation") String timestampCreation,
    @JsonProperty("timestampModification") String timestampModification) {
}
