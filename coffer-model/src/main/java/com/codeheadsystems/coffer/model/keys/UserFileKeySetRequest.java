package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A wrapped key for one user and one file.
 *
 * @param userId  the user id
 * @param fileId  the file id
 * @param fileKey the key wrapped for that user
 */
public record UserFileKeySetRequest(
    @JsonProperty("userId") long userId,
    @JsonProperty("fileId") long fileId,
    @JsonProperty("fileKey") FileKey fileKey) {
}
