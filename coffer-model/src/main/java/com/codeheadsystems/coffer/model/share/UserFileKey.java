package com.codeheadsystems.coffer.model.share;

import com.codeheadsystems.coffer.model.keys.FileKey;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file key wrapped for one share recipient.
 *
 * @param userId  the user id
 * @param fileKey the wrapped key
 */
public record UserFileKey(
    @JsonProperty("userId") long userId,
    @JsonProperty("fileKey") FileKey fileKey) {
}
