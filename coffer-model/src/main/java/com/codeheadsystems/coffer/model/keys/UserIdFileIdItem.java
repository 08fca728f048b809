package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user that can read a file but has no wrapped key for it yet.
 *
 * @param userId the user id
 * @param fileId the file id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserIdFileIdItem(
    @JsonProperty("userId") long userId,
    @JsonProperty("fileId") long fileId) {
}
