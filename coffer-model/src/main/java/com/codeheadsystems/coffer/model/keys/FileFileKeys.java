package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file id with the caller's own wrapped key for it.
 *
 * @param id               the file id
 * @param fileKeyContainer the wrapped key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileFileKeys(
    @JsonProperty("id") long id,
    @JsonProperty("fileKeyContainer") FileKey fileKeyContainer) {
}
