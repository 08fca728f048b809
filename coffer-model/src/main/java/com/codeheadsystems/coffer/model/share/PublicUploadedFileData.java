package com.codeheadsystems.coffer.model.share;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a proxy share upload reports after finalize.
 *
 * @param name the stored name
 * @param size the stored size
 * @param hash the content hash, if computed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicUploadedFileData(
    @JsonProperty("name") String name,
    @JsonProperty("size") Long size,
    @JsonProperty("hash") String hash) {
}
