package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A presigned part URL.
 *
 * @param url        the URL
 * @param partNumber the part number it accepts
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresignedUrl(
    @JsonProperty("url") String url,
    @JsonProperty("partNumber") int partNumber) {
}
