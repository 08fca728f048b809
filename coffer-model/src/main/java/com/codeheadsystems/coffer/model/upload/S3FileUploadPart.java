package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An uploaded part and the entity tag the object storage returned for it.
 *
 * @param partNumber the part number
 * @param partEtag   the entity tag without surrounding quotes
 */
public record S3FileUploadPart(
    @JsonProperty("partNumber") int partNumber,
    @JsonProperty("partEtag") String partEtag) {
}
