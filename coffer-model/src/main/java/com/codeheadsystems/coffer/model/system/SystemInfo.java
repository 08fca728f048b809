package com.codeheadsystems.coffer.model.system;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Public system information.
 * <p>
 * Used by: {@code GET api/v4/public/system/info}
 *
 * @param languageDefault      default language
 * @param s3Hosts              object storage hosts
 * @param s3EnforceDirectUpload whether direct uploads are enforced
 * @param useS3Storage         whether content lives in object storage
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemInfo(
    @JsonProperty("languageDefault") String languageDefault,
    @JsonProperty("s3Hosts") List<String> s3Hosts,
    @JsonProperty("s3EnforceDirectUpload") boolean s3EnforceDirectUpload,
    @JsonProperty("useS3Storage") boolean useS3Storage) {
}
