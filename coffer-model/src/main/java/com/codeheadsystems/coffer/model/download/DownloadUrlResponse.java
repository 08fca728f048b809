package com.codeheadsystems.coffer.model.download;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A short lived URL the file content can be fetched from without authentication.
 * <p>
 * Used by: {@code POST api/v4/nodes/files/{id}/downloads}, {@code POST api/v4/public/shares/downloads/{accessKey}}
 *
 * @param downloadUrl the url
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DownloadUrlResponse(@JsonProperty("downloadUrl") String downloadUrl) {
}
