package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The presigned URL list.
 *
 * @param urls the urls
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresignedUrlList(@JsonProperty("urls") List<PresignedUrl> urls) {
}
