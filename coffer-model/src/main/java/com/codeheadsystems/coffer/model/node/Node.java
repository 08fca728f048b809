package com.codeheadsystems.coffer.model.node;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file or folder node, reduced to the fields the transfer engine reads.
 *
 * @param id          the node id
 * @param type        {@code room}, {@code folder} or {@code file}
 * @param name        the node name
 * @param parentId    the parent node id
 * @param size        the size in bytes, null when unknown
 * @param isEncrypted whether the content is end-to-end encrypted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Node(
    @JsonProperty("id") long id,
    @JsonProperty("type") String type,
    @JsonProperty("name") String name,
    @JsonProperty("parentId") Long parentId,
    @JsonProperty("size") Long size,
    @JsonProperty("isEncrypted") Boolean isEncrypted) {

  public boolean encrypted() {
    return Boolean.TRUE.equals(isEncrypted);
  }
}
