package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * One page of missing file keys.
 * <p>
 * {@code items} pairs users with files.  {@code users} carries the public key of every user that
 * appears in {@code items}, {@code files} the caller's own wrapped key of every file.
 * <p>
 * Used by: {@code GET api/v4/nodes/missingFileKeys}
 *
 * @param range the page range
 * @param items the user/file pairs
 * @param users the public keys by user
 * @param files the caller's wrapped keys by file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MissingKeysResponse(
    @JsonProperty("range") Range range,
    @JsonProperty("items") List<UserIdFileIdItem> items,
    @JsonProperty("users") List<UserUserPublicKey> users,
    @JsonProperty("files") List<FileFileKeys> files) {

  public Optional<PublicKeyContainer> publicKeyFor(final long userId) {
    return users == null ? Optional.empty() : users.stream()
        .filter(u -> u.id() == userId)
        .map(UserUserPublicKey::publicKeyContainer)
        .findFirst();
  }

  public Optional<FileKey> fileKeyFor(final long fileId) {
    return files == null ? Optional.empty() : files.stream()
        .filter(f -> f.id() == fileId)
        .map(FileFileKeys::fileKeyContainer)
        .findFirst();
  }

  public boolean isEmpty() {
    return items == null || items.isEmpty();
  }

  /**
   * Paging information.
   *
   * @param offset the offset
   * @param limit  the limit
   * @param total  the total number of items
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Range(
      @JsonProperty("offset") long offset,
      @JsonProperty("limit") long limit,
      @JsonProperty("total") long total) {
  }
}
