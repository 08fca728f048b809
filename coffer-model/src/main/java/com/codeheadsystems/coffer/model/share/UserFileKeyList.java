package com.codeheadsystems.coffer.model.share;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The user file key list.
 *
 * @param items the items
 */
public record UserFileKeyList(@JsonProperty("items") List<UserFileKey> items) {
}
