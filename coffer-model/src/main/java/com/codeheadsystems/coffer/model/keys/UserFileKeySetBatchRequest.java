package com.codeheadsystems.coffer.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Sets many wrapped keys at once.
 * <p>
 * Used by: {@code POST api/v4/nodes/files/keys}
 *
 * @param items the keys
 */
public record UserFileKeySetBatchRequest(@JsonProperty("items") List<UserFileKeySetRequest> items) {
}
