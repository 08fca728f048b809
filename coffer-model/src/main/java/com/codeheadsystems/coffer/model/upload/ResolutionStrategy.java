package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the server does when a node with the same name already exists in the target.
 */
public enum ResolutionStrategy {
  AUTO_RENAME("autorename"),
  OVERWRITE("overwrite"),
  FAIL("fail");

  private final String value;

  ResolutionStrategy(final String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
