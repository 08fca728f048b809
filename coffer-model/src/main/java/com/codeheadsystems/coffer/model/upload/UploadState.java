package com.codeheadsystems.coffer.model.upload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Server side state of an object storage upload after finalize. DONE and ERROR are terminal.
 */
public enum UploadState {
  TRANSFER("transfer"),
  FINISHING("finishing"),
  DONE("done"),
  ERROR("error");

  private final String value;

  UploadState(final String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses the wire value.
   *
   * @param value the value
   * @return the upload state
   */
  @JsonCreator
  public static UploadState fromValue(final String value) {
    for (UploadState state : values()) {
      if (state.value.equalsIgnoreCase(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown upload state: " + value);
  }

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }
}
