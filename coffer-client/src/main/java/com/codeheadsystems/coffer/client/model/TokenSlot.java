package com.codeheadsystems.coffer.client.model;

/**
 * Position in the token rotation pool: index 0 is the main connection, index {@code i + 1} the
 * additional connection {@code i}.
 *
 * @param index the index
 */
public record TokenSlot(int index) {

  public static final TokenSlot MAIN = new TokenSlot(0);

  public static TokenSlot additional(final int i) {
    return new TokenSlot(i + 1);
  }

  public boolean isMain() {
    return index == 0;
  }

  @Override
  public String toString() {
    return isMain() ? "Main" : "Additional[" + (index - 1) + "]";
  }
}
