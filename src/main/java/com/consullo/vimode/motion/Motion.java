package com.consullo.vimode.motion;

/**
 * Cursor motions the resolver can apply, standalone or as an operator span boundary.
 *
 * @since 1.0
 */
public enum Motion {
  LEFT(true),
  RIGHT(true),
  UP(true),
  DOWN(true),
  WORD_RIGHT(true),
  WORD_LEFT(true),
  WORD_END(true),
  LINE_START(false),
  LINE_END(false),
  FIRST_NON_BLANK(false),
  DOCUMENT_START(false),
  DOCUMENT_END(false);

  private final boolean repeatable;

  Motion(boolean repeatable) {
    this.repeatable = repeatable;
  }

  /**
   * Returns true if a count prefix repeats this motion. Absolute motions ignore the count.
   *
   * @return true if repeatable
   */
  public boolean repeatable() {
    return repeatable;
  }
}
