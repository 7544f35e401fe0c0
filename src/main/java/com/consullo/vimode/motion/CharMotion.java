package com.consullo.vimode.motion;

/**
 * Commands that wait for a literal character: the in-line searches {@code f/t/F/T} and single-character
 * replace {@code r}.
 *
 * @since 1.0
 */
public enum CharMotion {
  /** {@code f}: forward, land on the match. */
  FIND_FORWARD('f'),
  /** {@code t}: forward, land one before the match. */
  TILL_FORWARD('t'),
  /** {@code F}: backward, land on the match. */
  FIND_BACKWARD('F'),
  /** {@code T}: backward, land one after the match. */
  TILL_BACKWARD('T'),
  /** {@code r}: replace the character under the cursor. */
  REPLACE('r');

  private final char trigger;

  CharMotion(char trigger) {
    this.trigger = trigger;
  }

  public char trigger() {
    return trigger;
  }

  public boolean isSearch() {
    return this != REPLACE;
  }

  /**
   * Returns the motion armed by {@code c}, or null if {@code c} arms none.
   *
   * @param c typed character
   * @return char motion or null
   */
  public static CharMotion forTrigger(char c) {
    for (CharMotion m : values()) {
      if (m.trigger == c) {
        return m;
      }
    }
    return null;
  }
}
