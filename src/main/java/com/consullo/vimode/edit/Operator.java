package com.consullo.vimode.edit;

/**
 * Operators that act on a span determined by a following motion, by doubling, or by a visual selection.
 *
 * @since 1.0
 */
public enum Operator {
  DELETE('d'),
  CHANGE('c'),
  YANK('y');

  private final char trigger;

  Operator(char trigger) {
    this.trigger = trigger;
  }

  public char trigger() {
    return trigger;
  }

  /**
   * Returns true if the operator removes text from the buffer.
   *
   * @return true for delete and change
   */
  public boolean mutates() {
    return this != YANK;
  }

  /**
   * Returns the operator typed as {@code c}, or null.
   *
   * @param c typed character
   * @return operator or null
   */
  public static Operator forTrigger(char c) {
    for (Operator op : values()) {
      if (op.trigger == c) {
        return op;
      }
    }
    return null;
  }
}
