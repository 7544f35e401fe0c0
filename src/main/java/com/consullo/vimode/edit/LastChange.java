package com.consullo.vimode.edit;

import com.consullo.vimode.motion.Motion;
import java.util.Objects;

/**
 * Replayable shape of the most recent mutating command.
 *
 * <p>Only the parameters needed to re-run the command are kept. Motions are stored by kind and resolved
 * again from wherever the cursor is at replay time.
 */
public final class LastChange {

  public enum Kind {
    /** {@code x} */
    DELETE_CHAR,
    /** {@code X} */
    DELETE_CHAR_BEFORE,
    /** {@code D} */
    DELETE_TO_LINE_END,
    /** {@code C} */
    CHANGE_TO_LINE_END,
    /** {@code s} */
    SUBSTITUTE_CHAR,
    /** {@code S} */
    SUBSTITUTE_LINE,
    /** {@code dd} */
    DELETE_LINE,
    /** {@code cc} */
    CHANGE_LINE,
    /** {@code d} + motion */
    DELETE_MOTION,
    /** {@code c} + motion */
    CHANGE_MOTION,
    /** {@code r} + character */
    REPLACE_CHAR,
    /** {@code J} */
    JOIN_LINES
  }

  private final Kind kind;
  private final Motion motion;
  private final char replacement;

  private LastChange(Kind kind, Motion motion, char replacement) {
    this.kind = kind;
    this.motion = motion;
    this.replacement = replacement;
  }

  /**
   * Creates a change that needs no parameters.
   *
   * @param kind change kind
   * @return change
   */
  public static LastChange of(Kind kind) {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null.");
    }
    if (kind == Kind.DELETE_MOTION || kind == Kind.CHANGE_MOTION || kind == Kind.REPLACE_CHAR) {
      throw new IllegalArgumentException(kind + " needs a parameter.");
    }
    return new LastChange(kind, null, '\0');
  }

  /**
   * Creates an operator+motion change.
   *
   * @param operator delete or change
   * @param motion motion defining the span
   * @return change
   */
  public static LastChange operatorMotion(Operator operator, Motion motion) {
    if (operator == null || motion == null) {
      throw new IllegalArgumentException("operator/motion must not be null.");
    }
    if (!operator.mutates()) {
      throw new IllegalArgumentException("Yank is not a change.");
    }
    Kind kind = operator == Operator.DELETE ? Kind.DELETE_MOTION : Kind.CHANGE_MOTION;
    return new LastChange(kind, motion, '\0');
  }

  /**
   * Creates a single-character replace change.
   *
   * @param replacement replacement character
   * @return change
   */
  public static LastChange replace(char replacement) {
    return new LastChange(Kind.REPLACE_CHAR, null, replacement);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the motion of an operator+motion change.
   *
   * @return motion, null for other kinds
   */
  public Motion motion() {
    return motion;
  }

  public char replacement() {
    return replacement;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LastChange)) {
      return false;
    }
    LastChange other = (LastChange) o;
    return kind == other.kind && motion == other.motion && replacement == other.replacement;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, motion, replacement);
  }

  @Override
  public String toString() {
    if (motion != null) {
      return kind + "(" + motion + ")";
    }
    if (kind == Kind.REPLACE_CHAR) {
      return kind + "(" + replacement + ")";
    }
    return kind.toString();
  }
}
