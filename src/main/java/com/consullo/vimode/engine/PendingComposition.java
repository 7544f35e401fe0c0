package com.consullo.vimode.engine;

import com.consullo.vimode.edit.Operator;
import com.consullo.vimode.motion.CharMotion;

/**
 * In-progress command composition: pending operator, count digits, awaited character motion and awaited
 * second {@code g}.
 *
 * <p>Every completed, cancelled or no-op command ends with {@link #clear()}. Arming keys (digits,
 * operators, {@code f/F/t/T/r}, {@code g}) leave it populated until the next key.
 *
 * @since 1.0
 */
public final class PendingComposition {

  private Operator operator;
  private final StringBuilder count = new StringBuilder();
  private CharMotion awaitedCharMotion;
  private boolean awaitedSecondG;

  /**
   * Resets every field to its default.
   */
  public void clear() {
    operator = null;
    count.setLength(0);
    awaitedCharMotion = null;
    awaitedSecondG = false;
  }

  /**
   * Returns true when no composition is in progress.
   *
   * @return true if all fields hold their defaults
   */
  public boolean isClear() {
    return operator == null && count.length() == 0 && awaitedCharMotion == null && !awaitedSecondG;
  }

  public Operator operator() {
    return operator;
  }

  public void operator(Operator operator) {
    this.operator = operator;
  }

  public boolean hasCount() {
    return count.length() > 0;
  }

  public String countDigits() {
    return count.toString();
  }

  public void appendDigit(char digit) {
    if (digit < '0' || digit > '9') {
      throw new IllegalArgumentException("Not a digit: " + digit);
    }
    count.append(digit);
  }

  /**
   * Returns the multiplier encoded by the count digits, 1 when none were typed.
   *
   * @param maxCount upper bound for the returned value
   * @return count in [1, maxCount]
   */
  public int count(int maxCount) {
    if (count.length() == 0) {
      return 1;
    }
    long value = 0;
    for (int i = 0; i < count.length(); i++) {
      value = value * 10 + (count.charAt(i) - '0');
      if (value >= maxCount) {
        return maxCount;
      }
    }
    return (int) Math.max(1, value);
  }

  public CharMotion awaitedCharMotion() {
    return awaitedCharMotion;
  }

  public void awaitCharMotion(CharMotion motion) {
    this.awaitedCharMotion = motion;
  }

  public boolean awaitingSecondG() {
    return awaitedSecondG;
  }

  public void awaitSecondG() {
    this.awaitedSecondG = true;
  }

  @Override
  public String toString() {
    return "PendingComposition{operator=" + operator
        + ", count='" + count
        + "', awaitedCharMotion=" + awaitedCharMotion
        + ", awaitedSecondG=" + awaitedSecondG + '}';
  }
}
