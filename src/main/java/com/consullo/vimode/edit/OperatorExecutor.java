package com.consullo.vimode.edit;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.Selection;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.buffer.TextCoordinates;
import com.consullo.vimode.motion.Motion;
import com.consullo.vimode.motion.MotionResolver;
import org.apache.commons.lang3.Validate;

/**
 * Applies delete, change and yank to a span of the buffer and keeps the register up to date.
 *
 * <p>
 * Spans come from three places:
 * <ul>
 * <li>a motion, between the cursor before and after the motion;</li>
 * <li>a doubled operator, covering the whole current line;</li>
 * <li>a visual selection, including the character under its far end.</li>
 * </ul>
 * Change behaves like delete here; switching to Insert mode is up to the caller.
 * </p>
 *
 * @since 1.0
 */
public final class OperatorExecutor {

  private final TextBuffer buffer;
  private final MotionResolver resolver;
  private final YankRegister register;

  public OperatorExecutor(final TextBuffer buffer, final MotionResolver resolver, final YankRegister register) {
    Validate.notNull(buffer, "buffer must not be null");
    Validate.notNull(resolver, "resolver must not be null");
    Validate.notNull(register, "register must not be null");
    this.buffer = buffer;
    this.resolver = resolver;
    this.register = register;
  }

  /**
   * Resolves {@code motion} from the cursor and applies {@code operator} to the span it covers.
   *
   * @param operator operator
   * @param motion motion
   */
  public void applyToMotion(final Operator operator, final Motion motion) {
    Validate.notNull(operator, "operator must not be null");
    Validate.notNull(motion, "motion must not be null");
    Location before = buffer.cursorLocation();
    resolver.move(motion);
    Location after = buffer.cursorLocation();
    applyToSpan(operator, Location.min(before, after), Location.max(before, after), false);
  }

  /**
   * Applies {@code operator} to the current line including its line break, unless it is the last line.
   *
   * @param operator operator
   */
  public void applyToLine(final Operator operator) {
    Validate.notNull(operator, "operator must not be null");
    int row = buffer.cursorLocation().row();
    buffer.cursorLineStart();
    Location lineStart = buffer.cursorLocation();
    buffer.cursorLineEnd();
    if (row < buffer.lineCount() - 1) {
      buffer.cursorRight();
    }
    Location lineEnd = buffer.cursorLocation();
    applyToSpan(operator, lineStart, lineEnd, true);
  }

  /**
   * Applies {@code operator} to the buffer selection. The character under the later end is included,
   * except when the later end is the anchor parked past the end of its line: a selection started after
   * {@code $} does not take the line break.
   *
   * @param operator operator
   */
  public void applyToSelection(final Operator operator) {
    Validate.notNull(operator, "operator must not be null");
    Selection selection = buffer.selection();
    String text = buffer.fullText();
    Location end = selection.end();
    int endOffset = TextCoordinates.toOffset(text, end);
    if (!end.equals(selection.anchor()) || end.equals(selection.active()) || !isPastLineEnd(end)) {
      endOffset = Math.min(endOffset + 1, text.length());
    }
    applyToSpan(operator, selection.start(), TextCoordinates.toLocation(text, endOffset), false);
  }

  private boolean isPastLineEnd(Location location) {
    return location.column() >= buffer.documentLine(location.row()).length();
  }

  private void applyToSpan(Operator operator, Location start, Location end, boolean linewise) {
    buffer.select(start, end);
    register.store(buffer.selectedText(), linewise);
    if (operator.mutates()) {
      buffer.delete(start, end);
    } else {
      buffer.moveCursor(start);
    }
  }

  /**
   * Pastes the register after ({@code p}) or before ({@code P}) the cursor. Linewise content goes on a
   * new line below or above the cursor line. Nothing happens when the register is empty.
   *
   * @param after true for {@code p}
   * @return true if anything was pasted
   */
  public boolean paste(final boolean after) {
    if (register.isEmpty()) {
      return false;
    }
    if (register.isLinewise()) {
      pasteLine(after);
      return true;
    }
    if (after) {
      Location at = buffer.cursorLocation();
      int lineLength = buffer.documentLine(at.row()).length();
      buffer.moveCursor(new Location(at.row(), Math.min(at.column() + 1, lineLength)));
    }
    buffer.insert(register.text());
    return true;
  }

  private void pasteLine(boolean after) {
    String line = register.text();
    if (line.endsWith("\n")) {
      line = line.substring(0, line.length() - 1);
    }
    int row = buffer.cursorLocation().row();
    if (!after) {
      buffer.moveCursor(new Location(row, 0));
      buffer.insert(line + "\n");
      buffer.moveCursor(new Location(row, 0));
      return;
    }
    if (row < buffer.lineCount() - 1) {
      buffer.moveCursor(new Location(row + 1, 0));
      buffer.insert(line + "\n");
    } else {
      buffer.cursorLineEnd();
      buffer.insert("\n" + line);
    }
    buffer.moveCursor(new Location(row + 1, 0));
  }

  /**
   * Returns true if there is a character under the cursor (not at line end).
   *
   * @return true if a character can be replaced
   */
  public boolean hasCharacterUnderCursor() {
    Location at = buffer.cursorLocation();
    return at.column() < buffer.documentLine(at.row()).length();
  }

  /**
   * Replaces the character under the cursor. The cursor stays on it.
   *
   * @param replacement new character
   * @return true if a character was replaced
   */
  public boolean replaceCharacter(final char replacement) {
    if (!hasCharacterUnderCursor()) {
      return false;
    }
    Location at = buffer.cursorLocation();
    buffer.deleteRight();
    buffer.insert(String.valueOf(replacement));
    buffer.moveCursor(at);
    return true;
  }

  /**
   * Returns true if the cursor line has a following line to join.
   *
   * @return true if {@link #joinLines()} would act
   */
  public boolean canJoinLines() {
    return buffer.cursorLocation().row() < buffer.lineCount() - 1;
  }

  /**
   * Joins the cursor line with the next one, separated by a single space.
   *
   * @return true if lines were joined
   */
  public boolean joinLines() {
    if (!canJoinLines()) {
      return false;
    }
    buffer.cursorLineEnd();
    buffer.deleteRight();
    buffer.insert(" ");
    return true;
  }
}
