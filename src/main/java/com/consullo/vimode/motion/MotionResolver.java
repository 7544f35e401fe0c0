package com.consullo.vimode.motion;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.buffer.TextCoordinates;
import org.apache.commons.lang3.Validate;

/**
 * Moves the buffer cursor for word, line, document and in-line character motions.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Motions the buffer already provides (word left/right, line start/end, arrows) are delegated.</li>
 * <li>Word end and first-non-blank have no buffer primitive and are computed here from the text.</li>
 * <li>Character searches scan the current line only; a miss leaves the cursor where it is.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class MotionResolver {

  private final TextBuffer buffer;

  public MotionResolver(final TextBuffer buffer) {
    Validate.notNull(buffer, "buffer must not be null");
    this.buffer = buffer;
  }

  /**
   * Applies {@code motion} {@code count} times, or once for motions that are not repeatable.
   *
   * @param motion motion
   * @param count repeat count (at least 1)
   */
  public void move(final Motion motion, final int count) {
    Validate.notNull(motion, "motion must not be null");
    int times = motion.repeatable() ? Math.max(1, count) : 1;
    for (int i = 0; i < times; i++) {
      move(motion);
    }
  }

  /**
   * Applies {@code motion} once.
   *
   * @param motion motion
   */
  public void move(final Motion motion) {
    switch (motion) {
      case LEFT:
        buffer.cursorLeft();
        break;
      case RIGHT:
        buffer.cursorRight();
        break;
      case UP:
        buffer.cursorUp();
        break;
      case DOWN:
        buffer.cursorDown();
        break;
      case WORD_RIGHT:
        buffer.cursorWordRight();
        break;
      case WORD_LEFT:
        buffer.cursorWordLeft();
        break;
      case WORD_END:
        moveToWordEnd();
        break;
      case LINE_START:
        buffer.cursorLineStart();
        break;
      case LINE_END:
        buffer.cursorLineEnd();
        break;
      case FIRST_NON_BLANK:
        moveToFirstNonBlank();
        break;
      case DOCUMENT_START:
        buffer.moveCursor(Location.origin());
        break;
      case DOCUMENT_END:
        buffer.moveCursor(buffer.documentEnd());
        break;
      default:
        throw new IllegalStateException("Unhandled motion: " + motion);
    }
  }

  /**
   * Moves to the last character of the next word end. Always advances, even from the last character of a
   * word.
   */
  void moveToWordEnd() {
    String text = buffer.fullText();
    int n = text.length();
    int pos = TextCoordinates.toOffset(text, buffer.cursorLocation());

    while (pos < n && !Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    while (pos < n && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    while (pos < n && !Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    if (pos > 0) {
      pos--;
    }
    buffer.moveCursor(TextCoordinates.toLocation(text, pos));
  }

  private void moveToFirstNonBlank() {
    buffer.cursorLineStart();
    int row = buffer.cursorLocation().row();
    String line = buffer.documentLine(row);
    for (int i = 0; i < line.length(); i++) {
      if (!Character.isWhitespace(line.charAt(i))) {
        buffer.moveCursor(new Location(row, i));
        return;
      }
    }
  }

  /**
   * Searches the current line for {@code target} and moves the cursor per {@code motion}.
   *
   * @param motion one of the search motions
   * @param target character to find
   * @return true if the target was found
   */
  public boolean findOnLine(final CharMotion motion, final char target) {
    Validate.notNull(motion, "motion must not be null");
    Validate.isTrue(motion.isSearch(), "not a search motion: %s", motion);

    Location at = buffer.cursorLocation();
    int row = at.row();
    int col = at.column();
    String line = buffer.documentLine(row);

    switch (motion) {
      case FIND_FORWARD:
      case TILL_FORWARD: {
        int idx = line.indexOf(target, col + 1);
        if (idx < 0) {
          return false;
        }
        int landing = motion == CharMotion.FIND_FORWARD ? idx : idx - 1;
        buffer.moveCursor(new Location(row, Math.max(col, landing)));
        return true;
      }
      case FIND_BACKWARD:
      case TILL_BACKWARD: {
        int idx = col > 0 ? line.lastIndexOf(target, col - 1) : -1;
        if (idx < 0) {
          return false;
        }
        int landing = motion == CharMotion.FIND_BACKWARD ? idx : idx + 1;
        buffer.moveCursor(new Location(row, Math.min(col, landing)));
        return true;
      }
      default:
        throw new IllegalStateException("Unhandled search motion: " + motion);
    }
  }
}
