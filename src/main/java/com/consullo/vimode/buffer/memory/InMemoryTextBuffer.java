package com.consullo.vimode.buffer.memory;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.Selection;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.buffer.TextCoordinates;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TextBuffer} implementation that keeps the whole document in a single string.
 *
 * <p>
 * Notes:
 * <ul>
 * <li>Positions are converted to flat offsets for every operation, so horizontal motions wrap across line
 * breaks the way a text area does.</li>
 * <li>Word motions classify characters as word characters (letters, digits, '_'), punctuation, or
 * whitespace. A word is a run of one class.</li>
 * <li>Every mutation that changes the text pushes one undo snapshot; a new edit drops the redo stack.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class InMemoryTextBuffer implements TextBuffer {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTextBuffer.class);

  private static final int DEFAULT_MAX_UNDO_DEPTH = 1_000;

  private final int maxUndoDepth;
  private final Deque<Snapshot> undoStack = new ArrayDeque<>();
  private final Deque<Snapshot> redoStack = new ArrayDeque<>();

  private String text;
  private Selection selection;

  /**
   * Document text plus cursor at the time an edit happened.
   */
  private record Snapshot(String text, Location cursor) {
  }

  private enum CharClass {
    WORD,
    PUNCTUATION,
    SPACE
  }

  /**
   * Creates an empty buffer.
   */
  public InMemoryTextBuffer() {
    this("");
  }

  /**
   * Creates a buffer holding {@code text} with the cursor at the document start.
   *
   * @param text initial text (lines separated by '\n')
   */
  public InMemoryTextBuffer(final String text) {
    this(text, DEFAULT_MAX_UNDO_DEPTH);
  }

  /**
   * Creates a buffer holding {@code text} with the cursor at the document start.
   *
   * @param text initial text (lines separated by '\n')
   * @param maxUndoDepth max undo snapshots to retain
   */
  public InMemoryTextBuffer(final String text, final int maxUndoDepth) {
    Validate.notNull(text, "text must not be null");
    Validate.isTrue(maxUndoDepth > 0, "maxUndoDepth must be positive");
    this.text = text;
    this.maxUndoDepth = maxUndoDepth;
    this.selection = Selection.cursor(Location.origin());
  }

  @Override
  public Location cursorLocation() {
    return selection.active();
  }

  @Override
  public void moveCursor(final Location location) {
    Validate.notNull(location, "location must not be null");
    selection = Selection.cursor(clamp(location));
  }

  @Override
  public int lineCount() {
    int count = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }

  @Override
  public String documentLine(final int row) {
    Validate.isTrue(row >= 0 && row < lineCount(), "row out of range: %d", row);
    int start = lineStartOffset(row);
    return text.substring(start, lineEndOffset(start));
  }

  @Override
  public Location documentEnd() {
    return TextCoordinates.toLocation(text, text.length());
  }

  @Override
  public void cursorWordRight() {
    int pos = cursorOffset();
    int n = text.length();
    if (pos < n) {
      CharClass cls = classify(text.charAt(pos));
      if (cls != CharClass.SPACE) {
        while (pos < n && classify(text.charAt(pos)) == cls) {
          pos++;
        }
      }
    }
    while (pos < n && classify(text.charAt(pos)) == CharClass.SPACE) {
      pos++;
    }
    moveToOffset(pos);
  }

  @Override
  public void cursorWordLeft() {
    int pos = cursorOffset();
    while (pos > 0 && classify(text.charAt(pos - 1)) == CharClass.SPACE) {
      pos--;
    }
    if (pos > 0) {
      CharClass cls = classify(text.charAt(pos - 1));
      while (pos > 0 && classify(text.charAt(pos - 1)) == cls) {
        pos--;
      }
    }
    moveToOffset(pos);
  }

  @Override
  public void cursorLineStart() {
    moveCursor(new Location(cursorLocation().row(), 0));
  }

  @Override
  public void cursorLineEnd() {
    int row = cursorLocation().row();
    moveCursor(new Location(row, documentLine(row).length()));
  }

  @Override
  public void cursorUp() {
    Location at = cursorLocation();
    if (at.row() > 0) {
      moveCursor(new Location(at.row() - 1, at.column()));
    }
  }

  @Override
  public void cursorDown() {
    Location at = cursorLocation();
    if (at.row() < lineCount() - 1) {
      moveCursor(new Location(at.row() + 1, at.column()));
    }
  }

  @Override
  public void cursorLeft() {
    int pos = cursorOffset();
    if (pos > 0) {
      moveToOffset(pos - 1);
    }
  }

  @Override
  public void cursorRight() {
    int pos = cursorOffset();
    if (pos < text.length()) {
      moveToOffset(pos + 1);
    }
  }

  @Override
  public void deleteLeft() {
    int pos = cursorOffset();
    if (pos > 0) {
      replace(pos - 1, pos, "");
    }
  }

  @Override
  public void deleteRight() {
    int pos = cursorOffset();
    if (pos < text.length()) {
      replace(pos, pos + 1, "");
    }
  }

  @Override
  public void deleteToEndOfLine() {
    int pos = cursorOffset();
    int end = lineEndOffset(pos);
    if (end > pos) {
      replace(pos, end, "");
    }
  }

  @Override
  public void insert(final String insertText) {
    Validate.notNull(insertText, "text must not be null");
    int start = TextCoordinates.toOffset(text, selection.start());
    int end = TextCoordinates.toOffset(text, selection.end());
    replace(start, end, insertText);
  }

  @Override
  public String delete(final Location start, final Location end) {
    Validate.notNull(start, "start must not be null");
    Validate.notNull(end, "end must not be null");
    int a = TextCoordinates.toOffset(text, Location.min(start, end));
    int b = TextCoordinates.toOffset(text, Location.max(start, end));
    String removed = text.substring(a, b);
    if (a == b) {
      moveToOffset(a);
    } else {
      replace(a, b, "");
    }
    return removed;
  }

  @Override
  public String selectedText() {
    int start = TextCoordinates.toOffset(text, selection.start());
    int end = TextCoordinates.toOffset(text, selection.end());
    return text.substring(start, end);
  }

  @Override
  public Selection selection() {
    return selection;
  }

  @Override
  public void select(final Location anchor, final Location active) {
    Validate.notNull(anchor, "anchor must not be null");
    Validate.notNull(active, "active must not be null");
    selection = new Selection(clamp(anchor), clamp(active));
  }

  @Override
  public String fullText() {
    return text;
  }

  @Override
  public void undo() {
    Snapshot previous = undoStack.pollLast();
    if (previous == null) {
      return;
    }
    redoStack.addLast(new Snapshot(text, cursorLocation()));
    restore(previous);
    LOGGER.debug("undo: {} snapshots left", undoStack.size());
  }

  @Override
  public void redo() {
    Snapshot next = redoStack.pollLast();
    if (next == null) {
      return;
    }
    undoStack.addLast(new Snapshot(text, cursorLocation()));
    restore(next);
    LOGGER.debug("redo: {} snapshots left", redoStack.size());
  }

  private void restore(Snapshot snapshot) {
    text = snapshot.text();
    selection = Selection.cursor(clamp(snapshot.cursor()));
  }

  /**
   * Replaces [start, end) with {@code replacement} and leaves the cursor after the replacement.
   */
  private void replace(int start, int end, String replacement) {
    if (start == end && replacement.isEmpty()) {
      moveToOffset(start);
      return;
    }
    undoStack.addLast(new Snapshot(text, cursorLocation()));
    if (undoStack.size() > maxUndoDepth) {
      undoStack.removeFirst();
    }
    redoStack.clear();
    text = text.substring(0, start) + replacement + text.substring(end);
    moveToOffset(start + replacement.length());
  }

  private int cursorOffset() {
    return TextCoordinates.toOffset(text, cursorLocation());
  }

  private void moveToOffset(int offset) {
    selection = Selection.cursor(TextCoordinates.toLocation(text, offset));
  }

  private int lineStartOffset(int row) {
    return TextCoordinates.toOffset(text, new Location(row, 0));
  }

  private int lineEndOffset(int fromOffset) {
    int newline = text.indexOf('\n', fromOffset);
    return newline < 0 ? text.length() : newline;
  }

  private Location clamp(Location location) {
    int lastRow = lineCount() - 1;
    int row = Math.min(location.row(), lastRow);
    int column = Math.min(location.column(), documentLine(row).length());
    return new Location(row, column);
  }

  private static CharClass classify(char c) {
    if (Character.isWhitespace(c)) {
      return CharClass.SPACE;
    }
    if (Character.isLetterOrDigit(c) || c == '_') {
      return CharClass.WORD;
    }
    return CharClass.PUNCTUATION;
  }
}
