package com.consullo.vimode.buffer;

/**
 * Text buffer abstraction that the vi engine drives: content, cursor, selection, primitive motions and
 * mutations, and linear undo/redo.
 *
 * <p>This interface exists to isolate the key grammar from a specific widget implementation. Hosts adapt
 * their own text-area model to it; {@link com.consullo.vimode.buffer.memory.InMemoryTextBuffer} is the
 * reference implementation used for headless operation and tests.
 *
 * <p>Boundary handling (column 0 left, line end right, first row up, ...) belongs to the buffer. Callers
 * do not pre-check boundaries.
 *
 * @since 1.0
 */
public interface TextBuffer {

  /**
   * Returns the cursor location (the active end of the selection).
   *
   * @return cursor location
   */
  Location cursorLocation();

  /**
   * Moves the cursor and collapses the selection onto it. Out-of-range locations are clamped.
   *
   * @param location target location
   */
  void moveCursor(final Location location);

  /**
   * Returns the number of lines. An empty document has one empty line.
   *
   * @return line count
   */
  int lineCount();

  /**
   * Returns the text of a line without its line break.
   *
   * @param row zero-based row
   * @return line text
   */
  String documentLine(final int row);

  /**
   * Returns the location just after the last character of the document.
   *
   * @return document end
   */
  Location documentEnd();

  /**
   * Moves the cursor to the start of the next word, wrapping to following lines.
   */
  void cursorWordRight();

  /**
   * Moves the cursor to the start of the current or previous word, wrapping to preceding lines.
   */
  void cursorWordLeft();

  void cursorLineStart();

  void cursorLineEnd();

  void cursorUp();

  void cursorDown();

  void cursorLeft();

  void cursorRight();

  /**
   * Deletes the character before the cursor.
   */
  void deleteLeft();

  /**
   * Deletes the character under the cursor.
   */
  void deleteRight();

  /**
   * Deletes from the cursor to the end of the current line, leaving the line break.
   */
  void deleteToEndOfLine();

  /**
   * Inserts text at the cursor, replacing the selection if one exists. The cursor ends after the text.
   *
   * @param text text to insert
   */
  void insert(final String text);

  /**
   * Deletes the text between two locations, in either order. The cursor ends at the earlier location.
   *
   * @param start one end of the span
   * @param end other end of the span
   * @return the deleted text
   */
  String delete(final Location start, final Location end);

  /**
   * Returns the text covered by the current selection (empty when the selection is collapsed).
   *
   * @return selected text
   */
  String selectedText();

  /**
   * Returns the current selection.
   *
   * @return selection
   */
  Selection selection();

  /**
   * Sets the selection. The cursor moves to {@code active}.
   *
   * @param anchor fixed end
   * @param active moving end
   */
  void select(final Location anchor, final Location active);

  /**
   * Returns the whole document, lines joined with '\n'.
   *
   * @return document text
   */
  String fullText();

  /**
   * Reverts the most recent edit, if any.
   */
  void undo();

  /**
   * Re-applies the most recently undone edit, if any.
   */
  void redo();
}
