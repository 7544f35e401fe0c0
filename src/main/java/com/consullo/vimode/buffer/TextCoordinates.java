package com.consullo.vimode.buffer;

/**
 * Conversions between (row, column) locations and flat character offsets of a newline-separated text.
 *
 * <p>Out-of-range inputs clamp to the nearest valid position rather than failing.
 *
 * @since 1.0
 */
public final class TextCoordinates {

  private TextCoordinates() {
  }

  /**
   * Converts a location into an offset into {@code text}.
   *
   * @param text full document text, lines separated by '\n'
   * @param location location
   * @return offset in [0, text.length()]
   */
  public static int toOffset(String text, Location location) {
    if (text == null || location == null) {
      throw new IllegalArgumentException("text/location must not be null.");
    }
    int offset = 0;
    int row = 0;
    while (row < location.row()) {
      int newline = text.indexOf('\n', offset);
      if (newline < 0) {
        // Row past the last line: clamp to the end of the document.
        return text.length();
      }
      offset = newline + 1;
      row++;
    }
    int lineEnd = text.indexOf('\n', offset);
    if (lineEnd < 0) {
      lineEnd = text.length();
    }
    return Math.min(offset + location.column(), lineEnd);
  }

  /**
   * Converts an offset into a location.
   *
   * @param text full document text, lines separated by '\n'
   * @param offset offset, clamped to [0, text.length()]
   * @return location
   */
  public static Location toLocation(String text, int offset) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    int clamped = Math.max(0, Math.min(offset, text.length()));
    int row = 0;
    int lineStart = 0;
    for (int i = 0; i < clamped; i++) {
      if (text.charAt(i) == '\n') {
        row++;
        lineStart = i + 1;
      }
    }
    return new Location(row, clamped - lineStart);
  }
}
