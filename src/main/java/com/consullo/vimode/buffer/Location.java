package com.consullo.vimode.buffer;

/**
 * Zero-based (row, column) position inside a text buffer.
 *
 * <p>Locations order row-major, which is the order used to normalize operator spans.
 *
 * @param row zero-based line index
 * @param column zero-based column within the line
 * @since 1.0
 */
public record Location(int row, int column) implements Comparable<Location> {

  public Location {
    if (row < 0 || column < 0) {
      throw new IllegalArgumentException("row/column must not be negative.");
    }
  }

  /**
   * Creates a location.
   *
   * @param row row
   * @param column column
   * @return location
   */
  public static Location of(int row, int column) {
    return new Location(row, column);
  }

  /**
   * Returns the start of the document.
   *
   * @return location (0, 0)
   */
  public static Location origin() {
    return new Location(0, 0);
  }

  @Override
  public int compareTo(Location other) {
    if (row != other.row) {
      return Integer.compare(row, other.row);
    }
    return Integer.compare(column, other.column);
  }

  public boolean isBefore(Location other) {
    return compareTo(other) < 0;
  }

  public static Location min(Location a, Location b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  public static Location max(Location a, Location b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
