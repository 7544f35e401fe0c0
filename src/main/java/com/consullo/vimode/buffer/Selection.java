package com.consullo.vimode.buffer;

/**
 * Buffer selection. The anchor stays put while the active end follows the cursor.
 *
 * @param anchor fixed end of the selection
 * @param active moving end of the selection (the cursor)
 * @since 1.0
 */
public record Selection(Location anchor, Location active) {

  public Selection {
    if (anchor == null || active == null) {
      throw new IllegalArgumentException("anchor/active must not be null.");
    }
  }

  /**
   * Creates an empty selection collapsed at the given location.
   *
   * @param at location
   * @return collapsed selection
   */
  public static Selection cursor(Location at) {
    return new Selection(at, at);
  }

  public Location start() {
    return Location.min(anchor, active);
  }

  public Location end() {
    return Location.max(anchor, active);
  }

  public boolean isEmpty() {
    return anchor.equals(active);
  }
}
