package com.consullo.vimode.engine;

/**
 * Editing mode. Selects which key grammar is active.
 *
 * @since 1.0
 */
public enum Mode {
  INSERT("INSERT"),
  NORMAL("NORMAL"),
  VISUAL("VISUAL");

  private final String label;

  Mode(String label) {
    this.label = label;
  }

  /**
   * Returns the text a host shows in its mode indicator.
   *
   * @return indicator label
   */
  public String label() {
    return label;
  }
}
