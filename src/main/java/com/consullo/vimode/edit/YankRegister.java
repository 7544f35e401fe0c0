package com.consullo.vimode.edit;

/**
 * The single unnamed register. Overwritten by yank and delete, read (never cleared) by paste.
 *
 * <p>Content captured by a line operator is flagged linewise so that paste re-inserts it as a whole line.
 *
 * @since 1.0
 */
public final class YankRegister {

  private String text = "";
  private boolean linewise;

  /**
   * Replaces the register content. Only the operator executor writes the register; hosts read it.
   *
   * @param text captured text
   * @param linewise true if captured by a line operator
   */
  void store(String text, boolean linewise) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    this.text = text;
    this.linewise = linewise;
  }

  public String text() {
    return text;
  }

  public boolean isLinewise() {
    return linewise;
  }

  /**
   * Returns true if there is nothing to paste. An empty line captured linewise still pastes.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return text.isEmpty() && !linewise;
  }
}
