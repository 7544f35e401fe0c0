package com.consullo.vimode.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses vi-style key notation into {@link Key} lists.
 *
 * <p>
 * Plain characters stand for themselves. Named keys are written in angle brackets, case-insensitive:
 * {@code <Esc>}, {@code <Left>}, {@code <Right>}, {@code <Up>}, {@code <Down>}, {@code <C-r>},
 * {@code <CR>} / {@code <Enter>}, {@code <Tab>}, {@code <BS>}, {@code <Del>}. A literal '&lt;' is
 * written {@code <lt>}.
 * </p>
 *
 * @since 1.0
 */
public final class KeySequence {

  private KeySequence() {
  }

  /**
   * Parses a key script.
   *
   * @param script key script, e.g. {@code "dw3x<Esc>"}
   * @return immutable key list
   * @throws IllegalArgumentException on an unknown or unterminated bracket token
   */
  public static List<Key> parse(String script) {
    if (script == null) {
      throw new IllegalArgumentException("script must not be null.");
    }
    List<Key> keys = new ArrayList<>(script.length());
    int i = 0;
    while (i < script.length()) {
      char c = script.charAt(i);
      if (c != '<') {
        keys.add(Key.character(c));
        i++;
        continue;
      }
      int close = script.indexOf('>', i + 1);
      if (close < 0) {
        throw new IllegalArgumentException("Unterminated key token at index " + i + ": " + script);
      }
      keys.add(named(script.substring(i + 1, close)));
      i = close + 1;
    }
    return Collections.unmodifiableList(keys);
  }

  private static Key named(String token) {
    switch (token.toLowerCase(Locale.ROOT)) {
      case "esc":
      case "escape":
        return Key.control(ControlKey.ESCAPE);
      case "left":
        return Key.control(ControlKey.LEFT);
      case "right":
        return Key.control(ControlKey.RIGHT);
      case "up":
        return Key.control(ControlKey.UP);
      case "down":
        return Key.control(ControlKey.DOWN);
      case "c-r":
        return Key.control(ControlKey.CTRL_R);
      case "cr":
      case "enter":
        return Key.control(ControlKey.ENTER);
      case "tab":
        return Key.control(ControlKey.TAB);
      case "bs":
        return Key.control(ControlKey.BACKSPACE);
      case "del":
        return Key.control(ControlKey.DELETE);
      case "lt":
        return Key.character('<');
      default:
        throw new IllegalArgumentException("Unknown key token: <" + token + ">");
    }
  }
}
