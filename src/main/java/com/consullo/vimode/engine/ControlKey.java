package com.consullo.vimode.engine;

import java.util.Locale;

/**
 * Named keys that carry no printable character.
 *
 * @since 1.0
 */
public enum ControlKey {
  ESCAPE("escape"),
  LEFT("left"),
  RIGHT("right"),
  UP("up"),
  DOWN("down"),
  CTRL_R("ctrl+r"),
  ENTER("enter"),
  TAB("tab"),
  BACKSPACE("backspace"),
  DELETE("delete"),
  /** Any named key this engine does not distinguish. */
  OTHER("");

  private final String keyId;

  ControlKey(String keyId) {
    this.keyId = keyId;
  }

  /**
   * Returns the host key identifier, e.g. {@code "escape"} or {@code "ctrl+r"}.
   *
   * @return key identifier
   */
  public String keyId() {
    return keyId;
  }

  /**
   * Maps a host key identifier to a control key. Unknown identifiers map to {@link #OTHER}.
   *
   * @param keyId key identifier (case-insensitive)
   * @return control key
   */
  public static ControlKey fromKeyId(String keyId) {
    if (keyId == null || keyId.isEmpty()) {
      return OTHER;
    }
    String normalized = keyId.toLowerCase(Locale.ROOT);
    for (ControlKey k : values()) {
      if (k != OTHER && k.keyId.equals(normalized)) {
        return k;
      }
    }
    return OTHER;
  }
}
