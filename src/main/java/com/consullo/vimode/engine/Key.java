package com.consullo.vimode.engine;

import java.util.Objects;

/**
 * A key event delivered by the host: either a named control key or a printable character.
 */
public final class Key {

  public enum Type {
    CONTROL,
    CHARACTER
  }

  private final Type type;
  private final ControlKey control;
  private final char character;

  private Key(Type type, ControlKey control, char character) {
    this.type = type;
    this.control = control;
    this.character = character;
  }

  public static Key control(ControlKey control) {
    if (control == null) {
      throw new IllegalArgumentException("control must not be null.");
    }
    return new Key(Type.CONTROL, control, '\0');
  }

  public static Key character(char c) {
    if (Character.isISOControl(c)) {
      throw new IllegalArgumentException("Not a printable character: " + (int) c);
    }
    return new Key(Type.CHARACTER, null, c);
  }

  /**
   * Builds a key from the host's (key id, literal) pair. A printable literal wins; otherwise the key id
   * names the control key.
   *
   * @param keyId host key identifier, e.g. "escape", "left", "ctrl+r", "x"
   * @param literal printable character, or null for pure control keys
   * @return key
   */
  public static Key of(String keyId, Character literal) {
    if (literal != null && !Character.isISOControl(literal)) {
      return character(literal);
    }
    return control(ControlKey.fromKeyId(keyId));
  }

  public Type type() {
    return type;
  }

  public boolean isCharacter() {
    return type == Type.CHARACTER;
  }

  public boolean is(ControlKey k) {
    return type == Type.CONTROL && control == k;
  }

  public boolean is(char c) {
    return type == Type.CHARACTER && character == c;
  }

  public boolean isDigit() {
    return type == Type.CHARACTER && character >= '0' && character <= '9';
  }

  /**
   * Returns the control key. Only valid for {@link Type#CONTROL}.
   *
   * @return control key
   */
  public ControlKey controlKey() {
    if (type != Type.CONTROL) {
      throw new IllegalStateException("Not a control key: " + this);
    }
    return control;
  }

  /**
   * Returns the printable character. Only valid for {@link Type#CHARACTER}.
   *
   * @return character
   */
  public char character() {
    if (type != Type.CHARACTER) {
      throw new IllegalStateException("Not a character key: " + this);
    }
    return character;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Key)) {
      return false;
    }
    Key other = (Key) o;
    return type == other.type && control == other.control && character == other.character;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, control, character);
  }

  @Override
  public String toString() {
    return type == Type.CONTROL ? "<" + control + ">" : String.valueOf(character);
  }
}
