package com.consullo.vimode.demo;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.memory.InMemoryTextBuffer;
import com.consullo.vimode.engine.Key;
import com.consullo.vimode.engine.KeySequence;
import com.consullo.vimode.engine.ViEngine;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that runs a key script against an in-memory buffer and prints the result.
 *
 * <p>
 * Usage: {@code ViModeDemo <text> <keys>}, e.g. {@code ViModeDemo "hello world" "<Esc>0dw3x"}. Keys the
 * engine does not consume (typing in Insert mode) are inserted into the buffer, as a host widget would.
 * Without arguments a built-in script is used.
 * </p>
 *
 * @since 1.0
 */
public final class ViModeDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ViModeDemo.class);

  private ViModeDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args text and key script
   */
  public static void main(final String[] args) {
    final String text = args.length > 0 ? args[0] : "hello world\nsecond line";
    final String script = args.length > 1 ? args[1] : "<Esc>0dwjyyp";

    final InMemoryTextBuffer buffer = new InMemoryTextBuffer(text);
    final ViEngine engine = new ViEngine(buffer);
    engine.addModeChangeListener(event ->
        System.out.println("-- " + event.current().label() + " --"));

    final List<Key> keys = KeySequence.parse(script);
    LOGGER.info("Running {} keys against {} chars", keys.size(), text.length());
    for (Key key : keys) {
      boolean consumed = engine.handleKey(key);
      if (!consumed && key.isCharacter()) {
        buffer.insert(String.valueOf(key.character()));
      }
    }

    final Location cursor = buffer.cursorLocation();
    System.out.println("=== Buffer ===");
    System.out.println(buffer.fullText());
    System.out.println("=== End Buffer ===");
    System.out.println("cursor=(" + cursor.row() + "," + cursor.column() + ")"
        + " mode=" + engine.mode().label()
        + " register=\"" + engine.register().text() + "\"");
  }
}
