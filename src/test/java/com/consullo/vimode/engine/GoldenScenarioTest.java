package com.consullo.vimode.engine;

import com.consullo.vimode.buffer.memory.InMemoryTextBuffer;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Golden scenario tests.
 *
 * <p>
 * Each fixture is a triple under {@code fixtures/}: {@code <name>.before.txt} (initial buffer),
 * {@code <name>.keys} (key script in vi notation) and {@code <name>.after.txt} (expected buffer). The
 * engine starts in Insert mode with the cursor at the document start; keys it does not consume are
 * inserted into the buffer the way a host widget would.
 * </p>
 */
public final class GoldenScenarioTest {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoldenScenarioTest.class);

  @Test
  public void deleteWordThenCountedDelete() throws Exception {
    runFixture("word-ops");
  }

  @Test
  public void deleteLineThenPasteAbove() throws Exception {
    runFixture("line-ops");
  }

  @Test
  public void changeWordIsRepeatedFromNewCursor() throws Exception {
    runFixture("change-repeat");
  }

  @Test
  public void visualYankPastesAtLineEnd() throws Exception {
    runFixture("visual-yank");
  }

  @Test
  public void joinLinesThenReplaceCharacter() throws Exception {
    runFixture("join-replace");
  }

  private static void runFixture(String name) throws Exception {
    String before = loadTextResource("fixtures/" + name + ".before.txt");
    String script = loadTextResource("fixtures/" + name + ".keys");
    String expected = loadTextResource("fixtures/" + name + ".after.txt");
    LOGGER.info("runFixture: {} with keys {}", name, script);

    InMemoryTextBuffer buffer = new InMemoryTextBuffer(before);
    ViEngine engine = new ViEngine(buffer);

    List<Key> keys = KeySequence.parse(script);
    for (Key key : keys) {
      if (!engine.handleKey(key) && key.isCharacter()) {
        buffer.insert(String.valueOf(key.character()));
      }
    }

    assertThat(buffer.fullText()).isEqualTo(expected);
    assertThat(engine.isComposing()).isFalse();
  }

  /**
   * Reads a resource, joining lines with '\n' and dropping the final line break.
   */
  private static String loadTextResource(String path) throws Exception {
    InputStream is = GoldenScenarioTest.class.getClassLoader().getResourceAsStream(path);
    if (is == null) {
      throw new IllegalStateException("Missing resource: " + path);
    }
    try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      StringBuilder sb = new StringBuilder();
      String line;
      boolean first = true;
      while ((line = br.readLine()) != null) {
        if (!first) {
          sb.append("\n");
        }
        sb.append(line);
        first = false;
      }
      return sb.toString();
    }
  }
}
