package com.consullo.vimode.edit;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.memory.InMemoryTextBuffer;
import com.consullo.vimode.motion.Motion;
import com.consullo.vimode.motion.MotionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OperatorExecutor} against an in-memory buffer.
 *
 * @since 1.0
 */
public class OperatorExecutorTest {

  private InMemoryTextBuffer buffer;
  private YankRegister register;
  private OperatorExecutor executor;

  private void load(String text) {
    buffer = new InMemoryTextBuffer(text);
    register = new YankRegister();
    executor = new OperatorExecutor(buffer, new MotionResolver(buffer), register);
  }

  @BeforeEach
  void setUp() {
    load("");
  }

  @Test
  @DisplayName("Delete over a forward motion removes up to the new cursor")
  void applyToMotion_DeleteWord() {
    load("hello world");

    executor.applyToMotion(Operator.DELETE, Motion.WORD_RIGHT);

    assertThat(buffer.fullText()).isEqualTo("world");
    assertThat(register.text()).isEqualTo("hello ");
    assertThat(register.isLinewise()).isFalse();
  }

  @Test
  @DisplayName("A backward motion spans from the new cursor to the old one")
  void applyToMotion_Backward() {
    load("hello world");
    buffer.moveCursor(Location.of(0, 8));

    executor.applyToMotion(Operator.DELETE, Motion.WORD_LEFT);

    assertThat(buffer.fullText()).isEqualTo("hello rld");
    assertThat(register.text()).isEqualTo("wo");
    assertThat(buffer.cursorLocation()).isEqualTo(Location.of(0, 6));
  }

  @Test
  @DisplayName("Yank over a motion leaves the text and moves to the span start")
  void applyToMotion_Yank() {
    load("hello world");
    buffer.moveCursor(Location.of(0, 6));

    executor.applyToMotion(Operator.YANK, Motion.LINE_START);

    assertThat(buffer.fullText()).isEqualTo("hello world");
    assertThat(register.text()).isEqualTo("hello ");
    assertThat(buffer.cursorLocation()).isEqualTo(Location.origin());
    assertThat(buffer.selection().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("A line operator captures the line break and marks the register linewise")
  void applyToLine_MiddleLine() {
    load("a\nb\nc");
    buffer.moveCursor(Location.of(1, 1));

    executor.applyToLine(Operator.YANK);
    assertThat(register.text()).isEqualTo("b\n");
    assertThat(register.isLinewise()).isTrue();
    assertThat(buffer.cursorLocation()).isEqualTo(Location.of(1, 0));

    executor.applyToLine(Operator.DELETE);
    assertThat(buffer.fullText()).isEqualTo("a\nc");
  }

  @Test
  @DisplayName("A line operator on the last line takes no line break")
  void applyToLine_LastLine() {
    load("a\nbc");
    buffer.moveCursor(Location.of(1, 0));

    executor.applyToLine(Operator.DELETE);

    assertThat(register.text()).isEqualTo("bc");
    assertThat(buffer.fullText()).isEqualTo("a\n");
  }

  @Test
  @DisplayName("A selection ending at the document end is clamped")
  void applyToSelection_ClampsAtEnd() {
    load("abc");
    buffer.select(Location.of(0, 1), Location.of(0, 3));

    executor.applyToSelection(Operator.DELETE);

    assertThat(buffer.fullText()).isEqualTo("a");
    assertThat(register.text()).isEqualTo("bc");
  }

  @Test
  @DisplayName("Paste does nothing when the register is empty")
  void paste_EmptyRegister() {
    load("abc");

    assertThat(executor.paste(true)).isFalse();
    assertThat(buffer.fullText()).isEqualTo("abc");
  }

  @Test
  @DisplayName("Characterwise p inserts after the cursor; P inserts at it")
  void paste_Characterwise() {
    load("ab");
    register.store("X", false);
    buffer.moveCursor(Location.of(0, 1));

    executor.paste(true);
    assertThat(buffer.fullText()).isEqualTo("abX");

    buffer.moveCursor(Location.origin());
    executor.paste(false);
    assertThat(buffer.fullText()).isEqualTo("XabX");
  }

  @Test
  @DisplayName("Linewise P opens the line above and leaves the cursor on it")
  void paste_LinewiseAbove() {
    load("one\ntwo");
    register.store("new\n", true);
    buffer.moveCursor(Location.of(1, 2));

    executor.paste(false);

    assertThat(buffer.fullText()).isEqualTo("one\nnew\ntwo");
    assertThat(buffer.cursorLocation()).isEqualTo(Location.of(1, 0));
  }

  @Test
  @DisplayName("Linewise p below the last line adds a line break first")
  void paste_LinewiseBelowLastLine() {
    load("one");
    register.store("two", true);

    executor.paste(true);

    assertThat(buffer.fullText()).isEqualTo("one\ntwo");
    assertThat(buffer.cursorLocation()).isEqualTo(Location.of(1, 0));
  }

  @Test
  @DisplayName("Replace keeps the cursor and refuses at line end")
  void replaceCharacter() {
    load("abc");
    buffer.moveCursor(Location.of(0, 1));

    assertThat(executor.replaceCharacter('Z')).isTrue();
    assertThat(buffer.fullText()).isEqualTo("aZc");
    assertThat(buffer.cursorLocation()).isEqualTo(Location.of(0, 1));

    buffer.moveCursor(Location.of(0, 3));
    assertThat(executor.hasCharacterUnderCursor()).isFalse();
    assertThat(executor.replaceCharacter('Q')).isFalse();
    assertThat(buffer.fullText()).isEqualTo("aZc");
  }

  @Test
  @DisplayName("Join merges with the next line and does nothing on the last line")
  void joinLines() {
    load("ab\ncd");

    assertThat(executor.joinLines()).isTrue();
    assertThat(buffer.fullText()).isEqualTo("ab cd");
    assertThat(executor.canJoinLines()).isFalse();
    assertThat(executor.joinLines()).isFalse();
  }

  @Test
  @DisplayName("An anchor past the line end does not pull the line break into the selection")
  void applyToSelection_AnchorPastLineEnd() {
    load("ab\ncd");
    buffer.select(Location.of(0, 2), Location.of(0, 0));

    executor.applyToSelection(Operator.DELETE);

    assertThat(register.text()).isEqualTo("ab");
    assertThat(buffer.fullText()).isEqualTo("\ncd");
  }

  @Test
  @DisplayName("An active end past the line end takes the line break")
  void applyToSelection_ActivePastLineEnd() {
    load("ab\ncd");
    buffer.select(Location.of(0, 0), Location.of(0, 2));

    executor.applyToSelection(Operator.YANK);

    assertThat(register.text()).isEqualTo("ab\n");
  }
}
