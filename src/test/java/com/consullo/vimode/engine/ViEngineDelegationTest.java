package com.consullo.vimode.engine;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.engine.events.ModeChangeEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

/**
 * Verifies what the engine asks of the buffer contract, using a mocked {@link TextBuffer}.
 *
 * @since 1.0
 */
public class ViEngineDelegationTest {

  @Test
  @DisplayName("u and Ctrl-R delegate to the buffer's undo and redo")
  void handleKey_UndoRedo_Delegates() {
    TextBuffer buffer = mock(TextBuffer.class);
    when(buffer.cursorLocation()).thenReturn(Location.of(0, 0));
    ViEngine engine = new ViEngine(buffer, new ViEngineConfig(true, Mode.NORMAL, 100));

    engine.handleKey(Key.character('u'));
    engine.handleKey(Key.control(ControlKey.CTRL_R));

    verify(buffer).undo();
    verify(buffer).redo();
  }

  @Test
  @DisplayName("Escape at column 0 does not move the cursor")
  void handleKey_EscapeAtColumnZero_DoesNotMove() {
    TextBuffer buffer = mock(TextBuffer.class);
    when(buffer.cursorLocation()).thenReturn(Location.of(3, 0));
    ViEngine engine = new ViEngine(buffer);

    assertThat(engine.handleKey(Key.control(ControlKey.ESCAPE))).isTrue();

    verify(buffer, never()).moveCursor(any());
    assertThat(engine.mode()).isEqualTo(Mode.NORMAL);
  }

  @Test
  @DisplayName("Escape past column 0 moves the cursor one column left")
  void handleKey_Escape_StepsLeft() {
    TextBuffer buffer = mock(TextBuffer.class);
    when(buffer.cursorLocation()).thenReturn(Location.of(3, 4));
    ViEngine engine = new ViEngine(buffer);

    engine.handleKey(Key.control(ControlKey.ESCAPE));

    verify(buffer).moveCursor(Location.of(3, 3));
  }

  @Test
  @DisplayName("Insert-mode keys other than Escape never touch the buffer")
  void handleKey_InsertMode_LeavesBufferAlone() {
    TextBuffer buffer = mock(TextBuffer.class);
    ViEngine engine = new ViEngine(buffer);

    engine.handleKey(Key.character('d'));
    engine.handleKey(Key.control(ControlKey.BACKSPACE));

    verifyNoInteractions(buffer);
  }

  @Test
  @DisplayName("A failing buffer is logged and the key is still reported as consumed")
  void handleKey_BufferFails_DoesNotThrow() {
    TextBuffer buffer = mock(TextBuffer.class);
    when(buffer.cursorLocation()).thenThrow(new IllegalStateException("widget gone"));
    ViEngine engine = new ViEngine(buffer, new ViEngineConfig(true, Mode.NORMAL, 100));
    engine.handleKey(Key.character('3'));

    assertThatCode(() -> assertThat(engine.handleKey(Key.character('a'))).isTrue())
        .doesNotThrowAnyException();
    assertThat(engine.isComposing()).isFalse();
  }

  @Test
  @DisplayName("A throwing listener does not stop the others")
  void setMode_ListenerThrows_OthersStillNotified() {
    TextBuffer buffer = mock(TextBuffer.class);
    when(buffer.cursorLocation()).thenReturn(Location.of(0, 0));
    ViEngine engine = new ViEngine(buffer);
    List<ModeChangeEvent> events = new ArrayList<>();
    engine.addModeChangeListener(event -> {
      throw new IllegalStateException("listener bug");
    });
    engine.addModeChangeListener(events::add);

    engine.handleKey(Key.control(ControlKey.ESCAPE));

    assertThat(events).hasSize(1);
    assertThat(events.get(0).current()).isEqualTo(Mode.NORMAL);
  }
}
