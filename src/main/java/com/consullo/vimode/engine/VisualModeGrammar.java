package com.consullo.vimode.engine;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.edit.Operator;
import com.consullo.vimode.motion.Motion;

/**
 * Visual-mode key grammar. The selection anchor is fixed at the position where Visual mode was entered;
 * navigation moves only the active end.
 */
final class VisualModeGrammar {

  private final ViEngine engine;
  private final TextBuffer buffer;

  VisualModeGrammar(ViEngine engine) {
    this.engine = engine;
    this.buffer = engine.buffer();
  }

  boolean handle(Key key) {
    try {
      dispatch(key);
    } finally {
      engine.pending().clear();
    }
    return true;
  }

  private void dispatch(Key key) {
    if (key.is(ControlKey.ESCAPE) || key.is('v')) {
      buffer.moveCursor(buffer.selection().start());
      engine.setMode(Mode.NORMAL);
      return;
    }

    Motion motion = selectionMotion(key);
    if (motion != null) {
      Location anchor = buffer.selection().anchor();
      engine.resolver().move(motion);
      buffer.select(anchor, buffer.cursorLocation());
      return;
    }

    if (!key.isCharacter()) {
      return;
    }
    switch (key.character()) {
      case 'd':
      case 'x':
        engine.executor().applyToSelection(Operator.DELETE);
        engine.setMode(Mode.NORMAL);
        break;
      case 'c':
        engine.executor().applyToSelection(Operator.CHANGE);
        engine.setMode(Mode.INSERT);
        break;
      case 'y':
        engine.executor().applyToSelection(Operator.YANK);
        engine.setMode(Mode.NORMAL);
        break;
      default:
        break;
    }
  }

  private static Motion selectionMotion(Key key) {
    if (!key.isCharacter()) {
      switch (key.controlKey()) {
        case LEFT:
          return Motion.LEFT;
        case RIGHT:
          return Motion.RIGHT;
        case UP:
          return Motion.UP;
        case DOWN:
          return Motion.DOWN;
        default:
          return null;
      }
    }
    switch (key.character()) {
      case 'h':
        return Motion.LEFT;
      case 'l':
        return Motion.RIGHT;
      case 'j':
        return Motion.DOWN;
      case 'k':
        return Motion.UP;
      case 'w':
        return Motion.WORD_RIGHT;
      case 'b':
        return Motion.WORD_LEFT;
      case '$':
        return Motion.LINE_END;
      case '0':
        return Motion.LINE_START;
      default:
        return null;
    }
  }
}
