package com.consullo.vimode.engine;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.edit.LastChange;
import com.consullo.vimode.edit.Operator;
import com.consullo.vimode.edit.OperatorExecutor;
import com.consullo.vimode.motion.CharMotion;
import com.consullo.vimode.motion.Motion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normal-mode key grammar.
 *
 * <p>
 * Keys are interpreted in priority order:
 * <ol>
 * <li>second key of {@code gg};</li>
 * <li>target character of {@code f/F/t/T/r};</li>
 * <li>count digits ({@code 0} only continues a count);</li>
 * <li>completion of a pending operator: doubled ({@code dd}), motion ({@code dw}), or cancel;</li>
 * <li>mode switches, navigation, arming keys, standalone edits, paste, undo/redo, repeat.</li>
 * </ol>
 * Every branch that completes, cancels or ignores a command clears the pending composition.
 * </p>
 */
final class NormalModeGrammar {

  private static final Logger LOGGER = LoggerFactory.getLogger(NormalModeGrammar.class);

  /**
   * Outcome of one key: the composition continues, or the command is over and pending state is cleared.
   */
  private enum Step {
    COMPOSING,
    COMPLETE
  }

  private final ViEngine engine;
  private final TextBuffer buffer;
  private final OperatorExecutor executor;
  private final PendingComposition pending;

  NormalModeGrammar(ViEngine engine) {
    this.engine = engine;
    this.buffer = engine.buffer();
    this.executor = engine.executor();
    this.pending = engine.pending();
  }

  boolean handle(Key key) {
    if (dispatch(key) == Step.COMPLETE) {
      pending.clear();
    }
    return true;
  }

  private Step dispatch(Key key) {
    if (pending.awaitingSecondG()) {
      if (key.is('g')) {
        engine.resolver().move(Motion.DOCUMENT_START);
      }
      return Step.COMPLETE;
    }

    CharMotion awaited = pending.awaitedCharMotion();
    if (awaited != null) {
      if (key.isCharacter()) {
        executeCharMotion(awaited, key.character());
      }
      return Step.COMPLETE;
    }

    if (key.isDigit() && (!key.is('0') || pending.hasCount())) {
      pending.appendDigit(key.character());
      return Step.COMPOSING;
    }

    Operator operator = pending.operator();
    if (operator != null) {
      completeOperator(operator, key);
      return Step.COMPLETE;
    }

    int count = pending.count(engine.config().maxCount());

    if (handleModeSwitch(key)) {
      return Step.COMPLETE;
    }

    Motion motion = navigationMotion(key);
    if (motion != null) {
      engine.resolver().move(motion, count);
      return Step.COMPLETE;
    }

    if (!key.isCharacter()) {
      return handleControl(key);
    }
    char c = key.character();

    if (c == 'g') {
      pending.awaitSecondG();
      return Step.COMPOSING;
    }

    CharMotion charMotion = CharMotion.forTrigger(c);
    if (charMotion != null) {
      pending.awaitCharMotion(charMotion);
      return Step.COMPOSING;
    }

    Operator armed = Operator.forTrigger(c);
    if (armed != null) {
      pending.operator(armed);
      return Step.COMPOSING;
    }

    switch (c) {
      case 'x':
        executeChange(LastChange.of(LastChange.Kind.DELETE_CHAR), count);
        break;
      case 'X':
        executeChange(LastChange.of(LastChange.Kind.DELETE_CHAR_BEFORE), count);
        break;
      case 'D':
        executeChange(LastChange.of(LastChange.Kind.DELETE_TO_LINE_END), 1);
        break;
      case 'C':
        executeChange(LastChange.of(LastChange.Kind.CHANGE_TO_LINE_END), 1);
        break;
      case 's':
        executeChange(LastChange.of(LastChange.Kind.SUBSTITUTE_CHAR), 1);
        break;
      case 'S':
        executeChange(LastChange.of(LastChange.Kind.SUBSTITUTE_LINE), 1);
        break;
      case 'J':
        if (executor.canJoinLines()) {
          executeChange(LastChange.of(LastChange.Kind.JOIN_LINES), 1);
        }
        break;
      case 'p':
        executor.paste(true);
        break;
      case 'P':
        executor.paste(false);
        break;
      case 'u':
        buffer.undo();
        break;
      case '.':
        engine.recorder().replay(this::perform);
        break;
      default:
        LOGGER.debug("Ignoring unbound key: {}", key);
        break;
    }
    return Step.COMPLETE;
  }

  private Step handleControl(Key key) {
    if (key.is(ControlKey.CTRL_R)) {
      buffer.redo();
    }
    return Step.COMPLETE;
  }

  private void completeOperator(Operator operator, Key key) {
    if (key.is(operator.trigger())) {
      if (operator == Operator.YANK) {
        executor.applyToLine(Operator.YANK);
      } else {
        executeChange(LastChange.of(operator == Operator.DELETE
            ? LastChange.Kind.DELETE_LINE
            : LastChange.Kind.CHANGE_LINE), 1);
      }
      return;
    }
    Motion motion = operatorMotion(key);
    if (motion == null) {
      LOGGER.debug("Cancelled {} composition on key {}", operator, key);
      return;
    }
    if (operator == Operator.YANK) {
      executor.applyToMotion(Operator.YANK, motion);
    } else {
      executeChange(LastChange.operatorMotion(operator, motion), 1);
    }
  }

  private boolean handleModeSwitch(Key key) {
    if (!key.isCharacter()) {
      return false;
    }
    switch (key.character()) {
      case 'i':
        break;
      case 'I':
        buffer.cursorLineStart();
        break;
      case 'a': {
        Location at = buffer.cursorLocation();
        if (at.column() < buffer.documentLine(at.row()).length()) {
          buffer.moveCursor(new Location(at.row(), at.column() + 1));
        }
        break;
      }
      case 'A':
        buffer.cursorLineEnd();
        break;
      case 'o':
        buffer.cursorLineEnd();
        buffer.insert("\n");
        break;
      case 'O':
        buffer.cursorLineStart();
        buffer.insert("\n");
        buffer.cursorUp();
        break;
      case 'v': {
        Location at = buffer.cursorLocation();
        buffer.select(at, at);
        engine.setMode(Mode.VISUAL);
        return true;
      }
      default:
        return false;
    }
    engine.setMode(Mode.INSERT);
    return true;
  }

  private void executeCharMotion(CharMotion motion, char target) {
    if (motion == CharMotion.REPLACE) {
      if (executor.hasCharacterUnderCursor()) {
        executeChange(LastChange.replace(target), 1);
      }
      return;
    }
    engine.resolver().findOnLine(motion, target);
  }

  /**
   * Performs {@code change} {@code times} times and records it as the last change.
   */
  private void executeChange(LastChange change, int times) {
    for (int i = 0; i < times; i++) {
      perform(change);
    }
    engine.recorder().record(change);
  }

  /**
   * Performs one change. Shared by first execution and {@code .} replay.
   */
  private void perform(LastChange change) {
    switch (change.kind()) {
      case DELETE_CHAR:
        buffer.deleteRight();
        break;
      case DELETE_CHAR_BEFORE:
        buffer.deleteLeft();
        break;
      case DELETE_TO_LINE_END:
        buffer.deleteToEndOfLine();
        break;
      case CHANGE_TO_LINE_END:
        buffer.deleteToEndOfLine();
        engine.setMode(Mode.INSERT);
        break;
      case SUBSTITUTE_CHAR:
        buffer.deleteRight();
        engine.setMode(Mode.INSERT);
        break;
      case SUBSTITUTE_LINE:
        buffer.cursorLineStart();
        buffer.deleteToEndOfLine();
        engine.setMode(Mode.INSERT);
        break;
      case DELETE_LINE:
        executor.applyToLine(Operator.DELETE);
        break;
      case CHANGE_LINE:
        executor.applyToLine(Operator.CHANGE);
        engine.setMode(Mode.INSERT);
        break;
      case DELETE_MOTION:
        executor.applyToMotion(Operator.DELETE, change.motion());
        break;
      case CHANGE_MOTION:
        executor.applyToMotion(Operator.CHANGE, change.motion());
        engine.setMode(Mode.INSERT);
        break;
      case REPLACE_CHAR:
        executor.replaceCharacter(change.replacement());
        break;
      case JOIN_LINES:
        executor.joinLines();
        break;
      default:
        throw new IllegalStateException("Unhandled change: " + change);
    }
  }

  private static Motion navigationMotion(Key key) {
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
      case 'e':
        return Motion.WORD_END;
      case '0':
        return Motion.LINE_START;
      case '$':
        return Motion.LINE_END;
      case '^':
        return Motion.FIRST_NON_BLANK;
      case 'G':
        return Motion.DOCUMENT_END;
      default:
        return null;
    }
  }

  private static Motion operatorMotion(Key key) {
    if (!key.isCharacter()) {
      return null;
    }
    switch (key.character()) {
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
