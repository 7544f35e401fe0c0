package com.consullo.vimode.engine;

import com.consullo.vimode.buffer.Location;
import com.consullo.vimode.buffer.TextBuffer;
import com.consullo.vimode.edit.ChangeRecorder;
import com.consullo.vimode.edit.LastChange;
import com.consullo.vimode.edit.OperatorExecutor;
import com.consullo.vimode.edit.YankRegister;
import com.consullo.vimode.engine.events.ModeChangeEvent;
import com.consullo.vimode.engine.events.ModeChangeListener;
import com.consullo.vimode.motion.MotionResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vi-style key handling for one text-input widget.
 *
 * <p>
 * The host delivers every key press to {@link #handleKey(Key)} and performs its default handling (text
 * insertion, cursor keys) only when this returns false:
 * <ul>
 * <li>Insert mode: only Escape is consumed; it switches to Normal mode.</li>
 * <li>Normal mode: every key is consumed by the Normal grammar; unknown keys are no-ops.</li>
 * <li>Visual mode: every key is consumed by the Visual grammar.</li>
 * </ul>
 * </p>
 *
 * <p>
 * One engine instance owns its mode and composition state exclusively. Calls must be made from a single
 * thread, in key arrival order. Key handling never throws to the host.
 * </p>
 *
 * @since 1.0
 */
public final class ViEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ViEngine.class);

  private final TextBuffer buffer;
  private final ViEngineConfig config;

  private final PendingComposition pending = new PendingComposition();
  private final YankRegister register = new YankRegister();
  private final ChangeRecorder recorder = new ChangeRecorder();
  private final MotionResolver resolver;
  private final OperatorExecutor executor;
  private final NormalModeGrammar normalGrammar;
  private final VisualModeGrammar visualGrammar;

  private final List<ModeChangeListener> listeners = new ArrayList<>();

  private Mode mode;
  private boolean enabled;

  /**
   * Creates an engine over {@code buffer} with default configuration.
   *
   * @param buffer text buffer to drive
   */
  public ViEngine(final TextBuffer buffer) {
    this(buffer, ViEngineConfig.defaults());
  }

  /**
   * Creates an engine over {@code buffer}.
   *
   * @param buffer text buffer to drive
   * @param config configuration
   */
  public ViEngine(final TextBuffer buffer, final ViEngineConfig config) {
    Validate.notNull(buffer, "buffer must not be null");
    Validate.notNull(config, "config must not be null");
    this.buffer = buffer;
    this.config = config;
    this.mode = config.enabled() ? config.initialMode() : Mode.INSERT;
    this.enabled = config.enabled();
    this.resolver = new MotionResolver(buffer);
    this.executor = new OperatorExecutor(buffer, resolver, register);
    this.normalGrammar = new NormalModeGrammar(this);
    this.visualGrammar = new VisualModeGrammar(this);
  }

  /**
   * Handles a key given as the host's (key id, literal character) pair.
   *
   * @param keyId host key identifier, e.g. "escape" or "ctrl+r"
   * @param literal printable character, or null for pure control keys
   * @return true if consumed; false means the host should apply its default handling
   */
  public boolean handleKey(final String keyId, final Character literal) {
    return handleKey(Key.of(keyId, literal));
  }

  /**
   * Handles one key press.
   *
   * @param key key
   * @return true if consumed; false means the host should apply its default handling
   */
  public boolean handleKey(final Key key) {
    Validate.notNull(key, "key must not be null");
    if (!enabled) {
      return false;
    }
    try {
      switch (mode) {
        case INSERT:
          return handleInsertKey(key);
        case NORMAL:
          return normalGrammar.handle(key);
        case VISUAL:
          return visualGrammar.handle(key);
        default:
          throw new IllegalStateException("Unhandled mode: " + mode);
      }
    } catch (RuntimeException e) {
      // Key handling never throws to the host.
      LOGGER.warn("handleKey: {} failed in {} mode: {}", key, mode, e.getMessage(), e);
      pending.clear();
      return true;
    }
  }

  private boolean handleInsertKey(Key key) {
    if (!key.is(ControlKey.ESCAPE)) {
      return false;
    }
    setMode(Mode.NORMAL);
    pending.clear();
    Location at = buffer.cursorLocation();
    if (at.column() > 0) {
      buffer.moveCursor(new Location(at.row(), at.column() - 1));
    }
    return true;
  }

  /**
   * Returns the current mode.
   *
   * @return mode
   */
  public Mode mode() {
    return mode;
  }

  /**
   * Returns true while a command is partially typed (count, operator, awaited character or {@code g}).
   *
   * @return true if composing
   */
  public boolean isComposing() {
    return !pending.isClear();
  }

  /**
   * Returns the unnamed register. The host can read it; only yank and delete commands write it.
   *
   * @return register
   */
  public YankRegister register() {
    return register;
  }

  /**
   * Returns the change that {@code .} would repeat.
   *
   * @return last change, empty before the first mutating command
   */
  public Optional<LastChange> lastChange() {
    return recorder.lastChange();
  }

  /**
   * Returns false while vi handling is switched off and every key passes through.
   *
   * @return true if enabled
   */
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Turns vi handling on or off. Turning it off discards any composition and returns to Insert mode, so
   * the widget behaves like a plain text input.
   *
   * @param enabled true to enable
   */
  public void setEnabled(final boolean enabled) {
    if (this.enabled == enabled) {
      return;
    }
    LOGGER.debug("setEnabled: {}", enabled);
    pending.clear();
    if (!enabled) {
      setMode(Mode.INSERT);
    }
    this.enabled = enabled;
  }

  /**
   * Registers a listener notified once per mode transition.
   *
   * @param listener listener
   */
  public void addModeChangeListener(final ModeChangeListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  /**
   * Unregisters a listener. Unknown listeners are ignored.
   *
   * @param listener listener
   */
  public void removeModeChangeListener(final ModeChangeListener listener) {
    listeners.remove(listener);
  }

  /**
   * Switches mode and notifies listeners. A switch to the current mode does nothing.
   */
  void setMode(Mode next) {
    if (next == mode) {
      return;
    }
    Mode previous = mode;
    mode = next;
    LOGGER.debug("mode: {} -> {}", previous, next);
    ModeChangeEvent event = ModeChangeEvent.transition(previous, next);
    for (ModeChangeListener listener : new ArrayList<>(listeners)) {
      try {
        listener.onModeChanged(event);
      } catch (RuntimeException e) {
        LOGGER.warn("Mode change listener failed: {}", e.getMessage(), e);
      }
    }
  }

  TextBuffer buffer() {
    return buffer;
  }

  ViEngineConfig config() {
    return config;
  }

  PendingComposition pending() {
    return pending;
  }

  ChangeRecorder recorder() {
    return recorder;
  }

  MotionResolver resolver() {
    return resolver;
  }

  OperatorExecutor executor() {
    return executor;
  }
}
