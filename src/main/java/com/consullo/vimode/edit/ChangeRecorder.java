package com.consullo.vimode.edit;

import java.util.Optional;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the last mutating command and replays it on demand.
 *
 * <p>Recording is suspended while a replay runs, so {@code .} always repeats the original edit.
 *
 * @since 1.0
 */
public final class ChangeRecorder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChangeRecorder.class);

  private LastChange lastChange;
  private boolean replaying;

  /**
   * Records {@code change} as the last change, unless a replay is running.
   *
   * @param change change
   */
  public void record(final LastChange change) {
    Validate.notNull(change, "change must not be null");
    if (replaying) {
      return;
    }
    this.lastChange = change;
  }

  public Optional<LastChange> lastChange() {
    return Optional.ofNullable(lastChange);
  }

  public boolean isReplaying() {
    return replaying;
  }

  /**
   * Runs {@code executor} on the last change, if there is one.
   *
   * @param executor performs one change
   * @return true if a change was replayed
   */
  public boolean replay(final Consumer<LastChange> executor) {
    Validate.notNull(executor, "executor must not be null");
    if (lastChange == null) {
      return false;
    }
    LOGGER.debug("replay: {}", lastChange);
    replaying = true;
    try {
      executor.accept(lastChange);
    } finally {
      replaying = false;
    }
    return true;
  }
}
