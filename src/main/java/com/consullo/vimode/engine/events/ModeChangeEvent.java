package com.consullo.vimode.engine.events;

import com.consullo.vimode.engine.Mode;
import java.time.Instant;

/**
 * Emitted when the engine moves from one mode to a different one. Self-transitions are never emitted.
 *
 * @param timestampUtc event timestamp in UTC
 * @param previous mode before the transition
 * @param current mode after the transition
 * @since 1.0
 */
public record ModeChangeEvent(
    Instant timestampUtc,
    Mode previous,
    Mode current) {

  /**
   * Creates an event stamped with the current time.
   *
   * @param previous previous mode
   * @param current new mode
   * @return event
   */
  public static ModeChangeEvent transition(Mode previous, Mode current) {
    return new ModeChangeEvent(Instant.now(), previous, current);
  }
}
