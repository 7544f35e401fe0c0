package com.consullo.vimode.engine;

import org.apache.commons.lang3.Validate;

/**
 * Vi engine configuration values.
 *
 * @param enabled if false, the engine passes every key through to the host
 * @param initialMode mode the engine starts in
 * @param maxCount upper bound for count prefixes such as {@code 12j}
 * @since 1.0
 */
public record ViEngineConfig(
    boolean enabled,
    Mode initialMode,
    int maxCount) {

  public ViEngineConfig {
    Validate.notNull(initialMode, "initialMode must not be null");
    Validate.isTrue(initialMode != Mode.VISUAL, "initialMode must be INSERT or NORMAL");
    Validate.isTrue(maxCount > 0, "maxCount must be positive");
  }

  /**
   * Returns the defaults: enabled, starting in Insert mode, counts capped at 10,000.
   *
   * @return default configuration
   */
  public static ViEngineConfig defaults() {
    return new ViEngineConfig(true, Mode.INSERT, 10_000);
  }
}
