package com.consullo.vimode.engine.events;

/**
 * Listener interface for mode transitions, typically used by a host to render a mode indicator.
 *
 * @since 1.0
 */
public interface ModeChangeListener {

  /**
   * Called once per real mode transition, on the thread that delivered the key.
   *
   * @param event transition event
   */
  void onModeChanged(ModeChangeEvent event);
}
