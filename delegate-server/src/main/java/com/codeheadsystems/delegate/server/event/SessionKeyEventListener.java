package com.codeheadsystems.delegate.server.event;

/**
 * Receives session key events. Called synchronously while the affected record is still locked,
 * so implementations must be quick and must not call back into the manager for the same key.
 */
@FunctionalInterface
public interface SessionKeyEventListener {

  /**
   * On event.
   *
   * @param event the event
   */
  void onEvent(SessionKeyEvent event);
}
