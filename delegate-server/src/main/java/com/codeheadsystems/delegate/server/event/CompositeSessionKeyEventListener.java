package com.codeheadsystems.delegate.server.event;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans an event out to several listeners in order. A failing listener is logged and does not
 * stop delivery to the ones after it.
 */
public class CompositeSessionKeyEventListener implements SessionKeyEventListener {

  private static final Logger log = LoggerFactory.getLogger(CompositeSessionKeyEventListener.class);

  private final List<SessionKeyEventListener> listeners;

  public CompositeSessionKeyEventListener(List<SessionKeyEventListener> listeners) {
    this.listeners = List.copyOf(listeners);
  }

  @Override
  public void onEvent(SessionKeyEvent event) {
    for (SessionKeyEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        log.error("Listener {} failed on {} for account {}",
            listener.getClass().getSimpleName(), event.type(), event.accountId(), e);
      }
    }
  }
}
