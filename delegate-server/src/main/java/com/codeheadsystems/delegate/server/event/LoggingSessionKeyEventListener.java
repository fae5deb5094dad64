package com.codeheadsystems.delegate.server.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the audit log at INFO.
 */
public class LoggingSessionKeyEventListener implements SessionKeyEventListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingSessionKeyEventListener.class);

  @Override
  public void onEvent(SessionKeyEvent event) {
    log.info("AUDIT type={} account={} event={}", event.type(), event.accountId(), event);
  }
}
