package com.github.automata;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default trace sink: writes every record to the log at debug level.
 */
public final class LoggingTransitionListener implements TransitionListener {
  private static final Logger logger =
      LogManager.getLogger(LoggingTransitionListener.class.getSimpleName());

  @Override
  public void onTransition(final TransitionRecord record) {
    if (logger.isDebugEnabled()) {
      logger.debug(record.toString());
    }
  }
}
