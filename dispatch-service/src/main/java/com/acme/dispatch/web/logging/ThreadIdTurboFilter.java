package com.acme.dispatch.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Puts the id of the logging thread into the MDC so the pattern can show which worker, listener
 * or poll thread handled a command.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  static final String THREAD_ID_KEY = "threadId";

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    String threadId = String.valueOf(Thread.currentThread().getId());
    // pooled threads keep their MDC between events
    if (!threadId.equals(MDC.get(THREAD_ID_KEY))) {
      MDC.put(THREAD_ID_KEY, threadId);
    }
    return FilterReply.NEUTRAL;
  }
}
