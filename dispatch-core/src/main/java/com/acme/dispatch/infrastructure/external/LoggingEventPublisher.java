package com.acme.dispatch.infrastructure.external;

import com.acme.dispatch.core.Jsons;
import com.acme.dispatch.spi.EventPublisher;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Event publisher for runs without a broker: events go to the log only. */
public class LoggingEventPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(LoggingEventPublisher.class);

  @Override
  public void publish(String eventType, Map<String, Object> data, String correlationId) {
    try {
      log.info("Event {} correlationId={} data={}", eventType, correlationId, Jsons.toJson(data));
    } catch (RuntimeException e) {
      log.warn("Could not render event {} correlationId={}", eventType, correlationId, e);
    }
  }
}
