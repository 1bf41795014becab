package com.acme.dispatch.kafka;

import com.acme.dispatch.core.Jsons;
import com.acme.dispatch.spi.EventPublisher;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

/**
 * Publishes domain events to Kafka. The topic is chosen from the event type prefix, the record key
 * is the correlation id and the value is a JSON envelope.
 *
 * <p>Each publish blocks until the broker acknowledges the record or the publish timeout expires.
 * Failures are logged and never reach the caller.
 */
@Slf4j
@Singleton
@Requires(property = "dispatch.kafka.enabled", value = "true")
public class KafkaEventPublisher implements EventPublisher {

  static final String SOURCE = "dispatch-platform";
  static final String EVENT_TYPE_HEADER = "event_type";
  static final String GENERAL_TOPIC = "general.events";

  private final Producer<String, String> producer;
  private final Duration publishTimeout;

  public KafkaEventPublisher(Producer<String, String> producer, KafkaSettings settings) {
    this.producer = producer;
    this.publishTimeout = settings.getPublishTimeout();
  }

  @Override
  public void publish(String eventType, Map<String, Object> data, String correlationId) {
    String topic = topicFor(eventType);
    try {
      ProducerRecord<String, String> record =
          new ProducerRecord<>(topic, correlationId, envelope(eventType, data, correlationId));
      if (eventType != null) {
        record.headers().add(EVENT_TYPE_HEADER, eventType.getBytes(StandardCharsets.UTF_8));
      }

      RecordMetadata metadata =
          producer.send(record).get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info(
          "Published {} to {} partition={} offset={} correlationId={}",
          eventType,
          topic,
          metadata.partition(),
          metadata.offset(),
          correlationId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error(
          "Interrupted while publishing {} to {} correlationId={}",
          eventType,
          topic,
          correlationId,
          e);
    } catch (ExecutionException | TimeoutException | RuntimeException e) {
      log.error("Failed to publish {} to {} correlationId={}", eventType, topic, correlationId, e);
    }
  }

  /** Route by event type prefix: user.*, payment.* and notification.* have their own topics. */
  static String topicFor(String eventType) {
    if (eventType == null) {
      return GENERAL_TOPIC;
    }
    if (eventType.startsWith("user.")) {
      return "user.events";
    }
    if (eventType.startsWith("payment.")) {
      return "payment.events";
    }
    if (eventType.startsWith("notification.")) {
      return "notification.events";
    }
    return GENERAL_TOPIC;
  }

  static String envelope(String eventType, Map<String, Object> data, String correlationId) {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("event_type", eventType);
    event.put("data", data);
    event.put("correlation_id", correlationId);
    event.put("timestamp", Instant.now().toString());
    event.put("source", SOURCE);
    return Jsons.toJson(event);
  }
}
