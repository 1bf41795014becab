package com.acme.dispatch.kafka;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Transport;
import com.acme.dispatch.core.ErrorCodes;
import com.acme.dispatch.core.Jsons;
import com.acme.dispatch.core.PermanentException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;

/**
 * Stream transport. Polls the mapped command topics on a dedicated thread, dispatches each record
 * over {@link Transport#STREAM} and publishes the result to {@code <topic>.results}.
 *
 * <p>Records are processed sequentially, which keeps per-partition order. Offsets are committed
 * synchronously once every record of a batch has been dispatched.
 */
@Slf4j
@Singleton
@Requires(property = "dispatch.kafka.enabled", value = "true")
public class KafkaCommandConsumer implements ApplicationEventListener<StartupEvent> {

  static final String RESULTS_SUFFIX = ".results";

  private final Consumer<String, String> consumer;
  private final Producer<String, String> producer;
  private final CommandDispatcher dispatcher;
  private final Map<String, String> topicOperations;
  private final Duration pollTimeout;
  private final Duration publishTimeout;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private Thread pollThread;

  public KafkaCommandConsumer(
      Consumer<String, String> consumer,
      Producer<String, String> producer,
      CommandDispatcher dispatcher,
      KafkaSettings settings) {
    this.consumer = consumer;
    this.producer = producer;
    this.dispatcher = dispatcher;
    this.topicOperations = settings.topicOperations();
    this.pollTimeout = settings.getPollTimeout();
    this.publishTimeout = settings.getPublishTimeout();
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    start();
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    consumer.subscribe(topicOperations.keySet());
    pollThread = new Thread(this::pollLoop, "kafka-command-consumer");
    pollThread.setDaemon(true);
    pollThread.start();
    log.info("Kafka command consumer started for topics {}", topicOperations.keySet());
  }

  @PreDestroy
  public synchronized void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    consumer.wakeup();
    try {
      pollThread.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("Kafka command consumer stopped");
  }

  public boolean isRunning() {
    return running.get();
  }

  private void pollLoop() {
    try {
      while (running.get()) {
        try {
          pollOnce();
        } catch (WakeupException e) {
          if (running.get()) {
            throw e;
          }
        } catch (RuntimeException e) {
          log.error("Error in Kafka poll loop", e);
        }
      }
    } finally {
      // KafkaConsumer is single-threaded: it must be closed by the thread that polls it
      consumer.close();
    }
  }

  /**
   * Poll one batch, dispatch every record in order and commit. A record that fails unexpectedly
   * gets an {@code INTERNAL_ERROR} result and does not hold back the rest of the batch.
   *
   * @return number of records polled
   */
  int pollOnce() {
    ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
    for (ConsumerRecord<String, String> record : records) {
      try {
        handle(record);
      } catch (RuntimeException e) {
        log.error(
            "Failed to handle {} partition={} offset={}",
            record.topic(),
            record.partition(),
            record.offset(),
            e);
        publishResult(
            record.topic(),
            record.key(),
            CommandResult.failure(
                ErrorCodes.INTERNAL_ERROR, CommandDispatcher.UNEXPECTED_ERROR_MESSAGE));
      }
    }
    if (!records.isEmpty()) {
      consumer.commitSync();
    }
    return records.count();
  }

  void handle(ConsumerRecord<String, String> record) {
    String operation = topicOperations.get(record.topic());
    if (operation == null) {
      log.warn(
          "No operation mapped for topic {}, skipping offset {}", record.topic(), record.offset());
      return;
    }
    log.debug(
        "Received {} partition={} offset={} key={}",
        record.topic(),
        record.partition(),
        record.offset(),
        record.key());

    Map<String, Object> value;
    try {
      value = Jsons.toMap(record.value());
    } catch (PermanentException e) {
      log.warn("Unparseable message on {} offset={}", record.topic(), record.offset(), e);
      publishResult(
          record.topic(),
          record.key(),
          CommandResult.failure(ErrorCodes.VALIDATION_ERROR, "Message value is not a JSON object"));
      return;
    }

    Object suppliedCorrelation = value.get(ContextKeys.CORRELATION_ID);
    String correlationId =
        suppliedCorrelation != null ? suppliedCorrelation.toString() : record.key();

    Map<String, Object> context = new HashMap<>();
    context.put(ContextKeys.TOPIC, record.topic());
    context.put(ContextKeys.KEY, record.key());
    context.put(ContextKeys.PARTITION, record.partition());
    context.put(ContextKeys.OFFSET, record.offset());
    if (correlationId != null) {
      context.put(ContextKeys.CORRELATION_ID, correlationId);
    }

    CommandResult result =
        dispatcher.dispatch(operation, Transport.STREAM, payloadOf(value), context);
    publishResult(record.topic(), correlationId, result);
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> payloadOf(Map<String, Object> value) {
    Object data = value.get("data");
    return data instanceof Map ? (Map<String, Object>) data : value;
  }

  private void publishResult(String topic, String key, CommandResult result) {
    String resultTopic = topic + RESULTS_SUFFIX;
    try {
      producer
          .send(new ProducerRecord<>(resultTopic, key, result.toJson()))
          .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Published result to {} key={} success={}", resultTopic, key, result.success());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while publishing result to {} key={}", resultTopic, key);
    } catch (ExecutionException | TimeoutException | RuntimeException e) {
      log.warn("Could not publish result to {} key={}", resultTopic, key, e);
    }
  }
}
