package com.acme.dispatch.mq;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.CommandEnvelope;
import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Transport;
import com.acme.dispatch.core.ErrorCodes;
import com.acme.dispatch.core.Jsons;
import com.acme.dispatch.core.PermanentException;
import com.acme.dispatch.spi.CommandQueue;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for JMS command consumers. Turns a message into a command envelope, dispatches it over
 * {@link Transport#QUEUE} and sends the result to the reply queue.
 *
 * <p>The body is either {@code {"data": {...}, "correlation_id": "..."}} or the bare data map. The
 * correlation id is taken from the body, then the {@code correlationId} property, then the JMS
 * correlation id.
 */
public abstract class BaseCommandConsumer {
  private static final Logger log = LoggerFactory.getLogger(BaseCommandConsumer.class);

  static final String HEADER_CORRELATION_ID = "correlationId";
  static final String HEADER_OPERATION = "operation";
  static final String HEADER_STATUS = "status";
  static final String STATUS_SUCCEEDED = "SUCCEEDED";
  static final String STATUS_FAILED = "FAILED";

  private final CommandDispatcher dispatcher;
  private final CommandQueue commandQueue;
  private final String replyQueue;

  protected BaseCommandConsumer(
      CommandDispatcher dispatcher, CommandQueue commandQueue, String replyQueue) {
    this.dispatcher = dispatcher;
    this.commandQueue = commandQueue;
    this.replyQueue = replyQueue;
  }

  protected void processCommand(String operation, String body, Message m) throws JMSException {
    log.info("Received {} command", operation);

    Map<String, Object> value;
    try {
      value = Jsons.toMap(body);
    } catch (PermanentException e) {
      log.warn("Rejecting {} command with unparseable body", operation, e);
      String correlationId = headerCorrelationId(m);
      sendReply(
          operation,
          correlationId != null ? correlationId : UUID.randomUUID().toString(),
          CommandResult.failure(ErrorCodes.VALIDATION_ERROR, "Message body is not a JSON object"));
      return;
    }

    Object bodyCorrelation = value.get(ContextKeys.CORRELATION_ID);
    String correlationId =
        bodyCorrelation != null ? bodyCorrelation.toString() : headerCorrelationId(m);

    Map<String, Object> context = new HashMap<>();
    if (m.getJMSDestination() != null) {
      context.put(ContextKeys.QUEUE, m.getJMSDestination().toString());
    }
    context.put(ContextKeys.MESSAGE_ID, m.getJMSMessageID());
    if (correlationId != null) {
      context.put(ContextKeys.CORRELATION_ID, correlationId);
    }

    CommandEnvelope envelope =
        CommandEnvelope.of(operation, Transport.QUEUE, payloadOf(value), context);
    CommandResult result = dispatcher.dispatch(envelope);

    log.info(
        "Command processed: operation={} correlationId={} success={}",
        operation,
        envelope.correlationId(),
        result.success());
    sendReply(operation, envelope.correlationId(), result);
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> payloadOf(Map<String, Object> value) {
    Object data = value.get("data");
    return data instanceof Map ? (Map<String, Object>) data : value;
  }

  private static String headerCorrelationId(Message m) throws JMSException {
    String property = m.getStringProperty(HEADER_CORRELATION_ID);
    if (property != null && !property.isBlank()) {
      return property;
    }
    String jmsCorrelation = m.getJMSCorrelationID();
    return jmsCorrelation != null && !jmsCorrelation.isBlank() ? jmsCorrelation : null;
  }

  private void sendReply(String operation, String correlationId, CommandResult result) {
    try {
      Map<String, String> headers =
          Map.of(
              HEADER_CORRELATION_ID, correlationId,
              HEADER_OPERATION, operation,
              HEADER_STATUS, result.success() ? STATUS_SUCCEEDED : STATUS_FAILED);

      commandQueue.send(replyQueue, result.toJson(), headers);

      log.debug("Sent reply to {}: correlationId={}", replyQueue, correlationId);
    } catch (RuntimeException e) {
      log.error("Failed to send reply: operation={} correlationId={}", operation, correlationId, e);
    }
  }
}
