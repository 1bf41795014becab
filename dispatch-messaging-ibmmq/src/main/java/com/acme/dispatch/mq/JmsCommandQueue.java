package com.acme.dispatch.mq;

import com.acme.dispatch.core.TransientException;
import com.acme.dispatch.spi.CommandQueue;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends replies over one shared connection. Listener threads each keep a session and an anonymous
 * producer, created on their first send and dropped after a failed one.
 */
@Singleton
@Requires(property = "dispatch.jms.enabled", value = "true")
public class JmsCommandQueue implements CommandQueue {
  private static final Logger LOG = LoggerFactory.getLogger(JmsCommandQueue.class);
  static final String HEADER_CORRELATION_ID = "correlationId";

  private final Connection connection;
  private final ThreadLocal<ReplySession> sessions = new ThreadLocal<>();

  public JmsCommandQueue(@Named("mqConnectionFactory") ConnectionFactory cf) {
    try {
      connection = cf.createConnection();
      connection.start();
    } catch (JMSException e) {
      throw new TransientException("Failed to initialize JMS connection", e);
    }
    LOG.info("JMS reply connection started");
  }

  @Override
  public void send(String queue, String body, Map<String, String> headers) {
    ReplySession reply = currentSession();
    try {
      TextMessage message = reply.session.createTextMessage(body);
      copyHeaders(message, headers == null ? Map.of() : headers);
      reply.producer.send(reply.session.createQueue(queue), message);
    } catch (JMSException e) {
      sessions.remove();
      reply.close();
      LOG.error("Reply to {} failed", queue, e);
      throw new TransientException("Failed to send message to queue: " + queue, e);
    }
  }

  private static void copyHeaders(TextMessage message, Map<String, String> headers)
      throws JMSException {
    for (Map.Entry<String, String> header : headers.entrySet()) {
      String name = header.getKey();
      if (HEADER_CORRELATION_ID.equals(name)) {
        message.setJMSCorrelationID(header.getValue());
      }
      // reserved by the JMS provider
      if (!name.startsWith("JMS_IBM_") && !name.startsWith("JMSX")) {
        message.setStringProperty(name, header.getValue());
      }
    }
  }

  private ReplySession currentSession() {
    ReplySession reply = sessions.get();
    if (reply == null) {
      try {
        reply = new ReplySession(connection.createSession(false, Session.AUTO_ACKNOWLEDGE));
      } catch (JMSException e) {
        throw new TransientException("Failed to create JMS session", e);
      }
      sessions.set(reply);
      LOG.debug("Opened reply session on {}", Thread.currentThread().getName());
    }
    return reply;
  }

  @PreDestroy
  void shutdown() {
    try {
      connection.close();
      LOG.info("JMS reply connection closed");
    } catch (JMSException e) {
      LOG.warn("Error closing JMS reply connection", e);
    }
  }

  private static final class ReplySession {
    final Session session;
    final MessageProducer producer;

    ReplySession(Session session) throws JMSException {
      this.session = session;
      this.producer = session.createProducer(null);
    }

    void close() {
      try {
        session.close();
      } catch (JMSException e) {
        LOG.debug("Ignoring failure closing a broken reply session", e);
      }
    }
  }
}
