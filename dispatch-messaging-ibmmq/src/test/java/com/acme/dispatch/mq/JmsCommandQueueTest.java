package com.acme.dispatch.mq;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.dispatch.core.TransientException;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.MessageProducer;
import jakarta.jms.Queue;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JmsCommandQueue - replies to the reply queue")
class JmsCommandQueueTest {

  private ConnectionFactory connectionFactory;
  private Connection connection;
  private Session session;
  private MessageProducer producer;
  private Queue destination;
  private TextMessage textMessage;
  private JmsCommandQueue commandQueue;

  @BeforeEach
  void setUp() throws JMSException {
    connectionFactory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    session = mock(Session.class);
    producer = mock(MessageProducer.class);
    destination = mock(Queue.class);
    textMessage = mock(TextMessage.class);

    when(connectionFactory.createConnection()).thenReturn(connection);
    when(connection.createSession(false, Session.AUTO_ACKNOWLEDGE)).thenReturn(session);
    when(session.createProducer(null)).thenReturn(producer);
    when(session.createQueue("DISPATCH.CMD.REPLY.Q")).thenReturn(destination);
    when(session.createTextMessage(any())).thenReturn(textMessage);

    commandQueue = new JmsCommandQueue(connectionFactory);
  }

  @Test
  @DisplayName("Constructor - should start the connection but open no session yet")
  void testConstructor() throws JMSException {
    verify(connection).start();
    verify(connection, never()).createSession(false, Session.AUTO_ACKNOWLEDGE);
  }

  @Test
  @DisplayName("send - should map correlationId to the JMS correlation id and set properties")
  void testSendWithHeaders() throws JMSException {
    // Given
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("correlationId", "corr-123");
    headers.put("operation", "create_user");
    headers.put("status", "SUCCEEDED");

    // When
    commandQueue.send("DISPATCH.CMD.REPLY.Q", "{\"success\":true}", headers);

    // Then
    verify(textMessage).setJMSCorrelationID("corr-123");
    verify(textMessage).setStringProperty("correlationId", "corr-123");
    verify(textMessage).setStringProperty("operation", "create_user");
    verify(textMessage).setStringProperty("status", "SUCCEEDED");
    verify(producer).send(destination, textMessage);
  }

  @Test
  @DisplayName("send - should skip provider-reserved properties")
  void testSendSkipsReservedHeaders() throws JMSException {
    // When
    commandQueue.send(
        "DISPATCH.CMD.REPLY.Q", "{}", Map.of("JMS_IBM_Format", "MQSTR", "JMSXGroupID", "g"));

    // Then
    verify(textMessage, never()).setStringProperty(any(), any());
    verify(producer).send(destination, textMessage);
  }

  @Test
  @DisplayName("send - should reuse the session of the calling thread")
  void testSessionReuse() throws JMSException {
    // When
    commandQueue.send("DISPATCH.CMD.REPLY.Q", "{}", null);
    commandQueue.send("DISPATCH.CMD.REPLY.Q", "{}", null);

    // Then
    verify(connection, times(1)).createSession(false, Session.AUTO_ACKNOWLEDGE);
    verify(producer, times(2)).send(destination, textMessage);
  }

  @Test
  @DisplayName("send - should discard the session and throw when sending fails")
  void testSendFailure() throws JMSException {
    // Given
    doThrow(new JMSException("broken pipe"))
        .when(producer)
        .send(destination, textMessage);

    // When
    assertThatThrownBy(() -> commandQueue.send("DISPATCH.CMD.REPLY.Q", "{}", null))
        .isInstanceOf(TransientException.class)
        .hasMessageContaining("DISPATCH.CMD.REPLY.Q");

    // Then
    verify(session).close();
    reset(producer);
    commandQueue.send("DISPATCH.CMD.REPLY.Q", "{}", null);
    verify(connection, times(2)).createSession(false, Session.AUTO_ACKNOWLEDGE);
  }

  @Test
  @DisplayName("shutdown - should close the connection")
  void testShutdown() throws JMSException {
    commandQueue.shutdown();

    verify(connection).close();
  }

  @Test
  @DisplayName("Constructor - should wrap connection failures")
  void testConstructorFailure() throws JMSException {
    // Given
    ConnectionFactory failing = mock(ConnectionFactory.class);
    when(failing.createConnection()).thenThrow(new JMSException("no queue manager"));

    // When/Then
    assertThatThrownBy(() -> new JmsCommandQueue(failing))
        .isInstanceOf(TransientException.class)
        .hasMessageContaining("Failed to initialize JMS connection");
  }
}
