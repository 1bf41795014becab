package com.acme.dispatch.mq;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.Operations;
import com.acme.dispatch.spi.CommandQueue;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSListener;
import io.micronaut.jms.annotations.Message;
import io.micronaut.jms.annotations.Queue;
import io.micronaut.messaging.annotation.MessageBody;
import jakarta.jms.JMSException;

/**
 * JMS listener for the queue-enabled operations
 */
@Requires(property = "dispatch.jms.enabled", value = "true")
@JMSListener("mqConnectionFactory")
public class DispatchCommandConsumer extends BaseCommandConsumer {

  public DispatchCommandConsumer(
      CommandDispatcher dispatcher, CommandQueue commandQueue, JmsSettings settings) {
    super(dispatcher, commandQueue, settings.getReplyQueue());
  }

  @Queue(JmsSettings.CREATE_USER_QUEUE)
  public void onCreateUser(@MessageBody String body, @Message jakarta.jms.Message m)
      throws JMSException {
    processCommand(Operations.CREATE_USER, body, m);
  }

  @Queue(JmsSettings.PROCESS_PAYMENT_QUEUE)
  public void onProcessPayment(@MessageBody String body, @Message jakarta.jms.Message m)
      throws JMSException {
    processCommand(Operations.PROCESS_PAYMENT, body, m);
  }
}
