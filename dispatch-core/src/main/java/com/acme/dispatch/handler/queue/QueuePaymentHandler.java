package com.acme.dispatch.handler.queue;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.ProcessPaymentCommand;
import com.acme.dispatch.application.usecase.ProcessPaymentUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

public class QueuePaymentHandler extends AbstractCommandHandler {
  private final ProcessPaymentUseCase processPayment;

  public QueuePaymentHandler(ProcessPaymentUseCase processPayment) {
    this.processPayment = processPayment;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    log.debug(
        "Process payment from queue {} message {}",
        context.get(ContextKeys.QUEUE),
        context.get(ContextKeys.MESSAGE_ID));
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return processPayment
        .execute(CommandPayloads.bind(fields, ProcessPaymentCommand.class))
        .toMap();
  }
}
