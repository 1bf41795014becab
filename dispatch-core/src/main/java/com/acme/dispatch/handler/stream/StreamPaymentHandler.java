package com.acme.dispatch.handler.stream;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.ProcessPaymentCommand;
import com.acme.dispatch.application.usecase.ProcessPaymentUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

public class StreamPaymentHandler extends AbstractCommandHandler {
  private final ProcessPaymentUseCase processPayment;

  public StreamPaymentHandler(ProcessPaymentUseCase processPayment) {
    this.processPayment = processPayment;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    log.debug(
        "Process payment from {}-{}@{}",
        context.get(ContextKeys.TOPIC),
        context.get(ContextKeys.PARTITION),
        context.get(ContextKeys.OFFSET));
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return processPayment
        .execute(CommandPayloads.bind(fields, ProcessPaymentCommand.class))
        .toMap();
  }
}
