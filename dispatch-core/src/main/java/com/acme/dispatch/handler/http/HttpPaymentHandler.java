package com.acme.dispatch.handler.http;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.ProcessPaymentCommand;
import com.acme.dispatch.application.usecase.ProcessPaymentUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

public class HttpPaymentHandler extends AbstractCommandHandler {
  private final ProcessPaymentUseCase processPayment;

  public HttpPaymentHandler(ProcessPaymentUseCase processPayment) {
    this.processPayment = processPayment;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return processPayment
        .execute(CommandPayloads.bind(fields, ProcessPaymentCommand.class))
        .toMap();
  }
}
