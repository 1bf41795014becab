package com.acme.dispatch.handler.http;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.RefundPaymentCommand;
import com.acme.dispatch.application.usecase.RefundPaymentUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

/** Refund of a completed payment; the payment id comes from the request path. */
public class HttpRefundPaymentHandler extends AbstractCommandHandler {
  private final RefundPaymentUseCase refundPayment;

  public HttpRefundPaymentHandler(RefundPaymentUseCase refundPayment) {
    this.refundPayment = refundPayment;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    Map<String, Object> fields =
        withContext(data, context, ContextKeys.PAYMENT_ID, ContextKeys.CORRELATION_ID);
    return refundPayment.execute(CommandPayloads.bind(fields, RefundPaymentCommand.class)).toMap();
  }
}
