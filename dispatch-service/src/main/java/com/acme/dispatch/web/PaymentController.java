package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Operations;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;

@Controller("/payments")
@ExecuteOn(TaskExecutors.BLOCKING)
public class PaymentController extends CommandController {

  public PaymentController(CommandDispatcher dispatcher) {
    super(dispatcher);
  }

  @Post
  public HttpResponse<Map<String, Object>> process(
      HttpRequest<?> request, @Body Map<String, Object> body) {
    return dispatch(
        request, Operations.PROCESS_PAYMENT, body, Map.of(ContextKeys.OPERATION, "process"));
  }

  /** The body is optional; a {@code reason} may be given. */
  @Post("/{id}/refund")
  public HttpResponse<Map<String, Object>> refund(
      HttpRequest<?> request, @PathVariable String id, @Nullable @Body Map<String, Object> body) {
    return dispatch(
        request,
        Operations.REFUND_PAYMENT,
        body,
        Map.of(ContextKeys.OPERATION, "refund", ContextKeys.PAYMENT_ID, id));
  }
}
