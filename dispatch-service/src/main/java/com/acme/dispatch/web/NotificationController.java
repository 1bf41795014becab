package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Operations;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;

@Controller("/notifications")
@ExecuteOn(TaskExecutors.BLOCKING)
public class NotificationController extends CommandController {

  public NotificationController(CommandDispatcher dispatcher) {
    super(dispatcher);
  }

  @Post
  public HttpResponse<Map<String, Object>> send(
      HttpRequest<?> request, @Body Map<String, Object> body) {
    return dispatch(
        request, Operations.SEND_NOTIFICATION, body, Map.of(ContextKeys.OPERATION, "send"));
  }
}
