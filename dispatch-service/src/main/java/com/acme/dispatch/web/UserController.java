package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.Operations;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Put;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;

@Controller("/users")
@ExecuteOn(TaskExecutors.BLOCKING)
public class UserController extends CommandController {

  public UserController(CommandDispatcher dispatcher) {
    super(dispatcher);
  }

  @Post
  public HttpResponse<Map<String, Object>> create(
      HttpRequest<?> request, @Body Map<String, Object> body) {
    return dispatch(
        request, Operations.CREATE_USER, body, Map.of(ContextKeys.OPERATION, "create"));
  }

  @Put("/{id}")
  public HttpResponse<Map<String, Object>> update(
      HttpRequest<?> request, @PathVariable String id, @Body Map<String, Object> body) {
    return dispatch(
        request,
        Operations.UPDATE_USER,
        body,
        Map.of(ContextKeys.OPERATION, "update", ContextKeys.USER_ID, id));
  }

  @Delete("/{id}")
  public HttpResponse<Map<String, Object>> delete(HttpRequest<?> request, @PathVariable String id) {
    return dispatch(
        request,
        Operations.DELETE_USER,
        Map.of(),
        Map.of(ContextKeys.OPERATION, "delete", ContextKeys.USER_ID, id));
  }
}
