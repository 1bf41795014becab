package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.core.ErrorCodes;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import java.util.Map;

/** Global exception handler for IllegalStateException: 400 with the uniform result body. */
@Produces
@Singleton
@Requires(classes = {IllegalStateException.class, ExceptionHandler.class})
public class IllegalStateExceptionHandler
    implements ExceptionHandler<IllegalStateException, HttpResponse<Map<String, Object>>> {

  @Override
  public HttpResponse<Map<String, Object>> handle(
      HttpRequest request, IllegalStateException exception) {
    String message = exception.getMessage();
    CommandResult result =
        CommandResult.failure(
            ErrorCodes.VALIDATION_ERROR, message != null ? message : "Invalid state");
    return HttpResponse.<Map<String, Object>>status(HttpStatus.BAD_REQUEST)
        .body(ResultResponses.body(result));
  }
}
