package com.acme.dispatch.web;

import com.acme.dispatch.command.CommandResult;
import com.acme.dispatch.core.DispatchException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a {@link DispatchException} that escapes a controller to the uniform result body, with the
 * status of its error code.
 */
@Slf4j
@Produces
@Singleton
@Requires(classes = {DispatchException.class, ExceptionHandler.class})
public class DispatchExceptionHandler
    implements ExceptionHandler<DispatchException, HttpResponse<Map<String, Object>>> {

  @Override
  public HttpResponse<Map<String, Object>> handle(
      HttpRequest request, DispatchException exception) {
    log.warn(
        "Request {} {} failed with {}",
        request.getMethodName(),
        request.getPath(),
        exception.getErrorCode());
    return ResultResponses.of(
        CommandResult.failure(exception.getErrorCode(), exception.getMessage()));
  }
}
