package com.acme.dispatch.handler.http;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.SendNotificationCommand;
import com.acme.dispatch.application.usecase.SendNotificationUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

public class HttpNotificationHandler extends AbstractCommandHandler {
  private final SendNotificationUseCase sendNotification;

  public HttpNotificationHandler(SendNotificationUseCase sendNotification) {
    this.sendNotification = sendNotification;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return sendNotification
        .execute(CommandPayloads.bind(fields, SendNotificationCommand.class))
        .toMap();
  }
}
