package com.acme.dispatch.handler.queue;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.CreateUserCommand;
import com.acme.dispatch.application.usecase.CreateUserUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

/** Queue deliveries for users only ever create. */
public class QueueUserHandler extends AbstractCommandHandler {
  private final CreateUserUseCase createUser;

  public QueueUserHandler(CreateUserUseCase createUser) {
    this.createUser = createUser;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    log.debug(
        "Create user from queue {} message {}",
        context.get(ContextKeys.QUEUE),
        context.get(ContextKeys.MESSAGE_ID));
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return createUser.execute(CommandPayloads.bind(fields, CreateUserCommand.class)).toMap();
  }
}
