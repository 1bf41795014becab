package com.acme.dispatch.handler.stream;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.CreateUserCommand;
import com.acme.dispatch.application.usecase.CreateUserUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import java.util.Map;

/** Stream records for users only ever create. */
public class StreamUserHandler extends AbstractCommandHandler {
  private final CreateUserUseCase createUser;

  public StreamUserHandler(CreateUserUseCase createUser) {
    this.createUser = createUser;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    log.debug(
        "Create user from {}-{}@{}",
        context.get(ContextKeys.TOPIC),
        context.get(ContextKeys.PARTITION),
        context.get(ContextKeys.OFFSET));
    Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
    return createUser.execute(CommandPayloads.bind(fields, CreateUserCommand.class)).toMap();
  }
}
