package com.acme.dispatch.handler.http;

import com.acme.dispatch.application.command.CommandPayloads;
import com.acme.dispatch.application.command.CreateUserCommand;
import com.acme.dispatch.application.command.DeleteUserCommand;
import com.acme.dispatch.application.command.UpdateUserCommand;
import com.acme.dispatch.application.usecase.CreateUserUseCase;
import com.acme.dispatch.application.usecase.DeleteUserUseCase;
import com.acme.dispatch.application.usecase.UpdateUserUseCase;
import com.acme.dispatch.command.AbstractCommandHandler;
import com.acme.dispatch.command.ContextKeys;
import com.acme.dispatch.command.InvalidOperationException;
import com.acme.dispatch.command.Operations;
import java.util.Map;

/**
 * HTTP handler for the user resource. One instance is registered per user operation, and the
 * {@code operation} context entry (create, update or delete) must name that same operation. Update
 * and delete take the user id from the request path.
 */
public class HttpUserHandler extends AbstractCommandHandler {
  static final String CREATE = "create";
  static final String UPDATE = "update";
  static final String DELETE = "delete";

  private final String subOperation;
  private final String registeredOperation;
  private final CreateUserUseCase createUser;
  private final UpdateUserUseCase updateUser;
  private final DeleteUserUseCase deleteUser;

  /**
   * @param registeredOperation one of {@code create_user}, {@code update_user}, {@code delete_user}
   */
  public HttpUserHandler(
      String registeredOperation,
      CreateUserUseCase createUser,
      UpdateUserUseCase updateUser,
      DeleteUserUseCase deleteUser) {
    this.subOperation = subOperationOf(registeredOperation);
    this.registeredOperation = registeredOperation;
    this.createUser = createUser;
    this.updateUser = updateUser;
    this.deleteUser = deleteUser;
  }

  @Override
  protected Map<String, Object> execute(Map<String, Object> data, Map<String, Object> context) {
    String selector = contextValue(context, ContextKeys.OPERATION);
    if (!subOperation.equals(selector)) {
      throw new InvalidOperationException(selector, registeredOperation);
    }

    switch (subOperation) {
      case CREATE:
        {
          Map<String, Object> fields = withContext(data, context, ContextKeys.CORRELATION_ID);
          return createUser.execute(CommandPayloads.bind(fields, CreateUserCommand.class)).toMap();
        }
      case UPDATE:
        {
          Map<String, Object> fields =
              withContext(data, context, ContextKeys.USER_ID, ContextKeys.CORRELATION_ID);
          return updateUser.execute(CommandPayloads.bind(fields, UpdateUserCommand.class)).toMap();
        }
      case DELETE:
        {
          Map<String, Object> fields =
              withContext(data, context, ContextKeys.USER_ID, ContextKeys.CORRELATION_ID);
          DeleteUserCommand command = CommandPayloads.bind(fields, DeleteUserCommand.class);
          deleteUser.execute(command);
          return Map.of("user_id", command.userId());
        }
      default:
        throw new IllegalStateException("Unhandled user operation " + subOperation);
    }
  }

  private static String subOperationOf(String registeredOperation) {
    switch (registeredOperation) {
      case Operations.CREATE_USER:
        return CREATE;
      case Operations.UPDATE_USER:
        return UPDATE;
      case Operations.DELETE_USER:
        return DELETE;
      default:
        throw new IllegalArgumentException("Not a user operation: " + registeredOperation);
    }
  }
}
