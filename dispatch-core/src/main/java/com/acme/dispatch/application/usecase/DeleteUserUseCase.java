package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.DeleteUserCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.spi.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@RequiredArgsConstructor
@Slf4j
public class DeleteUserUseCase {
    private final UserRepository userRepository;
    private final EventPublisher eventPublisher;

    /** @return the user as it was before deletion */
    public User execute(DeleteUserCommand command) {
        UserId userId = new UserId(command.userId());
        log.info("Deleting user {}", userId);

        User user = userRepository.findById(userId)
            .orElseThrow(() -> new NotFoundException("User", userId.value()));

        userRepository.delete(userId);

        eventPublisher.publish(
            EventTypeConstants.USER_DELETED,
            Map.of("user_id", userId.value(), "email", user.getEmail().value()),
            command.correlationId());

        log.info("User deleted: {}", userId);
        return user;
    }
}
