package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.UpdateUserCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.spi.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the fields present in the command and publishes {@code user.updated} listing only those.
 */
@RequiredArgsConstructor
@Slf4j
public class UpdateUserUseCase {
    private final UserRepository userRepository;
    private final EventPublisher eventPublisher;

    public User execute(UpdateUserCommand command) {
        UserId userId = new UserId(command.userId());
        log.info("Updating user {}", userId);

        User user = userRepository.findById(userId)
            .orElseThrow(() -> new NotFoundException("User", userId.value()));

        Map<String, Object> changes = new LinkedHashMap<>();
        if (command.name() != null) {
            user.updateName(command.name());
            changes.put("name", command.name());
        }
        if (command.age() != null) {
            user.updateAge(command.age());
            changes.put("age", command.age());
        }
        if (command.metadata() != null) {
            command.metadata().forEach(user::addMetadata);
            changes.put("metadata", command.metadata());
        }

        userRepository.update(user);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("user_id", userId.value());
        event.put("changes", changes);
        eventPublisher.publish(EventTypeConstants.USER_UPDATED, event, command.correlationId());

        log.info("User {} updated: {}", userId, changes.keySet());
        return user;
    }
}
