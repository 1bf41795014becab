package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.CreateUserCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationChannel;
import com.acme.dispatch.domain.model.NotificationContent;
import com.acme.dispatch.domain.model.Recipient;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.repository.NotificationRepository;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.domain.service.UserDomainService;
import com.acme.dispatch.spi.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Registers a user, stores a welcome notification for them and publishes {@code user.created}.
 */
@RequiredArgsConstructor
@Slf4j
public class CreateUserUseCase {
    static final String WELCOME_SUBJECT = "Welcome to Dispatch Platform!";
    static final String WELCOME_BODY = "Hello %s, welcome to our platform!";

    private final UserRepository userRepository;
    private final NotificationRepository notificationRepository;
    private final UserDomainService userDomainService;
    private final EventPublisher eventPublisher;

    public User execute(CreateUserCommand command) {
        log.info("Creating user with email {}", command.email());

        Email email = new Email(command.email());
        userDomainService.ensureEmailAvailable(email);

        User user = User.create(command.name(), email, command.age(), command.metadata());
        userRepository.create(user);

        createWelcomeNotification(user);

        eventPublisher.publish(
            EventTypeConstants.USER_CREATED,
            Map.of(
                "user_id", user.getUserId().value(),
                "name", user.getName(),
                "email", user.getEmail().value()),
            command.correlationId());

        log.info("User created: {}", user.getUserId());
        return user;
    }

    // The user stays created even when this fails
    private void createWelcomeNotification(User user) {
        try {
            Notification welcome = Notification.create(
                new Recipient(user.getEmail().value(), NotificationChannel.EMAIL),
                new NotificationContent(
                    WELCOME_SUBJECT, String.format(WELCOME_BODY, user.getName()), null),
                user.getUserId(),
                Map.of("type", "welcome"));
            notificationRepository.create(welcome);
            log.info("Welcome notification {} stored for user {}",
                welcome.getNotificationId(), user.getUserId());
        } catch (RuntimeException e) {
            log.warn("Failed to create welcome notification for user {}", user.getUserId(), e);
        }
    }
}
