package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.SendNotificationCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationChannel;
import com.acme.dispatch.domain.model.NotificationContent;
import com.acme.dispatch.domain.model.NotificationStatus;
import com.acme.dispatch.domain.model.Recipient;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.NotificationRepository;
import com.acme.dispatch.spi.EmailResult;
import com.acme.dispatch.spi.EmailService;
import com.acme.dispatch.spi.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Renders and sends a notification. Only the email channel has a provider; other channels are
 * stored and immediately failed.
 */
@RequiredArgsConstructor
@Slf4j
public class SendNotificationUseCase {
    static final String DEFAULT_EMAIL_FAILURE = "Failed to send email";

    private final NotificationRepository notificationRepository;
    private final EmailService emailService;
    private final EventPublisher eventPublisher;

    public Notification execute(SendNotificationCommand command) {
        NotificationChannel channel = NotificationChannel.fromValue(command.channel());
        Recipient recipient = new Recipient(command.recipient(), channel);
        String body = render(command.body(), command.variables());
        NotificationContent content =
            new NotificationContent(command.subject(), body, command.templateId());
        UserId userId = command.userId() != null ? new UserId(command.userId()) : null;

        Notification notification =
            Notification.create(recipient, content, userId, command.metadata());
        notificationRepository.create(notification);
        log.info("Sending {} notification {} to {}",
            channel.value(), notification.getNotificationId(), recipient);

        if (channel == NotificationChannel.EMAIL) {
            sendEmail(notification, command.variables());
        } else {
            notification.markAsFailed("Channel " + channel.value() + " not implemented");
        }

        notificationRepository.update(notification);

        boolean sent = notification.getStatus() == NotificationStatus.SENT;
        eventPublisher.publish(
            sent ? EventTypeConstants.NOTIFICATION_SENT : EventTypeConstants.NOTIFICATION_FAILED,
            Map.of(
                "notification_id", notification.getNotificationId().value(),
                "recipient", recipient.value(),
                "channel", channel.value(),
                "status", notification.getStatus().value()),
            command.correlationId());

        if (sent) {
            log.info("Notification {} sent", notification.getNotificationId());
        } else {
            log.warn("Notification {} failed: {}",
                notification.getNotificationId(), notification.getFailureReason());
        }
        return notification;
    }

    private void sendEmail(Notification notification, Map<String, Object> variables) {
        NotificationContent content = notification.getContent();
        EmailResult result;
        try {
            result = emailService.send(
                notification.getRecipient().value(),
                content.subject(),
                content.body(),
                content.templateId(),
                variables);
        } catch (RuntimeException e) {
            log.error("Email service failed for notification {}",
                notification.getNotificationId(), e);
            notification.markAsFailed("Service error: " + e.getMessage());
            notificationRepository.update(notification);
            throw e;
        }

        if (result.success()) {
            notification.markAsSent(result.messageId());
        } else {
            notification.markAsFailed(result.error() != null ? result.error() : DEFAULT_EMAIL_FAILURE);
        }
    }

    /** Replace {@code {key}} placeholders; unknown placeholders stay as written. */
    static String render(String template, Map<String, Object> variables) {
        if (variables == null || variables.isEmpty()) {
            return template;
        }
        String rendered = template;
        for (Map.Entry<String, Object> entry : variables.entrySet()) {
            rendered = rendered.replace(
                "{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return rendered;
    }
}
