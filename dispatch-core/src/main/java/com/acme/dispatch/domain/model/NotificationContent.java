package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;

public record NotificationContent(String subject, String body, String templateId) {
    public static final int MAX_SUBJECT_LENGTH = 500;

    public NotificationContent {
        if (subject == null || subject.isBlank()) {
            throw new ValidationException("Subject cannot be empty", "subject");
        }
        if (subject.length() > MAX_SUBJECT_LENGTH) {
            throw new ValidationException(
                    "Subject cannot exceed " + MAX_SUBJECT_LENGTH + " characters", "subject");
        }
        if (body == null || body.isBlank()) {
            throw new ValidationException("Body cannot be empty", "body");
        }
    }
}
