package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.regex.Pattern;

/** Email address value object */
public record Email(String value) {
    private static final Pattern PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    public Email {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Email cannot be empty", "email");
        }
        if (!PATTERN.matcher(value).matches()) {
            throw new ValidationException("Invalid email format: " + value, "email");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
