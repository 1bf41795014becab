package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Aggregate root for User
 */
@Getter
public class User {
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 150;

    private final UserId userId;
    private final Email email;
    private final Instant createdAt;
    private final Map<String, Object> metadata;
    private String name;
    private Integer age;
    private Instant updatedAt;

    public User(
            UserId userId,
            String name,
            Email email,
            Integer age,
            Map<String, Object> metadata,
            Instant createdAt,
            Instant updatedAt) {
        if (userId == null) {
            throw new ValidationException("User ID cannot be null", "user_id");
        }
        if (email == null) {
            throw new ValidationException("Email cannot be null", "email");
        }
        validateName(name);
        validateAge(age);

        this.userId = userId;
        this.name = name;
        this.email = email;
        this.age = age;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    public static User create(String name, Email email, Integer age, Map<String, Object> metadata) {
        Instant now = Instant.now();
        return new User(UserId.generate(), name, email, age, metadata, now, now);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void updateName(String name) {
        validateName(name);
        this.name = name;
        touch();
    }

    public void updateAge(Integer age) {
        validateAge(age);
        this.age = age;
        touch();
    }

    public void addMetadata(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("Metadata key cannot be empty", "metadata");
        }
        metadata.put(key, value);
        touch();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("user_id", userId.value());
        map.put("name", name);
        map.put("email", email.value());
        map.put("age", age);
        map.put("metadata", new HashMap<>(metadata));
        map.put("created_at", Attributes.iso(createdAt));
        map.put("updated_at", Attributes.iso(updatedAt));
        return map;
    }

    public static User fromMap(Map<String, Object> data) {
        return new User(
                new UserId(Attributes.requireString(data, "user_id")),
                Attributes.requireString(data, "name"),
                new Email(Attributes.requireString(data, "email")),
                Attributes.optionalInteger(data, "age"),
                Attributes.metadata(data),
                Attributes.instantOrNow(data, "created_at"),
                Attributes.optionalInstant(data, "updated_at"));
    }

    private void touch() {
        this.updatedAt = Attributes.advance(updatedAt);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name cannot be empty", "name");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    "Name cannot exceed " + MAX_NAME_LENGTH + " characters", "name");
        }
    }

    private static void validateAge(Integer age) {
        if (age != null && (age < MIN_AGE || age > MAX_AGE)) {
            throw new ValidationException(
                    "Age must be between " + MIN_AGE + " and " + MAX_AGE, "age");
        }
    }
}
