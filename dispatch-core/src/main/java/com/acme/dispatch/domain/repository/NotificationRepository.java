package com.acme.dispatch.domain.repository;

import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationId;
import com.acme.dispatch.domain.model.UserId;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Notification aggregate
 */
public interface NotificationRepository {
    void create(Notification notification);

    Optional<Notification> findById(NotificationId notificationId);

    List<Notification> findByUserId(UserId userId);

    void update(Notification notification);

    void delete(NotificationId notificationId);
}
