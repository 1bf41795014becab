package com.acme.dispatch.infrastructure.memory;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationId;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.NotificationRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryNotificationRepository implements NotificationRepository {
  // insertion order keeps findByUserId stable
  private final Map<String, Map<String, Object>> notifications = new LinkedHashMap<>();

  @Override
  public synchronized void create(Notification notification) {
    String id = notification.getNotificationId().value();
    if (notifications.containsKey(id)) {
      throw new AlreadyExistsException("Notification", "notification_id=" + id);
    }
    notifications.put(id, notification.toMap());
  }

  @Override
  public synchronized Optional<Notification> findById(NotificationId notificationId) {
    return Optional.ofNullable(notifications.get(notificationId.value()))
        .map(Notification::fromMap);
  }

  @Override
  public synchronized List<Notification> findByUserId(UserId userId) {
    return notifications.values().stream()
        .filter(row -> userId.value().equals(row.get("user_id")))
        .map(Notification::fromMap)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void update(Notification notification) {
    String id = notification.getNotificationId().value();
    if (!notifications.containsKey(id)) {
      throw new NotFoundException("Notification", id);
    }
    notifications.put(id, notification.toMap());
  }

  @Override
  public synchronized void delete(NotificationId notificationId) {
    if (notifications.remove(notificationId.value()) == null) {
      throw new NotFoundException("Notification", notificationId.value());
    }
  }

  public synchronized int size() {
    return notifications.size();
  }
}
