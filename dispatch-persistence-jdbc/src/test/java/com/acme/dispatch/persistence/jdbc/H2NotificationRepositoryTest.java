package com.acme.dispatch.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationChannel;
import com.acme.dispatch.domain.model.NotificationContent;
import com.acme.dispatch.domain.model.NotificationStatus;
import com.acme.dispatch.domain.model.Recipient;
import com.acme.dispatch.domain.model.UserId;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class H2NotificationRepositoryTest extends H2RepositoryTestBase {

  private H2NotificationRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    repository = new H2NotificationRepository(dataSource);
    clear("notifications");
  }

  private static Notification welcome(String userId) {
    return Notification.create(
        new Recipient("user@example.com", NotificationChannel.EMAIL),
        new NotificationContent("Welcome", "Hello there", null),
        userId != null ? new UserId(userId) : null,
        Map.of("type", "welcome"));
  }

  @Test
  @DisplayName("findByUserId should return only that user's notifications")
  void testFindByUserId() {
    repository.create(welcome("u-1"));
    repository.create(welcome("u-1"));
    repository.create(welcome("u-2"));
    repository.create(welcome(null));

    List<Notification> found = repository.findByUserId(new UserId("u-1"));

    assertThat(found).hasSize(2).allSatisfy(n -> {
      assertThat(n.getUserId().value()).isEqualTo("u-1");
      assertThat(n.getMetadata()).containsEntry("type", "welcome");
    });
  }

  @Test
  @DisplayName("sent state should round trip with external id and sent_at")
  void testSent() {
    Notification notification = welcome("u-3");
    repository.create(notification);

    notification.markAsSent("msg_0badf00d");
    repository.update(notification);

    Notification loaded = repository.findById(notification.getNotificationId()).orElseThrow();
    assertThat(loaded.getStatus()).isEqualTo(NotificationStatus.SENT);
    assertThat(loaded.getExternalId()).isEqualTo("msg_0badf00d");
    assertThat(loaded.getSentAt()).isNotNull();
    assertThat(loaded.getChannel()).isEqualTo(NotificationChannel.EMAIL);
  }
}
