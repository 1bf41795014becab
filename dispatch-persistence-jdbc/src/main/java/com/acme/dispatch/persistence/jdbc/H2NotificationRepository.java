package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of NotificationRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2NotificationRepository extends JdbcNotificationRepository {

  public H2NotificationRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO notifications
        (notification_id, recipient, channel, subject, body, template_id, user_id, status,
         external_id, failure_reason, metadata, sent_at, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE notifications
        SET status = ?, external_id = ?, failure_reason = ?, metadata = ?, sent_at = ?, updated_at = ?
        WHERE notification_id = ?
        """;
  }
}
