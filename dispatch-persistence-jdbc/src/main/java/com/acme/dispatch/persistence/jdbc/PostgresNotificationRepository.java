package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of NotificationRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresNotificationRepository extends JdbcNotificationRepository {

    private static final String SELECT =
            "SELECT notification_id, recipient, channel, subject, body, template_id, user_id, status,"
                    + " external_id, failure_reason, metadata::text AS metadata, sent_at, created_at,"
                    + " updated_at FROM notifications";

    public PostgresNotificationRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO notifications
                (notification_id, recipient, channel, subject, body, template_id, user_id, status,
                 external_id, failure_reason, metadata, sent_at, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE notifications
                SET status = ?, external_id = ?, failure_reason = ?,
                    metadata = CAST(? AS JSONB), sent_at = ?, updated_at = ?
                WHERE notification_id = ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return SELECT + " WHERE notification_id = ?";
    }

    @Override
    protected String getFindByUserIdSql() {
        return SELECT + " WHERE user_id = ? ORDER BY created_at";
    }
}
