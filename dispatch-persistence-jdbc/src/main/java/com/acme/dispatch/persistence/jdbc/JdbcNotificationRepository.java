package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Notification;
import com.acme.dispatch.domain.model.NotificationChannel;
import com.acme.dispatch.domain.model.NotificationContent;
import com.acme.dispatch.domain.model.NotificationId;
import com.acme.dispatch.domain.model.NotificationStatus;
import com.acme.dispatch.domain.model.Recipient;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.NotificationRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of NotificationRepository using Template Method pattern.
 */
public abstract class JdbcNotificationRepository implements NotificationRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcNotificationRepository.class);

    protected static final String COLUMNS =
            "notification_id, recipient, channel, subject, body, template_id, user_id, status,"
                    + " external_id, failure_reason, metadata, sent_at, created_at, updated_at";

    protected final DataSource dataSource;

    protected JdbcNotificationRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void create(Notification notification) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            NotificationContent content = notification.getContent();
            ps.setString(1, notification.getNotificationId().value());
            ps.setString(2, notification.getRecipient().value());
            ps.setString(3, notification.getChannel().value());
            ps.setString(4, content.subject());
            ps.setString(5, content.body());
            Columns.setNullableString(ps, 6, content.templateId());
            Columns.setNullableString(ps, 7, userId(notification));
            ps.setString(8, notification.getStatus().value());
            Columns.setNullableString(ps, 9, notification.getExternalId());
            Columns.setNullableString(ps, 10, notification.getFailureReason());
            ps.setString(11, Columns.json(notification.getMetadata()));
            Columns.setNullableInstant(ps, 12, notification.getSentAt());
            ps.setTimestamp(13, Timestamp.from(notification.getCreatedAt()));
            ps.setTimestamp(14, Timestamp.from(notification.getUpdatedAt()));
            ps.executeUpdate();

            LOG.debug("Inserted notification: {}", notification.getNotificationId());

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw new AlreadyExistsException(
                        "Notification",
                        "notification_id=" + notification.getNotificationId().value());
            }
            throw ExceptionTranslator.translateException(e, "insert notification", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Notification> findById(NotificationId notificationId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getFindByIdSql())) {

            ps.setString(1, notificationId.value());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToNotification(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find notification by ID", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findByUserId(UserId userId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getFindByUserIdSql())) {

            ps.setString(1, userId.value());
            List<Notification> notifications = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    notifications.add(mapResultSetToNotification(rs));
                }
            }
            return notifications;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find notifications by user", LOG);
        }
    }

    @Override
    @Transactional
    public void update(Notification notification) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getUpdateSql())) {

            ps.setString(1, notification.getStatus().value());
            Columns.setNullableString(ps, 2, notification.getExternalId());
            Columns.setNullableString(ps, 3, notification.getFailureReason());
            ps.setString(4, Columns.json(notification.getMetadata()));
            Columns.setNullableInstant(ps, 5, notification.getSentAt());
            ps.setTimestamp(6, Timestamp.from(notification.getUpdatedAt()));
            ps.setString(7, notification.getNotificationId().value());

            if (ps.executeUpdate() == 0) {
                throw new NotFoundException(
                        "Notification", notification.getNotificationId().value());
            }
            LOG.debug(
                    "Updated notification: {} status={}",
                    notification.getNotificationId(),
                    notification.getStatus());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update notification", LOG);
        }
    }

    @Override
    @Transactional
    public void delete(NotificationId notificationId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setString(1, notificationId.value());
            if (ps.executeUpdate() == 0) {
                throw new NotFoundException("Notification", notificationId.value());
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete notification", LOG);
        }
    }

    private static Notification mapResultSetToNotification(ResultSet rs) throws SQLException {
        String userId = rs.getString("user_id");
        return new Notification(
                new NotificationId(rs.getString("notification_id")),
                new Recipient(
                        rs.getString("recipient"),
                        NotificationChannel.fromValue(rs.getString("channel"))),
                new NotificationContent(
                        rs.getString("subject"), rs.getString("body"), rs.getString("template_id")),
                userId != null ? new UserId(userId) : null,
                NotificationStatus.fromValue(rs.getString("status")),
                rs.getString("external_id"),
                rs.getString("failure_reason"),
                Columns.metadata(rs, "metadata"),
                Columns.instant(rs, "sent_at"),
                Columns.instant(rs, "created_at"),
                Columns.instant(rs, "updated_at"));
    }

    private static String userId(Notification notification) {
        return notification.getUserId() != null ? notification.getUserId().value() : null;
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getUpdateSql();

    protected String getFindByIdSql() {
        return "SELECT " + COLUMNS + " FROM notifications WHERE notification_id = ?";
    }

    protected String getFindByUserIdSql() {
        return "SELECT " + COLUMNS + " FROM notifications WHERE user_id = ? ORDER BY created_at";
    }

    protected String getDeleteSql() {
        return "DELETE FROM notifications WHERE notification_id = ?";
    }
}
