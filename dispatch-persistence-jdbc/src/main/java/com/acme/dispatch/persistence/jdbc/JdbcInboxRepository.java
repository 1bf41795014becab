package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.repository.InboxRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDBC inbox over the {@code inbox} table, whose primary key is (message_id, handler). The plain
 * insert relies on that key: a duplicate entry surfaces as a unique violation and is reported as
 * already present. Dialects where a failed statement aborts the transaction override
 * {@link #getRecordSql()} with a statement that skips the conflict instead.
 */
public abstract class JdbcInboxRepository implements InboxRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcInboxRepository.class);

    private static final String SELECT_RECEIVED_AT =
            "SELECT processed_at FROM inbox WHERE message_id = ? AND handler = ?";

    protected final DataSource dataSource;

    protected JdbcInboxRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public boolean recordIfAbsent(String commandKey, String transport, Instant receivedAt) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getRecordSql())) {
            ps.setString(1, commandKey);
            ps.setString(2, transport);
            ps.setTimestamp(3, Timestamp.from(receivedAt));
            boolean recorded = ps.executeUpdate() == 1;
            LOG.debug("Inbox {} {}: {}", transport, commandKey, recorded ? "recorded" : "present");
            return recorded;
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Inbox {} {}: present", transport, commandKey);
                return false;
            }
            throw ExceptionTranslator.translateException(e, "record inbox entry", LOG);
        }
    }

    @Override
    @Transactional
    public Optional<Instant> receivedAt(String commandKey, String transport) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(SELECT_RECEIVED_AT)) {
            ps.setString(1, commandKey);
            ps.setString(2, transport);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next()
                        ? Optional.of(rs.getTimestamp("processed_at").toInstant())
                        : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "read inbox entry", LOG);
        }
    }

    protected String getRecordSql() {
        return "INSERT INTO inbox (message_id, handler, processed_at) VALUES (?, ?, ?)";
    }
}
