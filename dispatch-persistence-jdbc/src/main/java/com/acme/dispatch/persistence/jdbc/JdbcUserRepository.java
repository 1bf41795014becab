package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.UserRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of UserRepository using Template Method pattern. Subclasses supply
 * the statements that write the metadata column, whose type differs per database.
 */
public abstract class JdbcUserRepository implements UserRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcUserRepository.class);

    protected static final String COLUMNS =
            "user_id, name, email, age, metadata, created_at, updated_at";

    protected final DataSource dataSource;

    protected JdbcUserRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void create(User user) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setString(1, user.getUserId().value());
            ps.setString(2, user.getName());
            ps.setString(3, user.getEmail().value());
            setAge(ps, 4, user.getAge());
            ps.setString(5, Columns.json(user.getMetadata()));
            ps.setTimestamp(6, Timestamp.from(user.getCreatedAt()));
            ps.setTimestamp(7, Timestamp.from(user.getUpdatedAt()));
            ps.executeUpdate();

            LOG.debug("Inserted user: {}", user.getUserId());

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw alreadyExists(e, user);
            }
            throw ExceptionTranslator.translateException(e, "insert user", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(UserId userId) {
        return findOne(getFindByIdSql(), userId.value(), "find user by ID");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(Email email) {
        return findOne(getFindByEmailSql(), email.value(), "find user by email");
    }

    @Override
    @Transactional
    public void update(User user) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getUpdateSql())) {

            ps.setString(1, user.getName());
            ps.setString(2, user.getEmail().value());
            setAge(ps, 3, user.getAge());
            ps.setString(4, Columns.json(user.getMetadata()));
            ps.setTimestamp(5, Timestamp.from(user.getUpdatedAt()));
            ps.setString(6, user.getUserId().value());

            if (ps.executeUpdate() == 0) {
                throw new NotFoundException("User", user.getUserId().value());
            }
            LOG.debug("Updated user: {}", user.getUserId());

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw new AlreadyExistsException("User", "email=" + user.getEmail().value());
            }
            throw ExceptionTranslator.translateException(e, "update user", LOG);
        }
    }

    @Override
    @Transactional
    public void delete(UserId userId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setString(1, userId.value());
            if (ps.executeUpdate() == 0) {
                throw new NotFoundException("User", userId.value());
            }
            LOG.debug("Deleted user: {}", userId);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete user", LOG);
        }
    }

    private Optional<User> findOne(String sql, String key, String operation) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToUser(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private static User mapResultSetToUser(ResultSet rs) throws SQLException {
        int rawAge = rs.getInt("age");
        Integer age = rs.wasNull() ? null : rawAge;
        return new User(
                new UserId(rs.getString("user_id")),
                rs.getString("name"),
                new Email(rs.getString("email")),
                age,
                Columns.metadata(rs, "metadata"),
                Columns.instant(rs, "created_at"),
                Columns.instant(rs, "updated_at"));
    }

    private static void setAge(PreparedStatement ps, int index, Integer age) throws SQLException {
        if (age == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, age);
        }
    }

    private static AlreadyExistsException alreadyExists(SQLException e, User user) {
        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        return message.contains("email")
                ? new AlreadyExistsException("User", "email=" + user.getEmail().value())
                : new AlreadyExistsException("User", "user_id=" + user.getUserId().value());
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getUpdateSql();

    protected String getFindByIdSql() {
        return "SELECT " + COLUMNS + " FROM users WHERE user_id = ?";
    }

    protected String getFindByEmailSql() {
        return "SELECT " + COLUMNS + " FROM users WHERE email = ?";
    }

    protected String getDeleteSql() {
        return "DELETE FROM users WHERE user_id = ?";
    }
}
