package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.core.PermanentException;
import com.acme.dispatch.core.TransientException;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Maps a {@link SQLException} raised by a repository onto {@link TransientException}, when a retry
 * may succeed, or {@link PermanentException}. Classification goes by SQLSTATE class first, then
 * H2 vendor codes, then driver message text. Anything unrecognised counts as transient.
 */
public final class ExceptionTranslator {

    /** SQL state shared by H2 and PostgreSQL for a unique constraint violation */
    static final String UNIQUE_VIOLATION = "23505";

    // 08 connection, 40 rollback, 53 insufficient resources, 57 operator intervention
    private static final Set<String> RETRYABLE_STATE_CLASSES = Set.of("08", "40", "53", "57");

    // 22 data, 23 integrity, 42 syntax or access, 3D catalog, 3F schema
    private static final Set<String> PERMANENT_STATE_CLASSES = Set.of("22", "23", "42", "3D", "3F");

    // table not found, parameter count, table or view not found, column not found
    private static final Set<Integer> H2_PERMANENT_CODES = Set.of(90002, 90007, 42102, 42122);

    private static final List<String> RETRYABLE_MESSAGES =
            List.of("timeout", "connection refused", "deadlock", "too many connections");

    private ExceptionTranslator() {}

    /**
     * Logs the failure and returns the exception to throw in its place.
     *
     * @param operation what the repository was doing, e.g. {@code "insert user"}
     */
    public static RuntimeException translateException(
            SQLException exception, String operation, Logger logger) {
        boolean retryable = isRetryable(exception);
        logger.error(
                "Database {} failed (sqlState={}, {})",
                operation,
                exception.getSQLState(),
                retryable ? "transient" : "permanent",
                exception);

        String message = operation + " failed: " + exception.getMessage();
        return retryable
                ? new TransientException(message, exception)
                : new PermanentException(message, exception);
    }

    /** True when the statement was rejected by a unique or primary key constraint. */
    public static boolean isUniqueViolation(SQLException exception) {
        for (SQLException e = exception; e != null; e = e.getNextException()) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    static boolean isRetryable(SQLException exception) {
        String state = exception.getSQLState();
        if (state != null && state.length() >= 2) {
            String stateClass = state.substring(0, 2).toUpperCase(Locale.ROOT);
            if (RETRYABLE_STATE_CLASSES.contains(stateClass)) {
                return true;
            }
            if (PERMANENT_STATE_CLASSES.contains(stateClass)) {
                return false;
            }
        }
        if (H2_PERMANENT_CODES.contains(exception.getErrorCode())) {
            return false;
        }
        String text = exception.getMessage() == null
                ? ""
                : exception.getMessage().toLowerCase(Locale.ROOT);
        if (RETRYABLE_MESSAGES.stream().anyMatch(text::contains)) {
            return true;
        }
        return !text.contains("syntax error");
    }
}
