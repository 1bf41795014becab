package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of PaymentRepository
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresPaymentRepository extends JdbcPaymentRepository {

    private static final String SELECT =
            "SELECT payment_id, user_id, amount, currency, payment_method, status, transaction_id,"
                    + " reference, failure_reason, metadata::text AS metadata, created_at, updated_at"
                    + " FROM payments";

    public PostgresPaymentRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO payments
                (payment_id, user_id, amount, currency, payment_method, status, transaction_id,
                 reference, failure_reason, metadata, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql() {
        return """
                UPDATE payments
                SET status = ?, transaction_id = ?, failure_reason = ?,
                    metadata = CAST(? AS JSONB), updated_at = ?
                WHERE payment_id = ?
                """;
    }

    @Override
    protected String getFindByIdSql() {
        return SELECT + " WHERE payment_id = ?";
    }

    @Override
    protected String getFindByTransactionIdSql() {
        return SELECT + " WHERE transaction_id = ?";
    }
}
