package com.acme.dispatch.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of PaymentRepository */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2PaymentRepository extends JdbcPaymentRepository {

  public H2PaymentRepository(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO payments
        (payment_id, user_id, amount, currency, payment_method, status, transaction_id,
         reference, failure_reason, metadata, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE payments
        SET status = ?, transaction_id = ?, failure_reason = ?, metadata = ?, updated_at = ?
        WHERE payment_id = ?
        """;
  }
}
