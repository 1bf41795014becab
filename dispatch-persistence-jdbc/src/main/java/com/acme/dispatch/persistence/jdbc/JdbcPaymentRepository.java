package com.acme.dispatch.persistence.jdbc;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Money;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentId;
import com.acme.dispatch.domain.model.PaymentMethod;
import com.acme.dispatch.domain.model.PaymentStatus;
import com.acme.dispatch.domain.model.TransactionId;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.PaymentRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of PaymentRepository using Template Method pattern.
 */
public abstract class JdbcPaymentRepository implements PaymentRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcPaymentRepository.class);

    protected static final String COLUMNS =
            "payment_id, user_id, amount, currency, payment_method, status, transaction_id,"
                    + " reference, failure_reason, metadata, created_at, updated_at";

    protected final DataSource dataSource;

    protected JdbcPaymentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void create(Payment payment) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setString(1, payment.getPaymentId().value());
            ps.setString(2, payment.getUserId().value());
            ps.setBigDecimal(3, payment.getMoney().amount());
            ps.setString(4, payment.getMoney().currency());
            ps.setString(5, payment.getPaymentMethod().value());
            ps.setString(6, payment.getStatus().value());
            Columns.setNullableString(ps, 7, transactionId(payment));
            Columns.setNullableString(ps, 8, payment.getReference());
            Columns.setNullableString(ps, 9, payment.getFailureReason());
            ps.setString(10, Columns.json(payment.getMetadata()));
            ps.setTimestamp(11, Timestamp.from(payment.getCreatedAt()));
            ps.setTimestamp(12, Timestamp.from(payment.getUpdatedAt()));
            ps.executeUpdate();

            LOG.debug("Inserted payment: {} status={}", payment.getPaymentId(), payment.getStatus());

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw new AlreadyExistsException(
                        "Payment", "payment_id=" + payment.getPaymentId().value());
            }
            throw ExceptionTranslator.translateException(e, "insert payment", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findById(PaymentId paymentId) {
        return findOne(getFindByIdSql(), paymentId.value(), "find payment by ID");
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Payment> findByTransactionId(TransactionId transactionId) {
        return findOne(
                getFindByTransactionIdSql(), transactionId.value(), "find payment by transaction ID");
    }

    @Override
    @Transactional
    public void update(Payment payment) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getUpdateSql())) {

            ps.setString(1, payment.getStatus().value());
            Columns.setNullableString(ps, 2, transactionId(payment));
            Columns.setNullableString(ps, 3, payment.getFailureReason());
            ps.setString(4, Columns.json(payment.getMetadata()));
            ps.setTimestamp(5, Timestamp.from(payment.getUpdatedAt()));
            ps.setString(6, payment.getPaymentId().value());

            if (ps.executeUpdate() == 0) {
                throw new NotFoundException("Payment", payment.getPaymentId().value());
            }
            LOG.debug("Updated payment: {} status={}", payment.getPaymentId(), payment.getStatus());

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                throw new AlreadyExistsException(
                        "Payment", "transaction_id=" + transactionId(payment));
            }
            throw ExceptionTranslator.translateException(e, "update payment", LOG);
        }
    }

    @Override
    @Transactional
    public void delete(PaymentId paymentId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setString(1, paymentId.value());
            if (ps.executeUpdate() == 0) {
                throw new NotFoundException("Payment", paymentId.value());
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete payment", LOG);
        }
    }

    private Optional<Payment> findOne(String sql, String key, String operation) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToPayment(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private static Payment mapResultSetToPayment(ResultSet rs) throws SQLException {
        String transactionId = rs.getString("transaction_id");
        return new Payment(
                new PaymentId(rs.getString("payment_id")),
                new UserId(rs.getString("user_id")),
                Money.of(Columns.amount(rs, "amount"), rs.getString("currency")),
                PaymentMethod.fromValue(rs.getString("payment_method")),
                PaymentStatus.fromValue(rs.getString("status")),
                transactionId != null ? new TransactionId(transactionId) : null,
                rs.getString("reference"),
                rs.getString("failure_reason"),
                Columns.metadata(rs, "metadata"),
                Columns.instant(rs, "created_at"),
                Columns.instant(rs, "updated_at"));
    }

    private static String transactionId(Payment payment) {
        return payment.getTransactionId() != null ? payment.getTransactionId().value() : null;
    }

    // Template methods for database-specific SQL

    protected abstract String getInsertSql();

    protected abstract String getUpdateSql();

    protected String getFindByIdSql() {
        return "SELECT " + COLUMNS + " FROM payments WHERE payment_id = ?";
    }

    protected String getFindByTransactionIdSql() {
        return "SELECT " + COLUMNS + " FROM payments WHERE transaction_id = ?";
    }

    protected String getDeleteSql() {
        return "DELETE FROM payments WHERE payment_id = ?";
    }
}
