package com.acme.dispatch.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.core.PermanentException;
import com.acme.dispatch.core.TransientException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Retryable failures")
  class Retryable {

    @Test
    @DisplayName("connection failure becomes TransientException naming the operation")
    void testConnectionFailure() {
      // Given
      SQLException cause = new SQLException("Connection refused", "08001");

      // When
      RuntimeException result =
          ExceptionTranslator.translateException(cause, "find user by email", logger);

      // Then
      assertThat(result)
          .isInstanceOf(TransientException.class)
          .hasCause(cause)
          .hasMessage("find user by email failed: Connection refused");
    }

    @Test
    @DisplayName("serialization failure and server shutdown are retryable")
    void testRollbackAndOperatorClasses() {
      assertThat(ExceptionTranslator.isRetryable(new SQLException("serialize", "40001"))).isTrue();
      assertThat(ExceptionTranslator.isRetryable(new SQLException("starting up", "57P03")))
          .isTrue();
    }

    @Test
    @DisplayName("lock timeout without a SQL state is retryable")
    void testTimeoutMessage() {
      assertThat(ExceptionTranslator.isRetryable(new SQLException("Lock timeout exceeded")))
          .isTrue();
    }

    @Test
    @DisplayName("unrecognised failures default to TransientException")
    void testUnknown() {
      assertThat(
              ExceptionTranslator.translateException(
                  new SQLException("something odd", "XX000"), "update payment", logger))
          .isInstanceOf(TransientException.class);
    }
  }

  @Nested
  @DisplayName("Permanent failures")
  class Permanent {

    @Test
    @DisplayName("syntax errors become PermanentException")
    void testSyntaxError() {
      SQLException cause = new SQLException("Syntax error in SQL statement", "42000");

      assertThat(ExceptionTranslator.translateException(cause, "save notification", logger))
          .isInstanceOf(PermanentException.class)
          .hasMessageStartingWith("save notification failed");
    }

    @Test
    @DisplayName("foreign key and check violations are permanent")
    void testIntegrityViolations() {
      assertThat(ExceptionTranslator.isRetryable(new SQLException("fk", "23503"))).isFalse();
      assertThat(ExceptionTranslator.isRetryable(new SQLException("check", "23514"))).isFalse();
    }

    @Test
    @DisplayName("H2 vendor code for a missing column is permanent without a SQL state")
    void testH2VendorCode() {
      assertThat(ExceptionTranslator.isRetryable(new SQLException("Column missing", null, 42122)))
          .isFalse();
    }
  }

  @Test
  @DisplayName("isUniqueViolation should match SQL state 23505 anywhere in the chain")
  void testUniqueViolation() {
    SQLException unique = new SQLException("duplicate key", "23505");
    SQLException wrapper = new SQLException("batch failed", "XX000");
    wrapper.setNextException(unique);

    assertThat(ExceptionTranslator.isUniqueViolation(unique)).isTrue();
    assertThat(ExceptionTranslator.isUniqueViolation(wrapper)).isTrue();
    assertThat(ExceptionTranslator.isUniqueViolation(new SQLException("fk", "23503"))).isFalse();
  }
}
