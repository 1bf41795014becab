package com.acme.dispatch.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.acme.dispatch.domain.exception.BusinessRuleViolationException;
import com.acme.dispatch.domain.exception.NotFoundException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Exception handlers - uniform error bodies")
class ExceptionHandlersTest {

  private final HttpRequest<?> request = mock(HttpRequest.class);

  @Nested
  @DisplayName("DispatchExceptionHandler")
  class DispatchExceptions {

    private final DispatchExceptionHandler handler = new DispatchExceptionHandler();

    @Test
    @DisplayName("Should use the error code and message of the exception")
    void testNotFound() {
      // When
      HttpResponse<Map<String, Object>> response =
          handler.handle(request, new NotFoundException("Payment", "p-9"));

      // Then
      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.body())
          .containsEntry("success", false)
          .containsEntry("error_code", "NOT_FOUND")
          .containsEntry("message", "Payment with ID p-9 not found");
    }

    @Test
    @DisplayName("Should map business rule violations to 422")
    void testBusinessRule() {
      // When
      HttpResponse<Map<String, Object>> response =
          handler.handle(
              request,
              new BusinessRuleViolationException(
                  "payment_status_transition", "Can only refund completed payments"));

      // Then
      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.body()).containsEntry("error_code", "BUSINESS_RULE_VIOLATION");
    }
  }

  @Nested
  @DisplayName("IllegalStateExceptionHandler")
  class IllegalStates {

    private final IllegalStateExceptionHandler handler = new IllegalStateExceptionHandler();

    @Test
    @DisplayName("Should reply 400 with the exception message")
    void testMessage() {
      // When
      HttpResponse<Map<String, Object>> response =
          handler.handle(request, new IllegalStateException("Registry not initialized"));

      // Then
      assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.body())
          .containsEntry("error_code", "VALIDATION_ERROR")
          .containsEntry("message", "Registry not initialized");
    }

    @Test
    @DisplayName("Should fall back to a fixed message")
    void testNoMessage() {
      // When
      HttpResponse<Map<String, Object>> response =
          handler.handle(request, new IllegalStateException());

      // Then
      assertThat(response.body()).containsEntry("message", "Invalid state");
    }
  }
}
