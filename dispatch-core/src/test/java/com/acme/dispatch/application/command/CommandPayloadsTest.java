package com.acme.dispatch.application.command;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.domain.exception.ValidationException;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandPayloadsTest {

  private static Map<String, Object> payment() {
    Map<String, Object> data = new HashMap<>();
    data.put("user_id", "user-1");
    data.put("amount", 12.5);
    data.put("currency", "USD");
    data.put("payment_method", "paypal");
    return data;
  }

  @Test
  @DisplayName("Should bind snake_case fields onto the command")
  void testBind() {
    Map<String, Object> data = payment();
    data.put("metadata", Map.of("order", "o-1"));

    ProcessPaymentCommand command = CommandPayloads.bind(data, ProcessPaymentCommand.class);

    assertThat(command.userId()).isEqualTo("user-1");
    assertThat(command.amount()).isEqualByComparingTo(new BigDecimal("12.5"));
    assertThat(command.paymentMethod()).isEqualTo("paypal");
    assertThat(command.metadata()).containsEntry("order", "o-1");
    assertThat(command.reference()).isNull();
  }

  @Test
  @DisplayName("Unknown fields are rejected")
  void testUnknownField() {
    Map<String, Object> data = payment();
    data.put("coupon", "FREE");

    assertThatThrownBy(() -> CommandPayloads.bind(data, ProcessPaymentCommand.class))
        .isInstanceOfSatisfying(
            ValidationException.class, e -> assertThat(e.getField()).isEqualTo("coupon"))
        .hasMessage("Unknown field: coupon");
  }

  @Test
  @DisplayName("Missing required fields name the field")
  void testMissingField() {
    Map<String, Object> data = payment();
    data.remove("currency");

    assertThatThrownBy(() -> CommandPayloads.bind(data, ProcessPaymentCommand.class))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Missing required field: currency");
  }

  @Test
  @DisplayName("Values of the wrong type name the field")
  void testWrongType() {
    Map<String, Object> data = payment();
    data.put("amount", "a lot");

    assertThatThrownBy(() -> CommandPayloads.bind(data, ProcessPaymentCommand.class))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Invalid value for field: amount");
  }

  @Test
  @DisplayName("Null payload binds as empty and fails on the first required field")
  void testNullPayload() {
    assertThatThrownBy(() -> CommandPayloads.bind(null, CreateUserCommand.class))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("Missing required field: ");
  }

  @Test
  @DisplayName("Update commands keep absent metadata as null")
  void testUpdateMetadataAbsent() {
    UpdateUserCommand command =
        CommandPayloads.bind(Map.of("user_id", "u-1", "age", 40), UpdateUserCommand.class);

    assertThat(command.metadata()).isNull();
    assertThat(command.name()).isNull();
    assertThat(command.age()).isEqualTo(40);
  }

  @Test
  @DisplayName("A fractional age is rejected rather than truncated")
  void testFractionalAge() {
    Map<String, Object> data = new HashMap<>();
    data.put("name", "Jane");
    data.put("email", "jane@example.com");
    data.put("age", 30.7);

    assertThatThrownBy(() -> CommandPayloads.bind(data, CreateUserCommand.class))
        .isInstanceOfSatisfying(
            ValidationException.class, e -> assertThat(e.getField()).isEqualTo("age"))
        .hasMessage("Invalid value for field: age");
  }
}
