package com.acme.dispatch.web;

import static com.acme.dispatch.web.HttpTestSupport.body;
import static com.acme.dispatch.web.HttpTestSupport.call;
import static com.acme.dispatch.web.HttpTestSupport.data;
import static org.assertj.core.api.Assertions.assertThat;

import com.acme.dispatch.bootstrap.DispatchApplication;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.UserId;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@MicronautTest(environments = {"test"})
@DisplayName("UserController - user commands over HTTP")
class UserControllerTest {

  @Inject
  @Client("/")
  HttpClient client;

  @Inject DispatchApplication application;

  private static String uniqueEmail() {
    return "user-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
  }

  private String createUser(String email) {
    HttpResponse<?> response =
        call(client, HttpRequest.POST("/users", Map.of("name", "Ada", "email", email, "age", 36)));
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.OK);
    return (String) data(response).get("user_id");
  }

  // ============================================================================
  // Create
  // ============================================================================

  @Test
  @DisplayName("POST /users - should create the user and return the uniform result")
  void testCreateUser() {
    // Given
    String email = uniqueEmail();

    // When
    HttpResponse<?> response =
        call(client, HttpRequest.POST("/users", Map.of("name", "Ada", "email", email)));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = body(response);
    assertThat(body)
        .containsEntry("success", true)
        .containsKeys("execution_time_ms", "timestamp");
    assertThat(data(response)).containsEntry("email", email).containsKey("user_id");
    assertThat(application.userRepository().findByEmail(new Email(email))).isPresent();
  }

  @Test
  @DisplayName("POST /users - should reject an invalid email with 400")
  void testCreateUser_InvalidEmail() {
    // When
    HttpResponse<?> response =
        call(client, HttpRequest.POST("/users", Map.of("name", "Bad", "email", "not-an-email")));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(body(response))
        .containsEntry("success", false)
        .containsEntry("error_code", "VALIDATION_ERROR");
  }

  @Test
  @DisplayName("POST /users - should reject a missing name with 400")
  void testCreateUser_MissingName() {
    // When
    HttpResponse<?> response =
        call(client, HttpRequest.POST("/users", Map.of("email", uniqueEmail())));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(body(response)).containsEntry("error_code", "VALIDATION_ERROR");
  }

  @Test
  @DisplayName("POST /users - should return 409 for an email already registered")
  void testCreateUser_DuplicateEmail() {
    // Given
    String email = uniqueEmail();
    createUser(email);

    // When
    HttpResponse<?> response =
        call(client, HttpRequest.POST("/users", Map.of("name", "Twin", "email", email)));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(body(response)).containsEntry("error_code", "ALREADY_EXISTS");
  }

  // ============================================================================
  // Update and delete
  // ============================================================================

  @Test
  @DisplayName("PUT /users/{id} - should update only the given fields")
  void testUpdateUser() {
    // Given
    String email = uniqueEmail();
    String userId = createUser(email);

    // When
    HttpResponse<?> response =
        call(client, HttpRequest.PUT("/users/" + userId, Map.of("name", "Ada Lovelace")));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.OK);
    assertThat(data(response))
        .containsEntry("user_id", userId)
        .containsEntry("name", "Ada Lovelace")
        .containsEntry("email", email)
        .containsEntry("age", 36);
  }

  @Test
  @DisplayName("PUT /users/{id} - should return 404 for an unknown user")
  void testUpdateUser_NotFound() {
    // When
    HttpResponse<?> response =
        call(client, HttpRequest.PUT("/users/ghost", Map.of("name", "Nobody")));

    // Then
    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(body(response)).containsEntry("error_code", "NOT_FOUND");
  }

  @Test
  @DisplayName("DELETE /users/{id} - should delete once, then return 404")
  void testDeleteUser() {
    // Given
    String userId = createUser(uniqueEmail());

    // When
    HttpResponse<?> first = call(client, HttpRequest.DELETE("/users/" + userId));
    HttpResponse<?> second = call(client, HttpRequest.DELETE("/users/" + userId));

    // Then
    assertThat((Object) first.getStatus()).isEqualTo(HttpStatus.OK);
    assertThat(data(first)).containsEntry("user_id", userId);
    assertThat(application.userRepository().findById(new UserId(userId))).isEmpty();
    assertThat((Object) second.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
  }
}
