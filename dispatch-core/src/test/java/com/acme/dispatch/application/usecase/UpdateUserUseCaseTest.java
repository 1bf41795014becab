package com.acme.dispatch.application.usecase;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import com.acme.dispatch.application.command.DeleteUserCommand;
import com.acme.dispatch.application.command.UpdateUserCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.exception.ValidationException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.infrastructure.memory.InMemoryUserRepository;
import com.acme.dispatch.support.RecordingEventPublisher;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Update and delete against the in-memory store. */
class UpdateUserUseCaseTest {

  private InMemoryUserRepository users;
  private RecordingEventPublisher publisher;
  private User existing;

  @BeforeEach
  void setUp() {
    users = new InMemoryUserRepository();
    publisher = new RecordingEventPublisher();
    existing = User.create("Ada", new Email("ada@example.com"), 36, Map.of("tier", "gold"));
    users.create(existing);
  }

  @Test
  @DisplayName("Metadata-only update keeps name and age and lists only metadata")
  void testMetadataOnly() {
    UpdateUserUseCase useCase = new UpdateUserUseCase(users, publisher);

    User updated =
        useCase.execute(
            new UpdateUserCommand(
                existing.getUserId().value(), null, null, Map.of("theme", "dark"), "c-1"));

    assertThat(updated.getName()).isEqualTo("Ada");
    assertThat(updated.getAge()).isEqualTo(36);
    assertThat(updated.getMetadata()).containsEntry("tier", "gold").containsEntry("theme", "dark");
    assertThat(users.findById(existing.getUserId()).orElseThrow().getMetadata())
        .containsEntry("theme", "dark");

    Map<String, Object> event =
        publisher.eventsOfType(EventTypeConstants.USER_UPDATED).get(0).data();
    assertThat(event).containsEntry("user_id", existing.getUserId().value());
    assertThat(event.get("changes")).asInstanceOf(MAP).containsOnlyKeys("metadata");
  }

  @Test
  @DisplayName("Invalid age leaves the stored user untouched")
  void testInvalidAge() {
    UpdateUserUseCase useCase = new UpdateUserUseCase(users, publisher);

    assertThatThrownBy(
            () ->
                useCase.execute(
                    new UpdateUserCommand(existing.getUserId().value(), "Ada L.", 200, null, null)))
        .isInstanceOf(ValidationException.class);

    assertThat(users.findById(existing.getUserId()).orElseThrow().getName()).isEqualTo("Ada");
    assertThat(publisher.events()).isEmpty();
  }

  @Test
  @DisplayName("Updating an unknown user raises NOT_FOUND")
  void testUnknownUser() {
    UpdateUserUseCase useCase = new UpdateUserUseCase(users, publisher);

    assertThatThrownBy(
            () -> useCase.execute(new UpdateUserCommand("missing", "X", null, null, null)))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  @DisplayName("Delete removes the user and publishes user.deleted")
  void testDelete() {
    DeleteUserUseCase useCase = new DeleteUserUseCase(users, publisher);

    User deleted = useCase.execute(new DeleteUserCommand(existing.getUserId().value(), "c-2"));

    assertThat(deleted.getEmail().value()).isEqualTo("ada@example.com");
    assertThat(users.size()).isZero();
    assertThat(users.findByEmail(new Email("ada@example.com"))).isEmpty();
    assertThat(publisher.eventsOfType(EventTypeConstants.USER_DELETED)).hasSize(1);
    assertThatThrownBy(
            () -> useCase.execute(new DeleteUserCommand(existing.getUserId().value(), null)))
        .isInstanceOf(NotFoundException.class);
  }
}
