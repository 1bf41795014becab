package com.acme.dispatch.infrastructure.memory;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryUserRepositoryTest {

  private InMemoryUserRepository repository;

  @BeforeEach
  void setUp() {
    repository = new InMemoryUserRepository();
  }

  @Test
  @DisplayName("Stored users come back as independent copies")
  void testSnapshotIsolation() {
    User user = User.create("Grace", new Email("grace@example.com"), null, null);
    repository.create(user);

    user.updateName("Changed Without Saving");

    User loaded = repository.findById(user.getUserId()).orElseThrow();
    assertThat(loaded).isNotSameAs(user);
    assertThat(loaded.getName()).isEqualTo("Grace");
  }

  @Test
  @DisplayName("Email index enforces uniqueness")
  void testEmailUniqueness() {
    repository.create(User.create("A", new Email("same@example.com"), null, null));

    assertThatThrownBy(
            () -> repository.create(User.create("B", new Email("same@example.com"), null, null)))
        .isInstanceOf(AlreadyExistsException.class);
    assertThat(repository.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("Lookup by email follows the index")
  void testFindByEmail() {
    User user = User.create("Linus", new Email("linus@example.com"), 50, null);
    repository.create(user);

    assertThat(repository.findByEmail(new Email("linus@example.com")))
        .get()
        .extracting(User::getUserId)
        .isEqualTo(user.getUserId());
    assertThat(repository.findByEmail(new Email("nobody@example.com"))).isEmpty();
  }

  @Test
  @DisplayName("Update and delete of unknown users raise NOT_FOUND")
  void testUnknownUser() {
    User stranger = User.create("S", new Email("s@example.com"), null, null);

    assertThatThrownBy(() -> repository.update(stranger))
        .isInstanceOfSatisfying(
            NotFoundException.class,
            e -> {
              assertThat(e.getEntity()).isEqualTo("User");
              assertThat(e.getEntityId()).isEqualTo(stranger.getUserId().value());
            });
    assertThatThrownBy(() -> repository.delete(new UserId("missing")))
        .isInstanceOf(NotFoundException.class);
  }
}
