package com.acme.dispatch.infrastructure.memory;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.UserRepository;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed user store with an email index. Users are kept as map snapshots, so callers never
 * share a mutable instance with the store.
 */
public class InMemoryUserRepository implements UserRepository {
  private final Map<String, Map<String, Object>> users = new HashMap<>();
  private final Map<String, String> emailIndex = new HashMap<>();

  @Override
  public synchronized void create(User user) {
    String id = user.getUserId().value();
    String email = user.getEmail().value();
    if (users.containsKey(id)) {
      throw new AlreadyExistsException("User", "user_id=" + id);
    }
    if (emailIndex.containsKey(email)) {
      throw new AlreadyExistsException("User", "email=" + email);
    }
    users.put(id, user.toMap());
    emailIndex.put(email, id);
  }

  @Override
  public synchronized Optional<User> findById(UserId userId) {
    return Optional.ofNullable(users.get(userId.value())).map(User::fromMap);
  }

  @Override
  public synchronized Optional<User> findByEmail(Email email) {
    return Optional.ofNullable(emailIndex.get(email.value()))
        .map(users::get)
        .map(User::fromMap);
  }

  @Override
  public synchronized void update(User user) {
    String id = user.getUserId().value();
    Map<String, Object> previous = users.get(id);
    if (previous == null) {
      throw new NotFoundException("User", id);
    }
    String email = user.getEmail().value();
    String owner = emailIndex.get(email);
    if (owner != null && !owner.equals(id)) {
      throw new AlreadyExistsException("User", "email=" + email);
    }
    emailIndex.remove(String.valueOf(previous.get("email")));
    emailIndex.put(email, id);
    users.put(id, user.toMap());
  }

  @Override
  public synchronized void delete(UserId userId) {
    Map<String, Object> removed = users.remove(userId.value());
    if (removed == null) {
      throw new NotFoundException("User", userId.value());
    }
    emailIndex.remove(String.valueOf(removed.get("email")));
  }

  public synchronized int size() {
    return users.size();
  }
}
