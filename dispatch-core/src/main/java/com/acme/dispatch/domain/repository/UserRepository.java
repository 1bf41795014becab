package com.acme.dispatch.domain.repository;

import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;

import java.util.Optional;

/**
 * Repository interface for User aggregate. Email is the unique key.
 */
public interface UserRepository {
    /** @throws com.acme.dispatch.domain.exception.AlreadyExistsException if the id or email is taken */
    void create(User user);

    Optional<User> findById(UserId userId);

    Optional<User> findByEmail(Email email);

    /** @throws com.acme.dispatch.domain.exception.NotFoundException if the user does not exist */
    void update(User user);

    /** @throws com.acme.dispatch.domain.exception.NotFoundException if the user does not exist */
    void delete(UserId userId);
}
