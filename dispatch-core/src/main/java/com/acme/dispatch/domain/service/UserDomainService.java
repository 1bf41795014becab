package com.acme.dispatch.domain.service;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.repository.UserRepository;

/**
 * Domain rules for users that span more than one aggregate instance.
 */
public class UserDomainService {
    private final UserRepository userRepository;

    public UserDomainService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public boolean isEmailAvailable(Email email) {
        return userRepository.findByEmail(email).isEmpty();
    }

    /** @throws AlreadyExistsException if another user already owns the address */
    public void ensureEmailAvailable(Email email) {
        if (!isEmailAvailable(email)) {
            throw new AlreadyExistsException("User", "email=" + email.value());
        }
    }
}
