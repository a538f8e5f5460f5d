package com.example.userservice.domain.port;

import com.example.userservice.domain.model.CreateUser;
import com.example.userservice.domain.model.UpdateUser;
import com.example.userservice.domain.model.User;

/**
 * Storage boundary for users.
 *
 * <p>Every operation either returns its result or throws
 * {@link com.example.userservice.domain.error.UserDomainException}; implementations must not leak
 * store-specific exceptions.
 */
public interface UserRepositoryPort {

    /**
     * Persists a new user under a freshly generated id.
     * Fails with {@code CONFLICT} when the email is taken, {@code VALIDATION} when the store rejects the values.
     */
    User createUser(CreateUser user);

    /**
     * Fails with {@code NOT_FOUND} when no user has this id.
     */
    User getUser(String id);

    /**
     * Fails with {@code NOT_FOUND} when the id does not exist, in which case nothing is written.
     */
    User updateUser(UpdateUser user);

    /**
     * Fails with {@code NOT_FOUND} when the id does not exist, including on a repeated delete.
     */
    void deleteUser(String id);
}
