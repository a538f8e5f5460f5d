package com.example.userservice.domain.model;

import com.example.userservice.domain.error.UserDomainException;

/**
 * Attribute rules shared by {@link CreateUser} and {@link UpdateUser}.
 */
public final class UserConstraints {

    public static final int NAME_MAX_LENGTH = 255;
    public static final int EMAIL_MAX_LENGTH = 255;
    public static final int AGE_MIN = 0;
    public static final int AGE_MAX = 255;

    private UserConstraints() {
    }

    static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw UserDomainException.validation("name must not be blank");
        }
        if (name.length() > NAME_MAX_LENGTH) {
            throw UserDomainException.validation("name must be at most " + NAME_MAX_LENGTH + " characters");
        }
        return name;
    }

    static String requireEmail(String email) {
        if (email == null || email.trim().isEmpty()) {
            throw UserDomainException.validation("email must not be blank");
        }
        if (email.length() > EMAIL_MAX_LENGTH) {
            throw UserDomainException.validation("email must be at most " + EMAIL_MAX_LENGTH + " characters");
        }
        int at = email.indexOf('@');
        if (at <= 0 || at == email.length() - 1) {
            throw UserDomainException.validation("email must be a valid address");
        }
        return email;
    }

    static int requireAge(Integer age) {
        if (age == null) {
            throw UserDomainException.validation("age is required");
        }
        if (age < AGE_MIN || age > AGE_MAX) {
            throw UserDomainException.validation("age must be between " + AGE_MIN + " and " + AGE_MAX);
        }
        return age;
    }
}
