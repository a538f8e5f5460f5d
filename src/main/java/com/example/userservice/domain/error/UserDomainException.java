package com.example.userservice.domain.error;

import com.example.userservice.common.exception.BusinessException;

public class UserDomainException extends BusinessException {

    private final UserDomainError error;

    public UserDomainException(UserDomainError error) {
        this(error, error.getDefaultMessage());
    }

    public UserDomainException(UserDomainError error, String message) {
        super(error.getCode(), message);
        this.error = error;
    }

    public UserDomainException(UserDomainError error, String message, Throwable cause) {
        super(error.getCode(), message, cause);
        this.error = error;
    }

    public UserDomainError getError() {
        return error;
    }

    public static UserDomainException notFound(String id) {
        return new UserDomainException(UserDomainError.NOT_FOUND, "User not found: " + id);
    }

    public static UserDomainException validation(String message) {
        return new UserDomainException(UserDomainError.VALIDATION, message);
    }
}
