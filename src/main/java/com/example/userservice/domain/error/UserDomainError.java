package com.example.userservice.domain.error;

/**
 * Failure kinds a user operation can end with. Adapters translate store errors into these,
 * the HTTP layer translates these into status codes.
 */
public enum UserDomainError {

    /** No user row matches the requested id. */
    NOT_FOUND("USER_NOT_FOUND", "User not found"),

    /** A unique attribute (email) is already taken. */
    CONFLICT("USER_ALREADY_EXISTS", "User already exists"),

    /** Required attributes are missing or malformed. */
    VALIDATION("USER_INVALID", "User data is invalid"),

    /** The store could not be reached or failed unexpectedly. */
    STORE_FAILURE("USER_STORE_FAILURE", "User store is unavailable");

    private final String code;
    private final String defaultMessage;

    UserDomainError(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
