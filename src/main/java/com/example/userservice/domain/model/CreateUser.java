package com.example.userservice.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Attributes of a user that does not exist yet. The id is assigned by the repository.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CreateUser {

    private final String name;

    private final String email;

    private final int age;

    private CreateUser(String name, String email, int age) {
        this.name = name;
        this.email = email;
        this.age = age;
    }

    /**
     * @throws com.example.userservice.domain.error.UserDomainException with
     *         {@code VALIDATION} when an attribute is missing or out of range
     */
    public static CreateUser of(String name, String email, Integer age) {
        return new CreateUser(
                UserConstraints.requireName(name),
                UserConstraints.requireEmail(email),
                UserConstraints.requireAge(age));
    }
}
