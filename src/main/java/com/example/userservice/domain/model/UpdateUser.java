package com.example.userservice.domain.model;

import com.example.userservice.domain.error.UserDomainException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Partial update of an existing user. A {@code null} attribute keeps the stored value.
 */
@Getter
@EqualsAndHashCode
@ToString
public class UpdateUser {

    private final String id;

    private final String name;

    private final String email;

    private final Integer age;

    private UpdateUser(String id, String name, String email, Integer age) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.age = age;
    }

    public static UpdateUser of(String id, String name, String email, Integer age) {
        if (id == null || id.trim().isEmpty()) {
            throw UserDomainException.validation("id must not be blank");
        }
        return new UpdateUser(
                id,
                name == null ? null : UserConstraints.requireName(name),
                email == null ? null : UserConstraints.requireEmail(email),
                age == null ? null : Integer.valueOf(UserConstraints.requireAge(age)));
    }

    /**
     * Applies the present attributes over {@code existing}.
     */
    public User mergeInto(User existing) {
        return new User(
                existing.getId(),
                name != null ? name : existing.getName(),
                email != null ? email : existing.getEmail(),
                age != null ? age : existing.getAge());
    }
}
