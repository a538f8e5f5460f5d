package com.example.userservice.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A persisted user. The id is assigned once at creation and never changes.
 */
@Getter
@EqualsAndHashCode
@ToString
public class User {

    private final String id;

    private final String name;

    private final String email;

    private final int age;

    public User(String id, String name, String email, int age) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.age = age;
    }
}
