package com.example.userservice.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.userservice.domain.error.UserDomainException;
import org.junit.jupiter.api.Test;

class UpdateUserTest {

    @Test
    void mergeIntoShouldOverrideOnlyPresentAttributes() {
        User existing = new User("id-1", "Alice", "a@x.com", 30);

        User merged = UpdateUser.of("id-1", null, "alice@x.com", null).mergeInto(existing);

        assertEquals(new User("id-1", "Alice", "alice@x.com", 30), merged);
    }

    @Test
    void ofShouldValidatePresentAttributesAndRequireId() {
        assertThrows(UserDomainException.class, () -> UpdateUser.of(" ", "Bob", null, null));
        assertThrows(UserDomainException.class, () -> UpdateUser.of("id-1", null, null, 300));

        UpdateUser empty = UpdateUser.of("id-1", null, null, null);
        assertNull(empty.getName());
        assertNull(empty.getAge());
    }
}
