package com.example.dutybot.domain;

/**
 * A person on duty as reported by a provider.
 *
 * @param id          stable identifier (ldap / username)
 * @param displayName human readable name, falls back to the id
 */
public record Person(String id, String displayName) {

    public Person {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Person id must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }

    public static Person of(String id) {
        return new Person(id, id);
    }
}
