package com.example.dutybot.config;

import com.example.dutybot.domain.Person;

/**
 * An entry of the {@code [contacts]} directory.
 *
 * @param key      table key, used by the weekday schedule and the contact endpoints
 * @param ldap     Loop login mentioned in messages
 * @param fullName human readable name
 */
public record Contact(String key, String ldap, String fullName) {

    public Person toPerson() {
        return new Person(ldap, fullName);
    }
}
