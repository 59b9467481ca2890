package com.example.dutybot.config;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Statically configured duty contacts and who of them is on duty on which weekday.
 */
public record Roster(Map<String, Contact> contacts, Map<DayOfWeek, Contact> weekdays) {

    public Roster {
        contacts = Collections.unmodifiableMap(new LinkedHashMap<>(contacts));
        weekdays = weekdays.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(weekdays));
    }

    public static Roster empty() {
        return new Roster(Map.of(), Map.of());
    }

    public Optional<Contact> contact(String key) {
        return Optional.ofNullable(contacts.get(key));
    }

    public Optional<Contact> contactFor(LocalDate date) {
        return Optional.ofNullable(weekdays.get(date.getDayOfWeek()));
    }
}
