package com.example.dutybot.reminder;

/**
 * Outcome of an operator command for a configured contact.
 */
public enum ContactCommandResult {
    ACCEPTED,
    UNKNOWN_CONTACT,
    SESSION_IN_PROGRESS,
    NOT_CONFIGURED,
    FAILED
}
