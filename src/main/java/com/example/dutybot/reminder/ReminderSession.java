package com.example.dutybot.reminder;

import com.example.dutybot.domain.Person;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * The running reminder of one day. Acknowledgement may arrive on a request thread
 * while the scheduler is polling, hence the volatile state.
 */
@Data
@AllArgsConstructor
public class ReminderSession {

    private final Person contact;
    private final String threadId;
    private final Instant startedAt;
    private volatile Instant lastSentAt;
    private volatile boolean acknowledged;

    public ReminderSession(Person contact, String threadId, Instant startedAt) {
        this(contact, threadId, startedAt, startedAt, false);
    }
}
