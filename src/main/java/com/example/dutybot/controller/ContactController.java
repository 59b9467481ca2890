package com.example.dutybot.controller;

import com.example.dutybot.reminder.ContactCommandResult;
import com.example.dutybot.reminder.DutyReminderService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator commands for the contacts of the {@code [contacts]} directory.
 */
@RestController
@RequestMapping("/contacts")
@RequiredArgsConstructor
public class ContactController {

    private final DutyReminderService reminderService;

    /**
     * Starts a reminder session for the contact now.
     */
    @PostMapping("/{contactKey}/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String contactKey) {
        return respond(contactKey, reminderService.triggerContact(contactKey), HttpStatus.ACCEPTED, "started");
    }

    /**
     * Posts the duty message for the contact once, without reminders.
     */
    @PostMapping("/{contactKey}/ping")
    public ResponseEntity<Map<String, Object>> ping(@PathVariable String contactKey) {
        return respond(contactKey, reminderService.pingContact(contactKey), HttpStatus.OK, "sent");
    }

    private static ResponseEntity<Map<String, Object>> respond(String contactKey, ContactCommandResult result,
                                                               HttpStatus success, String status) {
        return switch (result) {
            case ACCEPTED -> ResponseEntity.status(success).body(Map.of("status", status, "contact", contactKey));
            case UNKNOWN_CONTACT -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Unknown contact: " + contactKey));
            case SESSION_IN_PROGRESS -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A reminder session is already in progress"));
            case NOT_CONFIGURED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "The [notification] section is not configured"));
            case FAILED -> ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("error", "Failed to post to Loop"));
        };
    }
}
