package com.example.dutybot.notification;

import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.Transition;

/**
 * A destination for duty change notifications.
 * Deliveries are at-least-once: implementations may see the same
 * (provider id, source revision) twice.
 */
public interface NotificationSink {

    SinkConfig config();

    default String name() {
        return config().name();
    }

    void deliver(Transition transition) throws DispatchException;
}
