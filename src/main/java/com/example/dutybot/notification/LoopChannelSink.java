package com.example.dutybot.notification;

import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.Transition;
import com.example.dutybot.loop.LoopApi;
import com.example.dutybot.loop.LoopApiException;
import lombok.extern.slf4j.Slf4j;

/**
 * Announces duty changes in a Loop channel, mentioning the new person.
 */
@Slf4j
public class LoopChannelSink implements NotificationSink {

    private final SinkConfig config;
    private final LoopApi api;

    public LoopChannelSink(SinkConfig config, LoopApi api) {
        this.config = config;
        this.api = api;
    }

    @Override
    public SinkConfig config() {
        return config;
    }

    @Override
    public void deliver(Transition transition) throws DispatchException {
        try {
            api.sendMessage(config.channel(), message(transition), null);
            log.info("Posted duty change for {} to Loop channel {}", transition.providerId(), config.channel());
        } catch (LoopApiException e) {
            boolean retry = e.isTimeout() || DispatchException.isTransientStatus(e.getStatusCode());
            throw new DispatchException(name(), e.getMessage(), retry, e);
        }
    }

    static String message(Transition transition) {
        StringBuilder text = new StringBuilder()
                .append('@').append(transition.current().person().id())
                .append(" is now on duty for ").append(transition.providerId());
        if (transition.previous() != null) {
            text.append(" (was @").append(transition.previous().person().id()).append(')');
        }
        if (transition.current().validUntil() != null) {
            text.append(", until ").append(transition.current().validUntil());
        }
        return text.toString();
    }
}
