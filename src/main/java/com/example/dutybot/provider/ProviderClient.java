package com.example.dutybot.provider;

import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.domain.DutyState;

import java.time.Duration;

/**
 * Talks to one external on-call API and normalizes its answer.
 */
public interface ProviderClient {

    ProviderConfig config();

    default String providerId() {
        return config().providerId();
    }

    /**
     * One bounded outbound call (or a short fixed sequence of them).
     *
     * @return the current duty state, never null
     * @throws ProviderException on any failure
     */
    DutyState fetch();

    /**
     * Upper bound for one {@link #fetch()}: every outbound call may take up to
     * the configured timeout.
     */
    default Duration fetchBudget() {
        return config().timeout();
    }
}
