package com.example.dutybot.provider;

/**
 * A failed provider fetch. Recoverable: it only degrades the freshness of one lane.
 */
public abstract class ProviderException extends RuntimeException {

    protected ProviderException(String providerId, String message, Throwable cause) {
        super(String.format("[%s] %s", providerId, message), cause);
    }

    /**
     * Short tag for logs and metrics.
     */
    public abstract String reason();
}
