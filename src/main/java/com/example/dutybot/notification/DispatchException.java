package com.example.dutybot.notification;

/**
 * A failed delivery to one sink. Transient failures are retried with backoff,
 * permanent ones are logged and dropped.
 */
public class DispatchException extends Exception {

    private final boolean transientFailure;

    public DispatchException(String sinkName, String message, boolean transientFailure) {
        super(String.format("[%s] %s", sinkName, message));
        this.transientFailure = transientFailure;
    }

    public DispatchException(String sinkName, String message, boolean transientFailure, Throwable cause) {
        super(String.format("[%s] %s", sinkName, message), cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Timeouts, 5xx and 429 are worth retrying; any other HTTP error is not.
     */
    public static boolean isTransientStatus(int statusCode) {
        return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
