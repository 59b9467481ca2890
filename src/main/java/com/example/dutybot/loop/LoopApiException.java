package com.example.dutybot.loop;

import java.io.IOException;

/**
 * A failed Loop API call. {@code statusCode} is 0 when no HTTP response was received.
 */
public class LoopApiException extends IOException {

    private final int statusCode;
    private final boolean timeout;

    public LoopApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
        this.timeout = false;
    }

    public LoopApiException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.timeout = timeout;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * No usable body although the call itself succeeded.
     */
    public boolean isMalformed() {
        return statusCode >= 200 && statusCode < 300;
    }
}
