package com.example.dutybot.provider;

/**
 * Provider did not answer within the configured timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String providerId, String message) {
        super(providerId, message, null);
    }

    public ProviderTimeoutException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public String reason() {
        return "timeout";
    }
}
