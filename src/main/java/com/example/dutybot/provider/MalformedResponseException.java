package com.example.dutybot.provider;

/**
 * Provider answered, but not with a usable duty schedule.
 */
public class MalformedResponseException extends ProviderException {

    public MalformedResponseException(String providerId, String message) {
        super(providerId, message, null);
    }

    public MalformedResponseException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public String reason() {
        return "malformed";
    }
}
