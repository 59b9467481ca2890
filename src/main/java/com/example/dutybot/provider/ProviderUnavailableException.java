package com.example.dutybot.provider;

/**
 * Provider could not be reached or answered with a server error.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String providerId, String message) {
        super(providerId, message, null);
    }

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public String reason() {
        return "unavailable";
    }
}
