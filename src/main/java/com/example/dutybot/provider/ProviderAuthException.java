package com.example.dutybot.provider;

/**
 * Provider rejected the configured token (HTTP 401/403).
 */
public class ProviderAuthException extends ProviderException {

    public ProviderAuthException(String providerId, String message) {
        super(providerId, message, null);
    }

    public ProviderAuthException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public String reason() {
        return "auth";
    }
}
