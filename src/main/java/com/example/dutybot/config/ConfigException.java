package com.example.dutybot.config;

/**
 * Invalid or unreadable bot configuration. Fatal: the application does not start.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
