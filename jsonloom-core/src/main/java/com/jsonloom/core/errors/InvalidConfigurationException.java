package com.jsonloom.core.errors;

/** Startup-time misconfiguration of the resource graph, services or hooks. Never sent to clients. */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
