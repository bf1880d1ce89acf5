package com.acme.pgprecheck.config;

/**
 * Thrown when the precheck configuration cannot be read or holds an unusable value
 * (non-positive timeout, empty worker pool).
 */
public class PrecheckConfigException extends RuntimeException {

    public PrecheckConfigException(String message) {
        super(message);
    }

    public PrecheckConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
