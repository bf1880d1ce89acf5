package com.acme.pgprecheck.exceptions;

/**
 * The initial version-detection or database-enumeration probe failed. Nothing useful can be
 * reported, so the run stops before any rule executes.
 */
public class ConnectivityException extends Exception {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
