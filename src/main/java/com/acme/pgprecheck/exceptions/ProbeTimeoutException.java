package com.acme.pgprecheck.exceptions;

import java.time.Duration;

public class ProbeTimeoutException extends ProbeException {

    private final String operation;
    private final Duration timeout;

    public ProbeTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(null, formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Probe '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
