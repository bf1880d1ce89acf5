package com.acme.pgprecheck.exceptions;

/** Malformed command-line input or an unusable upgrade path, detected before any rule runs. */
public class InputValidationException extends Exception {

    public InputValidationException(String message) {
        super(message);
    }
}
