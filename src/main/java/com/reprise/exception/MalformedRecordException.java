package com.reprise.exception;

/**
 * A persisted cache record could not be parsed or is missing required fields.
 */
public class MalformedRecordException extends Exception {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
