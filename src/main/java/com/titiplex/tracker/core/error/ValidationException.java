package com.titiplex.tracker.core.error;

/**
 * Bad user input: negative amounts, malformed dates, empty required fields.
 */
public class ValidationException extends TrackerException {

    public ValidationException(String message) {
        super(message);
    }
}
