package com.titiplex.tracker.core.error;

/**
 * Base of every failure raised by the tracker core.
 */
public class TrackerException extends RuntimeException {

    public TrackerException(String message) {
        super(message);
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
