package com.titiplex.tracker.core.error;

public class NotFoundException extends TrackerException {

    public NotFoundException(String message) {
        super(message);
    }
}
