package com.titiplex.tracker.core.error;

/**
 * An optional collaborator (e.g. the PDF library) is missing at runtime.
 */
public class DependencyUnavailableException extends TrackerException {

    public DependencyUnavailableException(String message) {
        super(message);
    }
}
