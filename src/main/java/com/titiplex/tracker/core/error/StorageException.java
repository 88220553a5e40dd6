package com.titiplex.tracker.core.error;

import java.nio.file.Path;

/**
 * A backing file could not be read, parsed or written.
 */
public class StorageException extends TrackerException {

    private final Path path;

    public StorageException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public StorageException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
