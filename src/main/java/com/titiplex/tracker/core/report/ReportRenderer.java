package com.titiplex.tracker.core.report;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes a {@link ReportPayload} to disk. Implementations publish each file atomically.
 */
public interface ReportRenderer {

    String format();

    boolean isAvailable();

    /**
     * @param target the requested report path; renderers producing other file types
     *               swap the extension
     * @return the files written
     */
    List<Path> render(ReportPayload payload, Path target);
}
