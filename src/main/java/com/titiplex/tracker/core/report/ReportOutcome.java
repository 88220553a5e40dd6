package com.titiplex.tracker.core.report;

import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;

public record ReportOutcome(YearMonth month, ReportPayload payload, String format, List<Path> files) {
}
