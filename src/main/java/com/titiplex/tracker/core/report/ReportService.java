package com.titiplex.tracker.core.report;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.config.PreferencesService;
import com.titiplex.tracker.core.error.DependencyUnavailableException;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import com.titiplex.tracker.core.model.Preferences;
import com.titiplex.tracker.core.store.RecordStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Generates monthly reports on a background worker. The store and preferences are read on
 * the calling thread before the job is queued, so the worker never touches shared state.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final RecordStore store;
    private final PreferencesService preferences;
    private final AggregationEngine engine;
    private final ReportAssembler assembler;
    private final ReportRenderer pdf;
    private final ReportRenderer fallback;
    private final String format;
    private final Path reportDir;
    private ExecutorService worker;

    public ReportService(RecordStore store,
                         PreferencesService preferences,
                         AggregationEngine engine,
                         ReportAssembler assembler,
                         PdfReportRenderer pdf,
                         ImageTableReportRenderer fallback,
                         @Value("${app.report.format:auto}") String format,
                         @Value("${app.report.dir}") String reportDir) {
        this.store = store;
        this.preferences = preferences;
        this.engine = engine;
        this.assembler = assembler;
        this.pdf = pdf;
        this.fallback = fallback;
        this.format = format.strip().toLowerCase(Locale.ROOT);
        this.reportDir = Paths.get(reportDir);
        if (!List.of("auto", "pdf", "png").contains(this.format)) {
            throw new IllegalArgumentException("app.report.format must be auto, pdf or png: " + format);
        }
    }

    public Path defaultTarget(YearMonth month) {
        return reportDir.resolve("report-" + month + ".pdf");
    }

    public CompletableFuture<ReportOutcome> generate(YearMonth month) {
        return generate(month, defaultTarget(month));
    }

    public CompletableFuture<ReportOutcome> generate(YearMonth month, Path target) {
        List<ExpenseRecord> rows;
        BigDecimal income;
        Preferences prefs;
        try {
            rows = store.listExpenses(month);
            income = store.incomeFor(month);
            prefs = preferences.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.info("Queued report for {} ({} expenses) -> {}", month, rows.size(), target);
        return CompletableFuture.supplyAsync(() -> render(month, rows, income, prefs, target), worker());
    }

    ReportOutcome render(YearMonth month, List<ExpenseRecord> rows, BigDecimal income, Preferences prefs, Path target) {
        MonthlyAggregate agg = engine.aggregate(rows, income, month);
        ReportPayload payload = assembler.buildReport(agg, prefs);

        ReportRenderer renderer = choose();
        List<Path> files;
        try {
            files = renderer.render(payload, target);
        } catch (DependencyUnavailableException e) {
            log.warn("{}; writing PNG + CSV instead", e.getMessage());
            renderer = fallback;
            files = fallback.render(payload, target);
        } catch (RuntimeException e) {
            log.error("Report for {} failed in the {} renderer", month, renderer.format(), e);
            throw e;
        }
        log.info("Report for {} written as {}: {}", month, renderer.format(), files);
        return new ReportOutcome(month, payload, renderer.format(), files);
    }

    ReportRenderer choose() {
        return switch (format) {
            case "png" -> fallback;
            case "pdf" -> pdf;
            default -> pdf.isAvailable() ? pdf : fallback;
        };
    }

    private synchronized ExecutorService worker() {
        if (worker == null) {
            worker = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "report-worker");
                t.setDaemon(true);
                return t;
            });
        }
        return worker;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (worker != null) {
            worker.shutdownNow();
            worker = null;
        }
    }
}
