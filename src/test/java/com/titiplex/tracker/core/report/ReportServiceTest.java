package com.titiplex.tracker.core.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.config.PreferencesService;
import com.titiplex.tracker.core.error.DependencyUnavailableException;
import com.titiplex.tracker.core.error.StorageException;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.store.CsvRecordStore;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final YearMonth JAN = YearMonth.of(2024, 1);

    @TempDir
    Path dir;

    @Mock
    private PdfReportRenderer pdf;

    private CsvRecordStore store;
    private PreferencesService preferences;
    private ReportService service;

    @BeforeEach
    void setUp() {
        store = new CsvRecordStore(dir);
        preferences = new PreferencesService(dir, "₹");
        store.addExpense(new ExpenseRecord(LocalDate.of(2024, 1, 5), "Food", new BigDecimal("500"), "₹", ""));
        store.setIncome(JAN, new BigDecimal("50000"));
        service = service("auto");
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private ReportService service(String format) {
        return new ReportService(store, preferences, new AggregationEngine(5), new ReportAssembler(),
                pdf, new ImageTableReportRenderer(), format, dir.resolve("reports").toString());
    }

    @Test
    @DisplayName("Missing PDF library falls back to PNG + CSV")
    void fallsBackWhenPdfUnavailable() {
        when(pdf.isAvailable()).thenReturn(true);
        when(pdf.render(any(), any())).thenThrow(new DependencyUnavailableException("no pdf"));

        ReportOutcome outcome = service.render(JAN, store.listExpenses(JAN), store.incomeFor(JAN),
                preferences.get(), service.defaultTarget(JAN));

        assertEquals("png", outcome.format());
        assertEquals(2, outcome.files().size());
        assertTrue(outcome.files().stream().allMatch(Files::exists));
    }

    @Test
    void autoSkipsPdfWhenLibraryIsAbsent() throws Exception {
        when(pdf.isAvailable()).thenReturn(false);

        ReportOutcome outcome = service.generate(JAN).get(10, TimeUnit.SECONDS);

        assertEquals("png", outcome.format());
        assertEquals(JAN, outcome.month());
        assertEquals(0, new BigDecimal("500").compareTo(outcome.payload().totalExpense()));
        assertEquals(dir.resolve("reports/report-2024-01.png"), outcome.files().get(0));
    }

    @Test
    void pngFormatNeverTouchesPdf() throws Exception {
        ReportService png = service("png");
        try {
            ReportOutcome outcome = png.generate(JAN).get(10, TimeUnit.SECONDS);
            assertEquals("png", outcome.format());
        } finally {
            png.shutdown();
        }
        verifyNoInteractions(pdf);
    }

    @Test
    void pdfFormatUsesPdfRenderer() throws Exception {
        Path target = dir.resolve("out.pdf");
        when(pdf.render(any(), any())).thenReturn(List.of(target));
        when(pdf.format()).thenReturn("pdf");
        ReportService pdfOnly = service("pdf");
        try {
            ReportOutcome outcome = pdfOnly.generate(JAN, target).get(10, TimeUnit.SECONDS);
            assertEquals("pdf", outcome.format());
            assertEquals(List.of(target), outcome.files());
        } finally {
            pdfOnly.shutdown();
        }
        verify(pdf).render(any(), any());
    }

    @Test
    void rendererFailureCompletesExceptionally() {
        when(pdf.isAvailable()).thenReturn(true);
        when(pdf.format()).thenReturn("pdf");
        when(pdf.render(any(), any())).thenThrow(new StorageException(dir, "disk full"));

        CompletionException e = assertThrows(CompletionException.class, () -> service.generate(JAN).join());
        assertInstanceOf(StorageException.class, e.getCause());
    }

    @Test
    void unknownFormatIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service("docx"));
    }
}
