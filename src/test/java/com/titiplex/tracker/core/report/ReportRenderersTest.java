package com.titiplex.tracker.core.report;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.Preferences;

class ReportRenderersTest {

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path dir;

    private static ReportPayload payload(List<ExpenseRecord> rows) {
        return new ReportAssembler().buildReport(
                new AggregationEngine(5).aggregate(rows, new BigDecimal("50000"), YearMonth.of(2024, 1)),
                new Preferences("₹", BigDecimal.ZERO));
    }

    private static List<ExpenseRecord> sample() {
        return List.of(
                new ExpenseRecord(LocalDate.of(2024, 1, 5), "Food", new BigDecimal("500"), "₹", ""),
                new ExpenseRecord(LocalDate.of(2024, 1, 9), "Bills & Rent", new BigDecimal("200"), "₹", ""));
    }

    @Test
    @DisplayName("Fallback writes a PNG chart and a CSV table next to the requested path")
    void imageAndTable() throws IOException {
        Path target = dir.resolve("reports/report-2024-01.pdf");

        List<Path> files = new ImageTableReportRenderer().render(payload(sample()), target);

        assertEquals(List.of(dir.resolve("reports/report-2024-01.png"), dir.resolve("reports/report-2024-01.csv")), files);
        assertArrayEquals(PNG_MAGIC, Arrays.copyOf(Files.readAllBytes(files.get(0)), 4));

        List<String> lines = Files.readAllLines(files.get(1), StandardCharsets.UTF_8);
        assertEquals("report,Monthly Expense Report - 2024-01", lines.get(0));
        assertTrue(lines.contains("income,50000.00"));
        assertTrue(lines.contains("no_data,false"));
        assertTrue(lines.contains("rank,category,amount,share_percent"));
        assertTrue(lines.contains("1,Food,500.00,71"));
        assertTrue(lines.contains("2,Bills & Rent,200.00,29"));
    }

    @Test
    void fallbackHandlesEmptyMonth() throws IOException {
        List<Path> files = new ImageTableReportRenderer().render(payload(List.of()), dir.resolve("empty.pdf"));

        assertArrayEquals(PNG_MAGIC, Arrays.copyOf(Files.readAllBytes(files.get(0)), 4));
        assertTrue(Files.readAllLines(files.get(1), StandardCharsets.UTF_8).contains("no_data,true"));
    }

    @Test
    void pdfStartsWithPdfHeader() throws IOException {
        PdfReportRenderer renderer = new PdfReportRenderer();
        assertTrue(renderer.isAvailable());

        Path target = dir.resolve("report-2024-01.pdf");
        List<Path> files = renderer.render(payload(sample()), target);

        assertEquals(List.of(target), files);
        byte[] head = Arrays.copyOf(Files.readAllBytes(target), 4);
        assertEquals("%PDF", new String(head, StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("PDF text keeps the rupee sign instead of a placeholder glyph")
    void pdfEmbedsAFontWithTheRupeeSign() throws IOException {
        Path target = dir.resolve("rupee.pdf");
        ReportPayload payload = new ReportAssembler().buildReport(
                new AggregationEngine(5).aggregate(List.of(
                        new ExpenseRecord(LocalDate.of(2024, 1, 5), "Food", new BigDecimal("500"), "₹", "")),
                        new BigDecimal("2000"), YearMonth.of(2024, 1)),
                new Preferences("₹", BigDecimal.ZERO));

        new PdfReportRenderer().render(payload, target);

        String text;
        try (PDDocument pdf = PDDocument.load(target.toFile())) {
            text = new PDFTextStripper().getText(pdf);
        }
        assertTrue(text.contains("₹2,000.00"), text);
        assertTrue(text.contains("₹1,500.00"), text);
        assertFalse(text.contains("#2,000.00"), text);
    }

    @Test
    void htmlEscapesCategoryNames() {
        String html = ReportHtml.toHtml(payload(sample()), new byte[0]);

        assertTrue(html.contains("Bills &amp; Rent"));
    }
}
