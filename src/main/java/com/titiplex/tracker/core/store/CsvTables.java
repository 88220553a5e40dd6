package com.titiplex.tracker.core.store;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.titiplex.tracker.core.error.StorageException;
import com.titiplex.tracker.core.error.ValidationException;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the two CSV tables. Columns are located by header name, so both the
 * current layout and the older {@code Date,Category,Amount,Note} / {@code Month,Income}
 * layout load.
 */
final class CsvTables {

    static final String[] EXPENSE_HEADER = {"date", "category", "amount", "currency_symbol", "note"};
    static final String[] INCOME_HEADER = {"month", "amount"};

    private static final Logger log = LoggerFactory.getLogger(CsvTables.class);

    private CsvTables() {
    }

    // ---------- Expenses ----------

    static List<ExpenseRecord> readExpenses(Path path) {
        List<ExpenseRecord> out = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = open(in)) {
            String[] header = csv.readNext();
            if (header == null) {
                return out;
            }
            Map<String, Integer> cols = columns(header);
            int date = require(cols, path, "date");
            int category = require(cols, path, "category");
            int amount = require(cols, path, "amount");
            Integer symbol = cols.get("currency_symbol");
            Integer note = cols.get("note");
            if (symbol == null) {
                log.info("{} uses the legacy layout; it will be rewritten on the next change", path);
            }

            String[] row;
            while ((row = csv.readNext()) != null) {
                if (isBlank(row)) {
                    continue;
                }
                long line = csv.getLinesRead();
                String amountText = cell(row, amount);
                out.add(new ExpenseRecord(
                        parseDate(path, line, cell(row, date)),
                        requireCategory(path, line, cell(row, category)),
                        parseAmount(path, line, amountText),
                        symbol != null ? cell(row, symbol) : Money.symbolOf(amountText),
                        note != null ? cell(row, note) : ""
                ));
            }
            return out;
        } catch (IOException | CsvValidationException e) {
            throw new StorageException(path, "unreadable expense file: " + e.getMessage(), e);
        }
    }

    static void writeExpenses(Path path, List<ExpenseRecord> records) {
        AtomicFiles.write(path, os -> {
            Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            CSVWriter csv = new CSVWriter(w);
            csv.writeNext(EXPENSE_HEADER, false);
            for (ExpenseRecord r : records) {
                csv.writeNext(new String[]{
                        r.date().toString(),
                        r.category(),
                        r.amount().toPlainString(),
                        r.currencySymbol(),
                        r.note()
                }, false);
            }
            csv.flush();
        });
    }

    // ---------- Income ----------

    static LinkedHashMap<YearMonth, BigDecimal> readIncome(Path path) {
        LinkedHashMap<YearMonth, BigDecimal> out = new LinkedHashMap<>();
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = open(in)) {
            String[] header = csv.readNext();
            if (header == null) {
                return out;
            }
            Map<String, Integer> cols = columns(header);
            int month = require(cols, path, "month");
            int amount = cols.containsKey("amount") ? cols.get("amount") : require(cols, path, "income");

            String[] row;
            while ((row = csv.readNext()) != null) {
                if (isBlank(row)) {
                    continue;
                }
                long line = csv.getLinesRead();
                // later rows win, as the upsert would have
                out.put(parseMonth(path, line, cell(row, month)), parseAmount(path, line, cell(row, amount)));
            }
            return out;
        } catch (IOException | CsvValidationException e) {
            throw new StorageException(path, "unreadable income file: " + e.getMessage(), e);
        }
    }

    static void writeIncome(Path path, Map<YearMonth, BigDecimal> income) {
        AtomicFiles.write(path, os -> {
            Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
            CSVWriter csv = new CSVWriter(w);
            csv.writeNext(INCOME_HEADER, false);
            for (Map.Entry<YearMonth, BigDecimal> e : income.entrySet()) {
                csv.writeNext(new String[]{e.getKey().toString(), e.getValue().toPlainString()}, false);
            }
            csv.flush();
        });
    }

    // RFC 4180 quoting only; backslashes in notes are plain text
    private static CSVReader open(Reader in) {
        return new CSVReaderBuilder(in)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
    }

    // ---------- Cells ----------

    static LocalDate parseDate(String text) {
        String s = text == null ? "" : text.strip();
        try {
            return LocalDate.parse(s);
        } catch (DateTimeException e) {
            // "2024-01-05T10:30" or "2024-01-05 10:30:00"
            if (s.length() > 10 && (s.charAt(10) == 'T' || s.charAt(10) == ' ')) {
                return LocalDate.parse(s.substring(0, 10));
            }
            throw e;
        }
    }

    private static LocalDate parseDate(Path path, long line, String text) {
        try {
            return parseDate(text);
        } catch (DateTimeException e) {
            throw new StorageException(path, "line " + line + ": invalid date '" + text + "'");
        }
    }

    private static YearMonth parseMonth(Path path, long line, String text) {
        String s = text.strip();
        try {
            return s.length() > 7 ? YearMonth.from(parseDate(s)) : YearMonth.parse(s);
        } catch (DateTimeException e) {
            throw new StorageException(path, "line " + line + ": invalid month '" + text + "'");
        }
    }

    private static BigDecimal parseAmount(Path path, long line, String text) {
        BigDecimal amount;
        try {
            amount = Money.parse(text);
        } catch (ValidationException e) {
            throw new StorageException(path, "line " + line + ": invalid amount '" + text + "'");
        }
        if (amount.signum() < 0) {
            throw new StorageException(path, "line " + line + ": negative amount '" + text + "'");
        }
        return amount;
    }

    private static String requireCategory(Path path, long line, String text) {
        if (text.isBlank()) {
            throw new StorageException(path, "line " + line + ": empty category");
        }
        return text;
    }

    private static Map<String, Integer> columns(String[] header) {
        Map<String, Integer> cols = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i].replace("\uFEFF", "").strip().toLowerCase(Locale.ROOT);
            cols.putIfAbsent(name, i);
        }
        return cols;
    }

    private static int require(Map<String, Integer> cols, Path path, String name) {
        Integer i = cols.get(name);
        if (i == null) {
            throw new StorageException(path, "missing column '" + name + "'");
        }
        return i;
    }

    private static String cell(String[] row, int i) {
        return i < row.length && row[i] != null ? row[i].strip() : "";
    }

    private static boolean isBlank(String[] row) {
        for (String c : row) {
            if (c != null && !c.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
