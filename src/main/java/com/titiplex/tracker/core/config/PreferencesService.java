package com.titiplex.tracker.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.tracker.core.error.StorageException;
import com.titiplex.tracker.core.error.ValidationException;
import com.titiplex.tracker.core.model.Preferences;
import com.titiplex.tracker.core.store.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * The preferences document ({@code preferences.json}). Created with defaults the first
 * time it is asked for and rewritten on every change.
 */
@Service
public class PreferencesService {

    private static final Logger log = LoggerFactory.getLogger(PreferencesService.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Path prefsPath;
    private final String defaultCurrency;
    private Preferences current;

    @Autowired
    public PreferencesService(@Value("${app.data.dir}") String dataDir,
                              @Value("${app.preferences.default-currency:₹}") String defaultCurrency) {
        this(Paths.get(dataDir), defaultCurrency);
    }

    public PreferencesService(Path dataDir, String defaultCurrency) {
        this.prefsPath = dataDir.resolve("preferences.json");
        this.defaultCurrency = defaultCurrency;
    }

    public Preferences get() {
        if (current == null) {
            current = Files.exists(prefsPath) ? load() : save(defaults());
        }
        return current;
    }

    /**
     * Validates and persists; returns what was stored (a blank symbol becomes the default).
     */
    public Preferences set(Preferences prefs) {
        if (prefs == null) {
            throw new ValidationException("Preferences are required");
        }
        BigDecimal budget = prefs.defaultMonthlyBudget();
        if (budget == null || budget.signum() < 0) {
            throw new ValidationException("Default monthly budget must be zero or more");
        }
        String symbol = prefs.currencySymbol() == null || prefs.currencySymbol().isBlank()
                ? defaultCurrency
                : prefs.currencySymbol().strip();
        current = save(new Preferences(symbol, budget));
        log.info("Preferences saved: currency={}, budget={}", symbol, budget.toPlainString());
        return current;
    }

    public Preferences reset() {
        current = save(defaults());
        return current;
    }

    public Preferences defaults() {
        return new Preferences(defaultCurrency, BigDecimal.ZERO);
    }

    private Preferences load() {
        try {
            Preferences p = mapper.readValue(Files.readAllBytes(prefsPath), Preferences.class);
            if (p == null) {
                throw new StorageException(prefsPath, "empty preferences document");
            }
            if (p.defaultMonthlyBudget() != null && p.defaultMonthlyBudget().signum() < 0) {
                throw new StorageException(prefsPath, "negative default_monthly_budget "
                        + p.defaultMonthlyBudget().toPlainString());
            }
            // keys missing from older documents fall back to defaults
            return new Preferences(
                    p.currencySymbol() == null || p.currencySymbol().isBlank() ? defaultCurrency : p.currencySymbol(),
                    p.defaultMonthlyBudget() == null ? BigDecimal.ZERO : p.defaultMonthlyBudget());
        } catch (IOException e) {
            throw new StorageException(prefsPath, "unreadable preferences: " + e.getMessage(), e);
        }
    }

    private Preferences save(Preferences prefs) {
        AtomicFiles.write(prefsPath, out -> out.write(mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(prefs)));
        return prefs;
    }
}
