package com.titiplex.tracker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.config.PreferencesService;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.report.ReportService;
import com.titiplex.tracker.core.store.RecordStore;
import com.titiplex.tracker.ui.MainController;

@SpringBootTest(classes = SpringConfig.class)
class SpringConfigTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void dataDirectory(DynamicPropertyRegistry registry) {
        registry.add("app.data.dir", () -> dataDir.toString());
    }

    @Autowired
    private RecordStore store;

    @Autowired
    private PreferencesService preferences;

    @Autowired
    private AggregationEngine aggregation;

    @Autowired
    private ReportService reports;

    @Autowired
    private MainController controller;

    @Test
    void wiresServicesFromProperties() {
        assertEquals(5, aggregation.topN());
        assertEquals("₹", preferences.defaults().currencySymbol());
        assertEquals(dataDir.resolve("reports").resolve("report-2024-01.pdf"),
                reports.defaultTarget(YearMonth.of(2024, 1)));
    }

    @Test
    @DisplayName("The window controller wires without a desktop HostServices bean")
    void controllerWiresWithoutHostServices() {
        assertNotNull(controller);
    }

    @Test
    void storeWritesIntoTheConfiguredDirectory() {
        int before = store.listExpenses().size();
        store.addExpense(new ExpenseRecord(LocalDate.now(), "Food", BigDecimal.ONE, "₹", "context test"));

        assertEquals(before + 1, store.listExpenses().size());
        assertEquals(dataDir.resolve("expenses.csv"), store.expensesPath());
        assertTrue(Files.exists(store.expensesPath()));
    }
}
