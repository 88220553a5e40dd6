package com.titiplex.tracker.ui;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.config.PreferencesService;
import com.titiplex.tracker.core.error.NotFoundException;
import com.titiplex.tracker.core.error.StorageException;
import com.titiplex.tracker.core.error.TrackerException;
import com.titiplex.tracker.core.error.ValidationException;
import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.ExpenseEntry;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.Money;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import com.titiplex.tracker.core.model.Preferences;
import com.titiplex.tracker.core.model.SipProjection;
import com.titiplex.tracker.core.model.SipRequirement;
import com.titiplex.tracker.core.report.ChartData;
import com.titiplex.tracker.core.report.ChartDataAssembler;
import com.titiplex.tracker.core.report.ChartSlice;
import com.titiplex.tracker.core.report.ReportService;
import com.titiplex.tracker.core.sip.SipCalculator;
import com.titiplex.tracker.core.store.RecordStore;
import com.titiplex.tracker.core.suggest.SuggestionEngine;
import javafx.application.HostServices;
import javafx.application.Platform;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.collections.FXCollections;
import javafx.fxml.FXML;
import javafx.scene.chart.BarChart;
import javafx.scene.chart.PieChart;
import javafx.scene.chart.XYChart;
import javafx.scene.control.Alert;
import javafx.scene.control.ChoiceBox;
import javafx.scene.control.ComboBox;
import javafx.scene.control.DatePicker;
import javafx.scene.control.Label;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableView;
import javafx.scene.control.TextArea;
import javafx.scene.control.TextField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@Component
public class MainController {

    private static final Logger log = LoggerFactory.getLogger(MainController.class);

    static final List<String> CATEGORIES = List.of(
            "Food", "Transport", "Shopping", "Bills", "Entertainment", "Health", "Education", "Other");
    static final List<String> CURRENCIES = List.of("₹", "$", "€", "£", "¥", "AED", "AUD", "CAD", "SGD");

    private final RecordStore store;
    private final PreferencesService preferences;
    private final AggregationEngine aggregation;
    private final SuggestionEngine suggestions;
    private final SipCalculator sip;
    private final ChartDataAssembler charts;
    private final ReportService reports;
    private final ObjectProvider<HostServices> hostServices;

    public MainController(RecordStore store,
                          PreferencesService preferences,
                          AggregationEngine aggregation,
                          SuggestionEngine suggestions,
                          SipCalculator sip,
                          ChartDataAssembler charts,
                          ReportService reports,
                          ObjectProvider<HostServices> hostServices) {
        this.store = store;
        this.preferences = preferences;
        this.aggregation = aggregation;
        this.suggestions = suggestions;
        this.sip = sip;
        this.charts = charts;
        this.reports = reports;
        this.hostServices = hostServices;
    }

    // Expenses tab
    @FXML private DatePicker datePicker;
    @FXML private ComboBox<String> categoryBox;
    @FXML private TextField amountField;
    @FXML private ChoiceBox<String> currencyChoice;
    @FXML private TextField noteField;
    @FXML private TextField incomeField;
    @FXML private TableView<ExpenseEntry> table;
    @FXML private TableColumn<ExpenseEntry, String> dateCol;
    @FXML private TableColumn<ExpenseEntry, String> categoryCol;
    @FXML private TableColumn<ExpenseEntry, String> amountCol;
    @FXML private TableColumn<ExpenseEntry, String> noteCol;
    @FXML private Label statusLabel;

    // Charts tab
    @FXML private BarChart<String, Number> incomeChart;
    @FXML private BarChart<String, Number> categoryChart;
    @FXML private PieChart shareChart;

    // Insights tab
    @FXML private TextArea insightsArea;
    @FXML private TextField prefCurrencyField;
    @FXML private TextField prefBudgetField;
    @FXML private Label reportStatus;

    // SIP tab
    @FXML private Label sipMonthlyLabel;
    @FXML private TextField sipMonthlyField;
    @FXML private TextField sipRateField;
    @FXML private TextField sipYearsField;
    @FXML private TextField sipGoalField;
    @FXML private TextArea sipResultArea;

    @FXML
    public void initialize() {
        categoryBox.setItems(FXCollections.observableArrayList(CATEGORIES));
        currencyChoice.setItems(FXCollections.observableArrayList(CURRENCIES));

        dateCol.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().record().date().toString()));
        categoryCol.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().record().category()));
        amountCol.setCellValueFactory(c -> new ReadOnlyStringWrapper(
                Money.format(c.getValue().record().currencySymbol(), c.getValue().record().amount())));
        noteCol.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().record().note()));

        table.getSelectionModel().selectedItemProperty().addListener((obs, old, sel) -> {
            if (sel != null) {
                fillForm(sel.record());
            }
        });
        datePicker.valueProperty().addListener((obs, old, date) -> {
            if (date != null && (old == null || !YearMonth.from(date).equals(YearMonth.from(old)))) {
                guarded(this::refreshMonth);
            }
        });

        guarded(() -> {
            applyPreferences(preferences.get());
            onClear();
        });
    }

    // ---------- Expenses ----------
    @FXML
    public void onAdd() {
        guarded(() -> {
            int id = store.addExpense(readForm());
            log.debug("Added expense #{}", id);
            status("Expense added.");
            refreshMonth();
        });
    }

    @FXML
    public void onUpdate() {
        ExpenseEntry sel = table.getSelectionModel().getSelectedItem();
        if (sel == null) {
            info("Select a row to update.");
            return;
        }
        guarded(() -> {
            store.updateExpense(sel.id(), readForm());
            status("Expense updated.");
            refreshMonth();
        });
    }

    @FXML
    public void onDelete() {
        ExpenseEntry sel = table.getSelectionModel().getSelectedItem();
        if (sel == null) {
            info("Select a row to delete.");
            return;
        }
        guarded(() -> {
            store.deleteExpense(sel.id());
            status("Expense deleted.");
            refreshMonth();
        });
    }

    @FXML
    public void onClear() {
        table.getSelectionModel().clearSelection();
        datePicker.setValue(LocalDate.now());
        categoryBox.getEditor().clear();
        categoryBox.setValue(null);
        amountField.clear();
        noteField.clear();
        guarded(() -> {
            currencyChoice.setValue(preferences.get().currencySymbol());
            refreshMonth();
        });
    }

    @FXML
    public void onSetIncome() {
        guarded(() -> {
            YearMonth month = selectedMonth();
            store.setIncome(month, Money.parse(incomeField.getText()));
            status("Income for " + month + " saved.");
        });
    }

    private ExpenseRecord readForm() {
        if (datePicker.getValue() == null) {
            throw new ValidationException("Date is required");
        }
        String category = categoryBox.getEditor().getText();
        if (category == null || category.isBlank()) {
            category = categoryBox.getValue();
        }
        BigDecimal amount = Money.parse(amountField.getText());
        if (amount.signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero");
        }
        String symbol = currencyChoice.getValue() == null ? preferences.get().currencySymbol() : currencyChoice.getValue();
        return new ExpenseRecord(datePicker.getValue(), category, amount, symbol, noteField.getText());
    }

    private void fillForm(ExpenseRecord r) {
        datePicker.setValue(r.date());
        categoryBox.setValue(r.category());
        categoryBox.getEditor().setText(r.category());
        amountField.setText(Money.plain(r.amount()));
        if (!r.currencySymbol().isEmpty() && !currencyChoice.getItems().contains(r.currencySymbol())) {
            currencyChoice.getItems().add(r.currencySymbol());
        }
        currencyChoice.setValue(r.currencySymbol().isEmpty() ? preferences.get().currencySymbol() : r.currencySymbol());
        noteField.setText(r.note());
    }

    private YearMonth selectedMonth() {
        LocalDate d = datePicker.getValue();
        return d == null ? YearMonth.now() : YearMonth.from(d);
    }

    private void refreshMonth() {
        YearMonth month = selectedMonth();
        table.setItems(FXCollections.observableArrayList(store.entries(month)));
        BigDecimal income = store.incomeFor(month);
        incomeField.setText(income.signum() == 0 ? "" : Money.plain(income));
    }

    // ---------- Charts ----------
    @FXML
    public void onChartsSelected() {
        if (incomeChart == null) {
            return;
        }
        guarded(() -> {
            ChartData data = charts.chartData(store.listExpenses(), store.listIncome());

            XYChart.Series<String, Number> income = new XYChart.Series<>();
            income.setName("Income");
            XYChart.Series<String, Number> expense = new XYChart.Series<>();
            expense.setName("Expenditure");
            for (ChartData.MonthPoint p : data.months()) {
                income.getData().add(new XYChart.Data<>(p.month().toString(), p.income()));
                expense.getData().add(new XYChart.Data<>(p.month().toString(), p.expense()));
            }
            incomeChart.getData().setAll(List.of(income, expense));

            XYChart.Series<String, Number> top = new XYChart.Series<>();
            for (CategoryTotal c : data.topCategories()) {
                top.getData().add(new XYChart.Data<>(c.category(), c.amount()));
            }
            categoryChart.getData().setAll(List.of(top));

            shareChart.setData(FXCollections.observableArrayList(data.slices().stream()
                    .map(this::pieSlice)
                    .toList()));
        });
    }

    private PieChart.Data pieSlice(ChartSlice s) {
        return new PieChart.Data(s.label(), s.amount().doubleValue());
    }

    // ---------- Insights ----------
    @FXML
    public void onInsightsSelected() {
        if (insightsArea == null) {
            return;
        }
        guarded(() -> {
            YearMonth month = selectedMonth();
            Preferences prefs = preferences.get();
            MonthlyAggregate agg = aggregation.aggregate(store.listExpenses(month), store.incomeFor(month), month);
            insightsArea.setText(suggestions.summaryText(suggestions.suggest(agg, prefs), prefs));
        });
    }

    @FXML
    public void onSavePreferences() {
        guarded(() -> {
            String budget = prefBudgetField.getText();
            BigDecimal value = budget == null || budget.isBlank() ? BigDecimal.ZERO : Money.parse(budget);
            Preferences saved = preferences.set(new Preferences(prefCurrencyField.getText(), value));
            applyPreferences(saved);
            status("Preferences saved.");
            onInsightsSelected();
        });
    }

    @FXML
    public void onGenerateReport() {
        YearMonth month = selectedMonth();
        reportStatus.setText("Generating report for " + month + "...");
        reports.generate(month).whenComplete((outcome, err) -> Platform.runLater(() -> {
            if (err != null) {
                Throwable cause = err.getCause() != null ? err.getCause() : err;
                log.error("Report generation for {} failed", month, cause);
                reportStatus.setText("Report failed: " + cause.getMessage());
                return;
            }
            reportStatus.setText("Report saved (" + outcome.format() + "): " + outcome.files().get(0));
        }));
    }

    private void applyPreferences(Preferences prefs) {
        prefCurrencyField.setText(prefs.currencySymbol());
        prefBudgetField.setText(Money.plain(prefs.defaultMonthlyBudget()));
        sipMonthlyLabel.setText("Monthly investment (" + prefs.currencySymbol() + ")");
        if (!currencyChoice.getItems().contains(prefs.currencySymbol())) {
            currencyChoice.getItems().add(0, prefs.currencySymbol());
        }
    }

    // ---------- SIP ----------
    @FXML
    public void onCalculateSip() {
        guarded(() -> {
            BigDecimal rate = Money.parse(sipRateField.getText());
            int months = sip.monthsForYears(Money.parse(sipYearsField.getText()));
            String goal = sipGoalField.getText();

            SipProjection projection = sip.futureValue(Money.parse(sipMonthlyField.getText()), rate, months);
            SipRequirement requirement = goal == null || goal.isBlank()
                    ? null
                    : sip.requiredMonthlyInvestment(Money.parse(goal), rate, months);
            sipResultArea.setText(sip.describe(projection, requirement, preferences.get()));
        });
    }

    @FXML
    public void onOpenCsv() {
        Path csv = store.expensesPath();
        if (!Files.exists(csv)) {
            info("No expenses saved yet, " + csv.getFileName() + " does not exist.");
            return;
        }
        HostServices host = hostServices.getIfAvailable();
        if (host == null) {
            error("Opening files is not supported here. The expenses are stored in " + csv);
            return;
        }
        log.info("Opening {}", csv);
        host.showDocument(csv.toUri().toString());
    }

    // ---------- helpers ----------
    private void guarded(Runnable action) {
        try {
            action.run();
        } catch (ValidationException | NotFoundException e) {
            info(e.getMessage());
        } catch (StorageException e) {
            log.error("Storage failure on {}", e.getPath(), e);
            error("Could not read or write " + e.getPath() + ".\n" + e.getMessage());
        } catch (TrackerException e) {
            log.error("Operation failed", e);
            error(e.getMessage());
        }
    }

    private void status(String text) {
        statusLabel.setText(text);
    }

    private static void info(String text) {
        new Alert(Alert.AlertType.INFORMATION, text).showAndWait();
    }

    private static void error(String text) {
        new Alert(Alert.AlertType.ERROR, text).showAndWait();
    }
}
