package com.titiplex.tracker.core.report;

import com.opencsv.CSVWriter;
import com.titiplex.tracker.core.model.Money;
import com.titiplex.tracker.core.store.AtomicFiles;
import org.springframework.stereotype.Component;

import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Fallback when PDF rendering is unavailable: a PNG chart next to a CSV with the same numbers.
 */
@Component
public class ImageTableReportRenderer implements ReportRenderer {

    @Override
    public String format() {
        return "png";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<Path> render(ReportPayload payload, Path target) {
        Path png = sibling(target, ".png");
        Path csv = sibling(target, ".csv");

        byte[] image = PieChartImage.png(payload.slices(), "Category share - " + payload.month(), 720, 400);
        AtomicFiles.write(png, out -> out.write(image));
        AtomicFiles.write(csv, out -> {
            CSVWriter w = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            w.writeNext(new String[]{"report", payload.title()}, false);
            w.writeNext(new String[]{"month", payload.month().toString()}, false);
            w.writeNext(new String[]{"currency_symbol", payload.currencySymbol()}, false);
            w.writeNext(new String[]{"income", Money.plain(payload.totalIncome())}, false);
            w.writeNext(new String[]{"expenditure", Money.plain(payload.totalExpense())}, false);
            w.writeNext(new String[]{"balance", Money.plain(payload.balance())}, false);
            w.writeNext(new String[]{"no_data", String.valueOf(payload.noData())}, false);
            w.writeNext(new String[]{}, false);
            w.writeNext(new String[]{"rank", "category", "amount", "share_percent"}, false);
            for (ReportPayload.CategoryLine line : payload.categories()) {
                w.writeNext(new String[]{
                        String.valueOf(line.rank()),
                        line.category(),
                        Money.plain(line.amount()),
                        String.valueOf(line.sharePercent())
                }, false);
            }
            w.flush();
        });
        return List.of(png, csv);
    }

    static Path sibling(Path target, String extension) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return target.resolveSibling(base + extension);
    }
}
