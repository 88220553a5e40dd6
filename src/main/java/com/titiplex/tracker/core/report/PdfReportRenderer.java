package com.titiplex.tracker.core.report;

import com.openhtmltopdf.outputdevice.helper.BaseRendererBuilder;
import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.titiplex.tracker.core.error.DependencyUnavailableException;
import com.titiplex.tracker.core.store.AtomicFiles;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

@Component
public class PdfReportRenderer implements ReportRenderer {

    static final String BUILDER_CLASS = "com.openhtmltopdf.pdfboxout.PdfRendererBuilder";
    static final String FONT_FAMILY = "Report Sans";
    private static final String REGULAR_FONT = "/fonts/DejaVuSans.ttf";
    private static final String BOLD_FONT = "/fonts/DejaVuSans-Bold.ttf";

    @Override
    public String format() {
        return "pdf";
    }

    @Override
    public boolean isAvailable() {
        return ClassUtils.isPresent(BUILDER_CLASS, getClass().getClassLoader());
    }

    @Override
    public List<Path> render(ReportPayload payload, Path target) {
        if (!isAvailable()) {
            throw new DependencyUnavailableException("PDF rendering library is not on the classpath");
        }
        String html = ReportHtml.toHtml(payload, PieChartImage.png(payload.slices(), "Category share - " + payload.month(), 720, 400));
        AtomicFiles.write(target, out -> {
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.useFastMode();
            // the standard PDF fonts have no glyph for ₹ and most other non-Latin currency signs
            builder.useFont(() -> font(REGULAR_FONT), FONT_FAMILY, 400, BaseRendererBuilder.FontStyle.NORMAL, true);
            builder.useFont(() -> font(BOLD_FONT), FONT_FAMILY, 700, BaseRendererBuilder.FontStyle.NORMAL, true);
            builder.withHtmlContent(html, null);
            builder.toStream(out);
            builder.run();
        });
        return List.of(target);
    }

    private static InputStream font(String resource) {
        InputStream in = PdfReportRenderer.class.getResourceAsStream(resource);
        if (in == null) {
            throw new DependencyUnavailableException("Report font " + resource + " is missing from the classpath");
        }
        return in;
    }
}
