package com.titiplex.tracker.core.report;

import java.util.Base64;

/**
 * XHTML for the PDF report. openhtmltopdf needs well-formed markup, so every tag is closed
 * and every value escaped.
 */
final class ReportHtml {

    private ReportHtml() {
    }

    static String toHtml(ReportPayload report, byte[] chartPng) {
        StringBuilder sb = new StringBuilder(4_000);
        sb.append("<!DOCTYPE html><html><head><meta charset='utf-8'/>");
        sb.append("<style>")
                .append("body{font-family:'" + PdfReportRenderer.FONT_FAMILY + "',Helvetica,Arial,sans-serif;font-size:12px;color:#111;margin:24px;}")
                .append("h1{font-size:18px;margin:0 0 12px 0;}")
                .append("h2{font-size:14px;margin:18px 0 8px 0;}")
                .append(".muted{color:#555;}")
                .append(".card{display:inline-block;border:1px solid #ddd;border-radius:6px;padding:8px 12px;margin-right:8px;}")
                .append("table{width:100%;border-collapse:collapse;}")
                .append("th,td{border-bottom:1px solid #eee;padding:6px 4px;text-align:left;}")
                .append("th{text-transform:uppercase;font-size:10px;color:#555;}")
                .append(".right{text-align:right;}")
                .append("</style>");
        sb.append("</head><body>");

        sb.append("<h1>").append(escape(report.title())).append("</h1>");
        sb.append("<div>");
        sb.append(card("Income", report.formattedIncome()));
        sb.append(card("Expenditure", report.formattedExpense()));
        sb.append(card("Balance", report.formattedBalance()));
        sb.append("</div>");

        if (report.noData()) {
            sb.append("<p class='muted'>No expenses recorded for ").append(escape(String.valueOf(report.month()))).append(".</p>");
            sb.append("</body></html>");
            return sb.toString();
        }

        sb.append("<h2>Category share</h2>");
        sb.append("<img width='500' src='data:image/png;base64,")
                .append(Base64.getEncoder().encodeToString(chartPng))
                .append("'/>");

        sb.append("<h2>Top expenses</h2>");
        sb.append("<table><thead><tr><th>#</th><th>Category</th><th class='right'>Amount</th><th class='right'>Share</th></tr></thead><tbody>");
        for (ReportPayload.CategoryLine line : report.categories()) {
            sb.append("<tr><td>").append(line.rank()).append("</td>")
                    .append("<td>").append(escape(line.category())).append("</td>")
                    .append("<td class='right'>").append(escape(line.formattedAmount())).append("</td>")
                    .append("<td class='right'>").append(line.sharePercent()).append("%</td></tr>");
        }
        sb.append("</tbody></table>");
        sb.append("</body></html>");
        return sb.toString();
    }

    private static String card(String label, String value) {
        return "<div class='card'><div class='muted'>" + escape(label) + "</div><div><b>" + escape(value) + "</b></div></div>";
    }

    static String escape(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}
