package com.titiplex.tracker.core.report;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Category share pie drawn with Java2D, PNG encoded. Works headless.
 */
final class PieChartImage {

    private static final Color[] PALETTE = {
            new Color(0x74b9ff), new Color(0x0984e3), new Color(0x00b894), new Color(0xfdcb6e),
            new Color(0xe17055), new Color(0x6c5ce7), new Color(0xb2bec3)
    };

    private PieChartImage() {
    }

    static byte[] png(List<ChartSlice> slices, String title, int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setColor(Color.DARK_GRAY);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 16));
            g.drawString(title, 16, 26);

            int diameter = Math.min(width / 2, height - 60);
            int x = 24;
            int y = 44;
            BigDecimal total = slices.stream().map(ChartSlice::amount).reduce(BigDecimal.ZERO, BigDecimal::add);

            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
            if (total.signum() == 0) {
                g.setColor(PALETTE[PALETTE.length - 1]);
                g.fillOval(x, y, diameter, diameter);
                g.setColor(Color.DARK_GRAY);
                g.drawString("No data", x + diameter + 24, y + 20);
                return encode(img);
            }

            double start = 90;
            int legendY = y + 20;
            for (int i = 0; i < slices.size(); i++) {
                ChartSlice s = slices.get(i);
                double share = s.amount().doubleValue() / total.doubleValue();
                double extent = -360 * share;
                Color c = PALETTE[i % PALETTE.length];
                g.setColor(c);
                g.fillArc(x, y, diameter, diameter, (int) Math.round(start), (int) Math.round(extent));
                start += extent;

                g.fillRect(x + diameter + 24, legendY - 10, 12, 12);
                g.setColor(Color.DARK_GRAY);
                g.drawString(String.format(Locale.ROOT, "%s (%.1f%%)", s.label(), share * 100),
                        x + diameter + 44, legendY);
                legendY += 20;
            }
            g.setColor(Color.WHITE);
            g.setStroke(new BasicStroke(1f));
            g.drawOval(x, y, diameter, diameter);
            return encode(img);
        } finally {
            g.dispose();
        }
    }

    private static byte[] encode(BufferedImage img) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(img, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode chart", e);
        }
    }
}
