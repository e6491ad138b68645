package de.conciso.genereconcile.report;

import de.conciso.genereconcile.model.Category;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Component
public class BreakdownSummaryWriter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public void write(ReportData data, Path path) throws IOException {
        String thick = "=".repeat(60);
        StringBuilder sb = new StringBuilder();
        sb.append(thick).append('\n');
        sb.append("APOPTOTIC GENE LIST - SOURCE BREAKDOWN SUMMARY\n");
        sb.append("Generated: ").append(DISPLAY_FORMAT.format(data.timestamp())).append('\n');
        sb.append(thick).append("\n\n");

        for (Map.Entry<String, Map<Category, Integer>> e : data.breakdownCounts().entrySet()) {
            sb.append('\n').append(e.getKey()).append('\n');
            sb.append("-".repeat(40)).append('\n');
            int total = 0;
            for (Category c : Category.values()) {
                int n = e.getValue().getOrDefault(c, 0);
                total += n;
                sb.append(String.format(Locale.ROOT, "  %-20s: %4d genes%n", c.label(), n));
            }
            sb.append(String.format(Locale.ROOT, "  %-20s: %4d genes%n", "TOTAL", total));
        }

        sb.append('\n').append(thick).append('\n');
        sb.append("Notes:\n");
        sb.append("- Categories are consensus annotations derived from multiple sources\n");
        sb.append("- A gene may appear in multiple source lists\n");
        sb.append("- A label covers every source whose name matches its pattern\n");
        sb.append(thick).append('\n');

        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }
}
