package de.conciso.genereconcile.report;

import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Kategorie-Zusammenfassung der konsolidierten Tabelle als Klartext.
 */
@Component
public class ConsolidationSummaryWriter {

    private String render(ReportData data) {
        String thick = "=".repeat(60);
        String thin = "-".repeat(40);
        StringBuilder sb = new StringBuilder();

        sb.append(thick).append('\n');
        sb.append("GENE SET CONSOLIDATION SUMMARY\n");
        sb.append(thick).append("\n\n");
        sb.append("Total unique human genes: ").append(data.totalGenes()).append('\n');
        sb.append(String.format(Locale.ROOT, "Genes with mouse orthologs: %d (%.1f%%)%n",
                data.genesWithMouseOrtholog(), data.percentOfGenes(data.genesWithMouseOrtholog())));
        sb.append(String.format(Locale.ROOT, "Average evidence score: %.2f%n", data.avgEvidenceScore()));
        sb.append(String.format(Locale.ROOT, "Genes from multiple sources: %d (%.1f%%)%n",
                data.multiSourceGenes(), data.percentOfGenes(data.multiSourceGenes())));

        sb.append('\n').append(thin).append("\nCATEGORY DISTRIBUTION\n").append(thin).append('\n');
        for (Category c : Category.values()) {
            int n = data.categoryCounts().getOrDefault(c, 0);
            sb.append(String.format(Locale.ROOT, "  %s: %d (%.1f%%)%n", c.label(), n, data.percentOfGenes(n)));
        }

        sb.append('\n').append(thin).append("\nEVIDENCE SCORE DISTRIBUTION\n").append(thin).append('\n');
        for (Map.Entry<Integer, Integer> e : data.scoreDistribution().entrySet()) {
            sb.append(String.format(Locale.ROOT, "  %d source(s): %d genes%n", e.getKey(), e.getValue()));
        }

        sb.append('\n').append(thin).append("\nTOP ").append(ReportData.TOP_GENES)
                .append(" GENES BY EVIDENCE SCORE\n").append(thin).append('\n');
        for (ConsolidatedGeneEntry e : data.topGenes()) {
            sb.append(String.format(Locale.ROOT, "  %s: %s (score=%d, sources: %s)%n",
                    e.humanSymbol(), e.category().label(), e.evidenceScore(), e.sourcesJoined()));
        }
        return sb.toString();
    }

    public void write(ReportData data, Path path) throws IOException {
        Files.writeString(path, render(data), StandardCharsets.UTF_8);
    }
}
