package de.conciso.genereconcile.report;

import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.CoverageStats;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.SourceBreakdown;
import de.conciso.genereconcile.service.PipelineResult;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record ReportData(
        Instant timestamp,
        Map<String, Long> recordsBySource,
        OrthologSummary orthology,
        int totalGenes,
        int genesWithMouseOrtholog,
        double avgEvidenceScore,
        int multiSourceGenes,
        Map<Category, Integer> categoryCounts,
        Map<Integer, Integer> scoreDistribution,
        List<ConsolidatedGeneEntry> topGenes,
        CoverageStats humanCoverage,
        CoverageStats mouseCoverage,
        Map<String, Map<Category, Integer>> breakdownCounts
) {
    public static final int TOP_GENES = 20;

    public static ReportData of(PipelineResult result) {
        Map<String, Long> bySource = new TreeMap<>();
        for (GeneSetRecord rec : result.records()) {
            bySource.merge(rec.source(), 1L, Long::sum);
        }

        List<ConsolidatedGeneEntry> entries = result.consolidated();
        Map<Category, Integer> categories = new EnumMap<>(Category.class);
        for (Category c : Category.values()) categories.put(c, 0);
        Map<Integer, Integer> scores = new TreeMap<>();
        for (ConsolidatedGeneEntry e : entries) {
            categories.merge(e.category(), 1, Integer::sum);
            scores.merge(e.evidenceScore(), 1, Integer::sum);
        }

        Map<String, Map<Category, Integer>> breakdownCounts = new LinkedHashMap<>();
        for (SourceBreakdown b : result.breakdowns().values()) {
            breakdownCounts.put(b.label(), b.categoryCounts());
        }

        return new ReportData(
                Instant.now(),
                bySource,
                OrthologSummary.of(result.orthology(), symbols(result, Organism.HUMAN), symbols(result, Organism.MOUSE)),
                entries.size(),
                (int) entries.stream().filter(ConsolidatedGeneEntry::hasMouseOrtholog).count(),
                entries.stream().mapToInt(ConsolidatedGeneEntry::evidenceScore).average().orElse(0.0),
                (int) entries.stream().filter(e -> e.evidenceScore() > 1).count(),
                categories,
                scores,
                topGenes(entries),
                result.annotation().human(),
                result.annotation().mouse(),
                breakdownCounts);
    }

    public double percentOfGenes(int count) {
        return totalGenes == 0 ? 0.0 : 100.0 * count / totalGenes;
    }

    private static List<String> symbols(PipelineResult result, Organism organism) {
        return result.records().stream()
                .filter(r -> r.organism() == organism)
                .map(GeneSetRecord::symbol)
                .distinct()
                .toList();
    }

    private static List<ConsolidatedGeneEntry> topGenes(List<ConsolidatedGeneEntry> entries) {
        // stabile Sortierung: bei gleichem Score bleibt die Tabellenreihenfolge
        return entries.stream()
                .sorted(Comparator.comparingInt(ConsolidatedGeneEntry::evidenceScore).reversed())
                .limit(TOP_GENES)
                .toList();
    }
}
