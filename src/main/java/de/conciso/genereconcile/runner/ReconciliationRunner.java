package de.conciso.genereconcile.runner;

import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.report.OrthologSummary;
import de.conciso.genereconcile.report.ReportData;
import de.conciso.genereconcile.report.ReportWriter;
import de.conciso.genereconcile.service.GeneSetRecordLoader;
import de.conciso.genereconcile.service.PipelineResult;
import de.conciso.genereconcile.service.ReconciliationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
@ConditionalOnProperty(name = "genereconciler.mode", havingValue = "reconcile", matchIfMissing = true)
public class ReconciliationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationRunner.class);

    private final GeneSetRecordLoader loader;
    private final ReconciliationPipeline pipeline;
    private final ReportWriter reportWriter;

    public ReconciliationRunner(GeneSetRecordLoader loader, ReconciliationPipeline pipeline,
                                ReportWriter reportWriter) {
        this.loader = loader;
        this.pipeline = pipeline;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run(String... args) throws Exception {
        System.out.println();
        System.out.println("=== Apoptosis Gene Reconciler ===");
        System.out.println();

        List<GeneSetRecord> records = loader.load();
        log.info("Loaded {} gene-set record(s)", records.size());

        PipelineResult result = pipeline.run(records);
        ReportData data = reportWriter.write(result);

        printSummary(data);
    }

    // -------------------------------------------------------------------------
    // Konsolen-Zusammenfassung
    // -------------------------------------------------------------------------

    private void printSummary(ReportData data) {
        String sep = "-".repeat(60);
        OrthologSummary o = data.orthology();

        System.out.println();
        System.out.println("-- Eingabe --");
        for (Map.Entry<String, Long> e : data.recordsBySource().entrySet()) {
            System.out.printf(Locale.ROOT, "  %-20s %6d Einträge%n", e.getKey(), e.getValue());
        }

        System.out.println();
        System.out.println("-- Orthologie --");
        System.out.printf(Locale.ROOT, "  Paare: %d (%d Duplikat(e) entfernt)%n", o.totalPairs(), o.duplicatesRemoved());
        System.out.printf(Locale.ROOT, "  Human-Eingabe abgedeckt: %d/%d (%.1f%%)%n",
                o.humanInputCovered(), o.humanInput(), o.humanCoveragePercent());
        System.out.printf(Locale.ROOT, "  Maus-Eingabe abgedeckt:  %d/%d (%.1f%%)%n",
                o.mouseInputCovered(), o.mouseInput(), o.mouseCoveragePercent());
        System.out.printf(Locale.ROOT, "  Human → Maus: %d Gene mit Ortholog, %d mit mehreren (max. %d)%n",
                o.humanWithOrthologs(), o.humanWithMultipleMouse(), o.maxMousePerHuman());
        System.out.printf(Locale.ROOT, "  Maus → Human: %d Gene mit Ortholog, %d mit mehreren (max. %d)%n",
                o.mouseWithOrthologs(), o.mouseWithMultipleHuman(), o.maxHumanPerMouse());

        System.out.println();
        System.out.println("-- Kategorien --");
        System.out.println(sep);
        for (Category c : Category.values()) {
            int n = data.categoryCounts().getOrDefault(c, 0);
            System.out.printf(Locale.ROOT, "  %-20s %6d (%.1f%%)%n", c.label(), n, data.percentOfGenes(n));
        }
        System.out.println(sep);
        System.out.printf(Locale.ROOT, "  %-20s %6d%n", "Gesamt", data.totalGenes());

        System.out.println();
        System.out.println("-- Ensembl-Abdeckung --");
        System.out.println("  " + data.humanCoverage());
        System.out.println("  " + data.mouseCoverage());

        System.out.println();
        System.out.println("-- Aufschlüsselung nach Quelle --");
        data.breakdownCounts().forEach((label, counts) -> System.out.printf(Locale.ROOT, "  %-20s %6d Gene%n",
                label, counts.values().stream().mapToInt(Integer::intValue).sum()));
        System.out.println();
    }
}
