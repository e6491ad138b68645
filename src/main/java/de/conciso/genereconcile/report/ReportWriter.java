package de.conciso.genereconcile.report;

import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.SourceBreakdown;
import de.conciso.genereconcile.service.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String ORTHOLOGY_FULL_FILE = "orthology_mapping_full.csv";
    public static final String ORTHOLOGY_FILE = "orthology_mapping.csv";
    public static final String CONSOLIDATED_FILE = "consolidated_apoptosis_genes.csv";
    public static final String CATEGORY_SUMMARY_FILE = "gene_category_summary.txt";
    public static final String FINAL_FILE = "final_apoptotic_gene_list.csv";
    public static final String BREAKDOWN_DIR = "source_breakdown";
    public static final String BREAKDOWN_SUMMARY_FILE = "breakdown_summary.txt";
    public static final String RUN_SUMMARY_FILE = "run_summary.json";

    private final Path outputDir;
    private final boolean reusedOrthologTable;
    private final CsvTables csvTables;
    private final ConsolidationSummaryWriter consolidationSummaryWriter;
    private final BreakdownSummaryWriter breakdownSummaryWriter;
    private final JsonReportWriter jsonReportWriter;

    public ReportWriter(ReconcilerProperties properties,
                        CsvTables csvTables,
                        ConsolidationSummaryWriter consolidationSummaryWriter,
                        BreakdownSummaryWriter breakdownSummaryWriter,
                        JsonReportWriter jsonReportWriter) {
        this.outputDir = properties.paths().output();
        this.reusedOrthologTable = properties.orthology().reuseExisting();
        this.csvTables = csvTables;
        this.consolidationSummaryWriter = consolidationSummaryWriter;
        this.breakdownSummaryWriter = breakdownSummaryWriter;
        this.jsonReportWriter = jsonReportWriter;
    }

    /**
     * Schreibt alle Tabellen und Zusammenfassungen eines Laufs ins Ausgabeverzeichnis.
     *
     * @return die Report-Daten, aus denen die Zusammenfassungen erzeugt wurden
     * @throws UncheckedIOException wenn eine Ausgabe nicht geschrieben werden kann
     */
    public ReportData write(PipelineResult result) {
        ReportData data = ReportData.of(result);
        try {
            writeAll(result, data);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write reports to " + outputDir, e);
        }
        return data;
    }

    private void writeAll(PipelineResult result, ReportData data) throws IOException {
        Files.createDirectories(outputDir);

        if (!reusedOrthologTable) {
            csvTables.writeOrthologTable(outputDir.resolve(ORTHOLOGY_FULL_FILE), outputDir.resolve(ORTHOLOGY_FILE),
                    result.orthology().pairs());
            log.info("Ortholog table written: {}", outputDir.resolve(ORTHOLOGY_FULL_FILE));
        }

        Path consolidated = outputDir.resolve(CONSOLIDATED_FILE);
        csvTables.writeConsolidated(consolidated, result.consolidated());
        log.info("Consolidated table written: {}", consolidated);

        Path categorySummary = outputDir.resolve(CATEGORY_SUMMARY_FILE);
        consolidationSummaryWriter.write(data, categorySummary);
        log.info("Category summary written: {}", categorySummary);

        Path finalList = outputDir.resolve(FINAL_FILE);
        csvTables.writeAnnotated(finalList, result.annotation().entries());
        log.info("Final gene list written: {}", finalList);

        Path breakdownDir = outputDir.resolve(BREAKDOWN_DIR);
        Files.createDirectories(breakdownDir);
        for (SourceBreakdown breakdown : result.breakdowns().values()) {
            Path file = breakdownDir.resolve(breakdownFileName(breakdown.label()));
            csvTables.writeAnnotated(file, breakdown.entries());
            log.info("Breakdown written: {}", file);
        }
        Path breakdownSummary = breakdownDir.resolve(BREAKDOWN_SUMMARY_FILE);
        breakdownSummaryWriter.write(data, breakdownSummary);

        Path json = outputDir.resolve(RUN_SUMMARY_FILE);
        jsonReportWriter.write(data, json);
        log.info("Run summary written: {}", json);
    }

    static String breakdownFileName(String label) {
        return "apoptosis_genes_" + label.replaceAll("[^A-Za-z0-9._-]", "_") + ".csv";
    }
}
