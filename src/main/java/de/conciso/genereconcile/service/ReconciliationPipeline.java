package de.conciso.genereconcile.service;

import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.EvidenceTable;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.OrthologyIndex;
import de.conciso.genereconcile.model.SourceBreakdown;
import de.conciso.genereconcile.model.SourcePattern;
import de.conciso.genereconcile.report.CsvTables;
import de.conciso.genereconcile.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Führt die Stufen Ortholog-Auflösung bis Aufschlüsselung nacheinander aus. Jede Stufe
 * sieht nur die unveränderliche Ausgabe der vorherigen.
 */
@Service
public class ReconciliationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPipeline.class);

    private final OrthologResolver orthologResolver;
    private final EvidenceAggregator evidenceAggregator;
    private final CategoryClassifier categoryClassifier;
    private final IdentifierAnnotator identifierAnnotator;
    private final SourceBreakdownGenerator breakdownGenerator;
    private final CsvTables csvTables;
    private final List<SourcePattern> breakdownPatterns;
    private final boolean reuseOrthologTable;
    private final Path outputDir;

    public ReconciliationPipeline(OrthologResolver orthologResolver,
                                  EvidenceAggregator evidenceAggregator,
                                  CategoryClassifier categoryClassifier,
                                  IdentifierAnnotator identifierAnnotator,
                                  SourceBreakdownGenerator breakdownGenerator,
                                  CsvTables csvTables,
                                  ReconcilerProperties properties) {
        this.orthologResolver = orthologResolver;
        this.evidenceAggregator = evidenceAggregator;
        this.categoryClassifier = categoryClassifier;
        this.identifierAnnotator = identifierAnnotator;
        this.breakdownGenerator = breakdownGenerator;
        this.csvTables = csvTables;
        this.breakdownPatterns = properties.breakdownPatterns();
        this.reuseOrthologTable = properties.orthology().reuseExisting();
        this.outputDir = properties.paths().output();
    }

    public PipelineResult run(List<GeneSetRecord> records) throws IOException {
        Set<String> human = new LinkedHashSet<>();
        Set<String> mouse = new LinkedHashSet<>();
        for (GeneSetRecord rec : records) {
            (rec.organism() == Organism.HUMAN ? human : mouse).add(rec.symbol());
        }
        log.info("Unique symbols: {} human, {} mouse", human.size(), mouse.size());

        log.info("--- Ortholog resolution ---");
        OrthologyIndex index = reuseOrthologTable ? readOrthologTable() : orthologResolver.resolve(human, mouse);

        log.info("--- Evidence aggregation ---");
        EvidenceTable evidence = evidenceAggregator.aggregate(records, index);

        log.info("--- Classification ---");
        List<ConsolidatedGeneEntry> consolidated = categoryClassifier.consolidate(evidence);

        log.info("--- Identifier annotation ---");
        IdentifierAnnotator.Result annotation = identifierAnnotator.annotate(consolidated);

        log.info("--- Source breakdown ---");
        Map<String, SourceBreakdown> breakdowns = breakdownGenerator.breakdown(annotation.entries(), breakdownPatterns);

        return new PipelineResult(records, index, consolidated, annotation, breakdowns);
    }

    private OrthologyIndex readOrthologTable() throws IOException {
        Path table = outputDir.resolve(ReportWriter.ORTHOLOGY_FULL_FILE);
        if (!Files.isRegularFile(table)) {
            throw new InputMissingException("Ortholog table not found", table);
        }
        OrthologyIndex index = OrthologyIndex.of(csvTables.readOrthologTable(table), 0);
        log.info("Reusing {} ortholog pairs from {}", index.pairs().size(), table);
        return index;
    }
}
