package de.conciso.genereconcile.service;

import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.Polarity;
import de.conciso.genereconcile.report.CsvTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Liest die Roh-Gen-Set-Tabellen aller konfigurierten Quellen. Das konfigurierte Label
 * wird zur Quelle des Eintrags; Polarität und Organismus kommen aus der Zeile.
 */
@Service
public class GeneSetRecordLoader {

    private static final Logger log = LoggerFactory.getLogger(GeneSetRecordLoader.class);

    private final Path rawDataDir;
    private final List<ReconcilerProperties.Source> sources;
    private final CsvTables csvTables;

    @Autowired
    public GeneSetRecordLoader(ReconcilerProperties properties, CsvTables csvTables) {
        this(properties.paths().rawData(), properties.sources(), csvTables);
    }

    GeneSetRecordLoader(Path rawDataDir, List<ReconcilerProperties.Source> sources, CsvTables csvTables) {
        this.rawDataDir = rawDataDir;
        this.sources = sources;
        this.csvTables = csvTables;
    }

    public List<GeneSetRecord> load() throws IOException {
        if (sources.isEmpty()) {
            throw new IllegalStateException("No sources configured (genereconciler.sources)");
        }
        log.info("Loading gene sets from {}", rawDataDir.toAbsolutePath());

        List<GeneSetRecord> records = new ArrayList<>();
        for (ReconcilerProperties.Source source : sources) {
            Path file = rawDataDir.resolve(source.file());
            if (!Files.isRegularFile(file)) {
                if (source.required()) {
                    throw new InputMissingException("Source file for " + source.label() + " not found", file);
                }
                log.warn("Source file for {} not found, skipping: {}", source.label(), file);
                continue;
            }
            List<GeneSetRecord> loaded = loadSource(source, file);
            log.info("  {}: {} records, {} unique symbols ({})", source.label(), loaded.size(),
                    loaded.stream().map(GeneSetRecord::symbol).distinct().count(), file.getFileName());
            records.addAll(loaded);
        }

        if (records.isEmpty()) {
            throw new InputMissingException("No gene-set records in any source file", rawDataDir);
        }
        return List.copyOf(records);
    }

    private List<GeneSetRecord> loadSource(ReconcilerProperties.Source source, Path file) throws IOException {
        List<GeneSetRecord> records = new ArrayList<>();
        int line = 1;
        for (CsvTables.RawGeneSetRow row : csvTables.readRawGeneSets(file)) {
            line++;
            if (row.geneSymbol() == null || row.geneSymbol().isBlank()) continue;

            Polarity polarity = row.category() != null ? parsePolarity(row.category(), file, line) : source.polarity();
            if (polarity == null) {
                throw new IllegalArgumentException(file + ":" + line + ": no category and no polarity configured for "
                        + source.label());
            }
            Organism organism = row.organism() != null ? Organism.parse(row.organism()) : null;
            if (organism == null) organism = source.organism();
            if (organism == null) {
                throw new IllegalArgumentException(file + ":" + line + ": unknown organism '" + row.organism()
                        + "' and none configured for " + source.label());
            }
            records.add(new GeneSetRecord(row.geneSymbol().trim(), row.geneSetName(), source.label(), polarity, organism));
        }
        return records;
    }

    private static Polarity parsePolarity(String category, Path file, int line) {
        try {
            return Polarity.parse(category);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file + ":" + line + ": " + e.getMessage(), e);
        }
    }
}
