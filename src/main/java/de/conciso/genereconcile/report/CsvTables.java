package de.conciso.genereconcile.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.conciso.genereconcile.model.AnnotatedGeneEntry;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.MappingDirection;
import de.conciso.genereconcile.model.OrthologPair;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CSV-Layouts der Pipeline-Tabellen (Kopfzeile, kommagetrennt).
 */
@Component
public class CsvTables {

    private final CsvMapper csv;

    public CsvTables() {
        this.csv = new CsvMapper();
        this.csv.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
        this.csv.enable(CsvParser.Feature.TRIM_SPACES);
    }

    // --- Roh-Gen-Sets ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"gene_symbol", "gene_set_name", "source", "category", "organism"})
    public record RawGeneSetRow(
            @JsonProperty("gene_symbol") String geneSymbol,
            @JsonProperty("gene_set_name") String geneSetName,
            @JsonProperty("source") String source,
            @JsonProperty("category") String category,
            @JsonProperty("organism") String organism
    ) {}

    public List<RawGeneSetRow> readRawGeneSets(Path path) throws IOException {
        return read(path, RawGeneSetRow.class);
    }

    public void writeRawGeneSets(Path path, List<RawGeneSetRow> rows) throws IOException {
        write(path, RawGeneSetRow.class, rows);
    }

    // --- Ortholog-Tabelle ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"human_symbol", "mouse_symbol", "human_entrez", "mouse_entrez", "mapping_source"})
    record OrthologRow(
            @JsonProperty("human_symbol") String humanSymbol,
            @JsonProperty("mouse_symbol") String mouseSymbol,
            @JsonProperty("human_entrez") Long humanEntrez,
            @JsonProperty("mouse_entrez") Long mouseEntrez,
            @JsonProperty("mapping_source") String mappingSource
    ) {}

    @JsonPropertyOrder({"human_symbol", "mouse_symbol"})
    record SymbolPairRow(
            @JsonProperty("human_symbol") String humanSymbol,
            @JsonProperty("mouse_symbol") String mouseSymbol
    ) {}

    public void writeOrthologTable(Path full, Path simple, List<OrthologPair> pairs) throws IOException {
        write(full, OrthologRow.class, pairs.stream()
                .map(p -> new OrthologRow(p.humanSymbol(), p.mouseSymbol(), p.humanEntrez(), p.mouseEntrez(),
                        p.direction().label()))
                .toList());
        Set<SymbolPairRow> symbolPairs = new LinkedHashSet<>();
        for (OrthologPair p : pairs) {
            symbolPairs.add(new SymbolPairRow(p.humanSymbol(), p.mouseSymbol()));
        }
        write(simple, SymbolPairRow.class, List.copyOf(symbolPairs));
    }

    public List<OrthologPair> readOrthologTable(Path full) throws IOException {
        return read(full, OrthologRow.class).stream()
                .filter(r -> r.humanSymbol() != null && r.mouseSymbol() != null)
                .map(r -> new OrthologPair(r.humanSymbol(), r.mouseSymbol(), r.humanEntrez(), r.mouseEntrez(),
                        r.mappingSource() == null ? MappingDirection.HUMAN_TO_MOUSE
                                : MappingDirection.parse(r.mappingSource())))
                .toList();
    }

    // --- konsolidierte und finale Tabelle ---

    @JsonPropertyOrder({"human_symbol", "mouse_symbol", "category", "sources", "evidence_score"})
    record ConsolidatedRow(
            @JsonProperty("human_symbol") String humanSymbol,
            @JsonProperty("mouse_symbol") String mouseSymbol,
            @JsonProperty("category") String category,
            @JsonProperty("sources") String sources,
            @JsonProperty("evidence_score") int evidenceScore
    ) {}

    @JsonPropertyOrder({"human_symbol", "human_ensembl_id", "mouse_symbol", "mouse_ensembl_id",
            "category", "sources", "evidence_score"})
    record AnnotatedRow(
            @JsonProperty("human_symbol") String humanSymbol,
            @JsonProperty("human_ensembl_id") String humanEnsemblId,
            @JsonProperty("mouse_symbol") String mouseSymbol,
            @JsonProperty("mouse_ensembl_id") String mouseEnsemblId,
            @JsonProperty("category") String category,
            @JsonProperty("sources") String sources,
            @JsonProperty("evidence_score") int evidenceScore
    ) {}

    public void writeConsolidated(Path path, List<ConsolidatedGeneEntry> entries) throws IOException {
        write(path, ConsolidatedRow.class, entries.stream()
                .map(e -> new ConsolidatedRow(e.humanSymbol(), e.mouseSymbolsJoined(), e.category().label(),
                        e.sourcesJoined(), e.evidenceScore()))
                .toList());
    }

    public void writeAnnotated(Path path, List<AnnotatedGeneEntry> entries) throws IOException {
        write(path, AnnotatedRow.class, entries.stream()
                .map(a -> new AnnotatedRow(a.humanSymbol(), a.humanEnsemblId(), a.entry().mouseSymbolsJoined(),
                        a.mouseEnsemblId(), a.category().label(), a.entry().sourcesJoined(),
                        a.entry().evidenceScore()))
                .toList());
    }

    // --- Hilfsmethoden ---

    private <T> List<T> read(Path path, Class<T> type) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<T> it = csv.readerFor(type).with(schema).readValues(path.toFile())) {
            return it.readAll();
        }
    }

    private <T> void write(Path path, Class<T> type, List<T> rows) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        CsvSchema schema = csv.schemaFor(type).withHeader();
        if (rows.isEmpty()) {
            // ohne Zeile schreibt der Writer keinen Header; Datei bleibt lesbar
            List<String> names = new ArrayList<>();
            for (CsvSchema.Column column : schema) {
                names.add(column.getName());
            }
            Files.writeString(path, String.join(",", names) + "\n", StandardCharsets.UTF_8);
            return;
        }
        try (SequenceWriter writer = csv.writerFor(type).with(schema).writeValues(path.toFile())) {
            writer.writeAll(rows);
        }
    }
}
