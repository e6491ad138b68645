package de.conciso.genereconcile.report;

import de.conciso.genereconcile.model.AnnotatedGeneEntry;
import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.MappingDirection;
import de.conciso.genereconcile.model.OrthologPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvTablesTest {

    @TempDir
    Path dir;

    private final CsvTables csvTables = new CsvTables();

    @Test
    @DisplayName("ortholog table survives a write and read, unknown entrez ids included")
    void orthologTableRoundTrip() throws IOException {
        List<OrthologPair> pairs = List.of(
                new OrthologPair("BAX", "Bax", 581L, null, MappingDirection.MOUSE_TO_HUMAN),
                new OrthologPair("TP53", "Trp53", null, 22059L, MappingDirection.HUMAN_TO_MOUSE));
        Path full = dir.resolve("orthology_mapping_full.csv");
        Path simple = dir.resolve("orthology_mapping.csv");

        csvTables.writeOrthologTable(full, simple, pairs);

        assertThat(csvTables.readOrthologTable(full)).isEqualTo(pairs);
        assertThat(Files.readAllLines(full).get(0))
                .isEqualTo("human_symbol,mouse_symbol,human_entrez,mouse_entrez,mapping_source");
        assertThat(Files.readAllLines(simple)).containsExactly("human_symbol,mouse_symbol", "BAX,Bax", "TP53,Trp53");
    }

    @Test
    void annotatedTableQuotesJoinedColumns() throws IOException {
        ConsolidatedGeneEntry entry = new ConsolidatedGeneEntry("BCL2L1", List.of("Bcl2l1", "Bcl2l1b"),
                Category.AMBIGUOUS, List.of("GO_Anti_Human", "GO_Pro_Human"), 2);
        Path file = dir.resolve("final.csv");

        csvTables.writeAnnotated(file, List.of(new AnnotatedGeneEntry(entry, "ENSG00000171552", null)));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(0)).isEqualTo(
                "human_symbol,human_ensembl_id,mouse_symbol,mouse_ensembl_id,category,sources,evidence_score");
        assertThat(lines.get(1)).isEqualTo(
                "BCL2L1,ENSG00000171552,\"Bcl2l1,Bcl2l1b\",,Ambiguous,\"GO_Anti_Human,GO_Pro_Human\",2");
    }

    @Test
    void emptyTableStillHasHeader() throws IOException {
        Path file = dir.resolve("consolidated.csv");

        csvTables.writeConsolidated(file, List.of());

        assertThat(Files.readAllLines(file))
                .containsExactly("human_symbol,mouse_symbol,category,sources,evidence_score");
    }
}
