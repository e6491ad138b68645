package de.conciso.genereconcile.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.AnnotatedGeneEntry;
import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.CoverageStats;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.MappingDirection;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.OrthologPair;
import de.conciso.genereconcile.model.OrthologyIndex;
import de.conciso.genereconcile.model.Polarity;
import de.conciso.genereconcile.model.SourcePattern;
import de.conciso.genereconcile.service.IdentifierAnnotator;
import de.conciso.genereconcile.service.PipelineResult;
import de.conciso.genereconcile.service.SourceBreakdownGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    @TempDir
    Path output;

    private PipelineResult result;

    @BeforeEach
    void setUp() {
        List<GeneSetRecord> records = List.of(
                new GeneSetRecord("TP53", "pos", "GO_Pro_Human", Polarity.PRO, Organism.HUMAN),
                new GeneSetRecord("TP53", "kegg", "KEGG", Polarity.GENERAL, Organism.HUMAN),
                new GeneSetRecord("AIFM1", "hallmark", "Hallmark", Polarity.GENERAL, Organism.HUMAN),
                new GeneSetRecord("Trp53", "pos", "GO_Pro_Mouse", Polarity.PRO, Organism.MOUSE));
        OrthologyIndex index = OrthologyIndex.of(List.of(
                new OrthologPair("TP53", "Trp53", null, 22059L, MappingDirection.HUMAN_TO_MOUSE)), 1);

        ConsolidatedGeneEntry tp53 = new ConsolidatedGeneEntry("TP53", List.of("Trp53"), Category.PRO_APOPTOTIC,
                List.of("GO_Pro_Human", "GO_Pro_Mouse", "KEGG"), 3);
        ConsolidatedGeneEntry aifm1 = new ConsolidatedGeneEntry("AIFM1", List.of(), Category.UNSPECIFIED,
                List.of("Hallmark"), 1);
        List<AnnotatedGeneEntry> annotated = List.of(
                new AnnotatedGeneEntry(tp53, "ENSG00000141510", "ENSMUSG00000059552"),
                new AnnotatedGeneEntry(aifm1, null, null));
        IdentifierAnnotator.Result annotation = new IdentifierAnnotator.Result(annotated,
                new CoverageStats(Organism.HUMAN, 1, 2), new CoverageStats(Organism.MOUSE, 1, 1));

        result = new PipelineResult(records, index, List.of(tp53, aifm1), annotation,
                new SourceBreakdownGenerator().breakdown(annotated, List.of(
                        new SourcePattern("KEGG", "KEGG", SourcePattern.MatchMode.CONTAINS),
                        new SourcePattern("Hallmark", "Hallmark", SourcePattern.MatchMode.CONTAINS),
                        new SourcePattern("GO", "GO_", SourcePattern.MatchMode.PREFIX))));
    }

    private ReconcilerProperties properties(boolean reuse) {
        return new ReconcilerProperties("reconcile",
                new ReconcilerProperties.Paths(output, output),
                new ReconcilerProperties.MyGene("http://localhost", Duration.ofSeconds(1)),
                new ReconcilerProperties.Enrichr("http://localhost", "http://localhost", Duration.ofSeconds(1), 3),
                new ReconcilerProperties.Batch(500, 200, 4),
                new ReconcilerProperties.Retry(3, Duration.ofMillis(500), 2.0),
                new ReconcilerProperties.Cache(1000),
                new ReconcilerProperties.Orthology(reuse),
                List.of(), List.of());
    }

    private ReportWriter writer(boolean reuse) {
        ReconcilerProperties properties = properties(reuse);
        return new ReportWriter(properties, new CsvTables(), new ConsolidationSummaryWriter(),
                new BreakdownSummaryWriter(), new JsonReportWriter(properties));
    }

    @Nested
    @DisplayName("files")
    class Outputs {

        @Test
        void writesEveryOutput() {
            writer(false).write(result);

            assertThat(output.resolve(ReportWriter.ORTHOLOGY_FULL_FILE)).exists();
            assertThat(output.resolve(ReportWriter.ORTHOLOGY_FILE)).exists();
            assertThat(output.resolve(ReportWriter.CONSOLIDATED_FILE)).exists();
            assertThat(output.resolve(ReportWriter.CATEGORY_SUMMARY_FILE)).exists();
            assertThat(output.resolve(ReportWriter.FINAL_FILE)).exists();
            assertThat(output.resolve(ReportWriter.RUN_SUMMARY_FILE)).exists();
            Path breakdown = output.resolve(ReportWriter.BREAKDOWN_DIR);
            assertThat(breakdown.resolve("apoptosis_genes_KEGG.csv")).exists();
            assertThat(breakdown.resolve("apoptosis_genes_Hallmark.csv")).exists();
            assertThat(breakdown.resolve("apoptosis_genes_GO.csv")).exists();
            assertThat(breakdown.resolve(ReportWriter.BREAKDOWN_SUMMARY_FILE)).exists();
        }

        @Test
        @DisplayName("a reused ortholog table is not overwritten")
        void keepsReusedOrthologTable() throws IOException {
            Path table = output.resolve(ReportWriter.ORTHOLOGY_FULL_FILE);
            Files.writeString(table, "human_symbol,mouse_symbol,human_entrez,mouse_entrez,mapping_source\n");

            writer(true).write(result);

            assertThat(Files.readAllLines(table)).hasSize(1);
            assertThat(output.resolve(ReportWriter.ORTHOLOGY_FILE)).doesNotExist();
        }

        @Test
        void breakdownFileNamesAreSanitized() {
            assertThat(ReportWriter.breakdownFileName("GO/BP 2023")).isEqualTo("apoptosis_genes_GO_BP_2023.csv");
        }
    }

    @Nested
    @DisplayName("summaries")
    class Summaries {

        @Test
        void categorySummaryListsDistributionAndTopGenes() throws IOException {
            writer(false).write(result);

            String summary = Files.readString(output.resolve(ReportWriter.CATEGORY_SUMMARY_FILE));
            assertThat(summary)
                    .contains("Total unique human genes: 2")
                    .contains("Genes with mouse orthologs: 1 (50.0%)")
                    .contains("Average evidence score: 2.00")
                    .contains("Pro-apoptotic: 1 (50.0%)")
                    .contains("Anti-apoptotic: 0 (0.0%)")
                    .contains("3 source(s): 1 genes")
                    .contains("TP53: Pro-apoptotic (score=3, sources: GO_Pro_Human,GO_Pro_Mouse,KEGG)");
            assertThat(summary.indexOf("Pro-apoptotic:")).isLessThan(summary.indexOf("Unspecified:"));
        }

        @Test
        void breakdownSummaryHasTotalsPerLabel() throws IOException {
            writer(false).write(result);

            String summary = Files.readString(output.resolve(ReportWriter.BREAKDOWN_DIR)
                    .resolve(ReportWriter.BREAKDOWN_SUMMARY_FILE));
            assertThat(summary).contains("Generated: ").contains("Notes:");
            assertThat(summary).containsPattern("KEGG\\n-+\\n  Pro-apoptotic\\s+:\\s+1 genes");
            assertThat(summary).containsPattern("TOTAL\\s+:\\s+1 genes");
        }

        @Test
        void runSummaryCarriesStageCounts() throws IOException {
            writer(false).write(result);

            JsonNode json = new ObjectMapper().readTree(output.resolve(ReportWriter.RUN_SUMMARY_FILE).toFile());
            assertThat(json.path("orthology").path("totalPairs").asInt()).isEqualTo(1);
            assertThat(json.path("orthology").path("duplicatesRemoved").asInt()).isEqualTo(1);
            assertThat(json.path("orthology").path("humanCoveragePercent").asDouble()).isEqualTo(50.0);
            assertThat(json.path("consolidation").path("categories").path("Unspecified").asInt()).isEqualTo(1);
            assertThat(json.path("sourceBreakdown").path("GO").path("Pro-apoptotic").asInt()).isEqualTo(1);
            assertThat(json.path("recordsBySource").path("KEGG").asInt()).isEqualTo(1);
            assertThat(json.path("configuration").path("orthologBatchSize").asInt()).isEqualTo(500);
        }

        @Test
        @DisplayName("run summary reports one-to-many orthologs per direction")
        void runSummaryCarriesCardinality() throws IOException {
            OrthologyIndex fanOut = OrthologyIndex.of(List.of(
                    new OrthologPair("BCL2L1", "Bcl2l1", null, null, MappingDirection.HUMAN_TO_MOUSE),
                    new OrthologPair("TP53", "Trp53", null, 22059L, MappingDirection.HUMAN_TO_MOUSE),
                    new OrthologPair("TP53", "Trp53b", null, null, MappingDirection.MOUSE_TO_HUMAN)), 0);
            PipelineResult withFanOut = new PipelineResult(result.records(), fanOut, result.consolidated(),
                    result.annotation(), result.breakdowns());

            writer(false).write(withFanOut);

            JsonNode orthology = new ObjectMapper().readTree(output.resolve(ReportWriter.RUN_SUMMARY_FILE).toFile())
                    .path("orthology");
            assertThat(orthology.path("humanWithOrthologs").asInt()).isEqualTo(2);
            assertThat(orthology.path("mouseWithOrthologs").asInt()).isEqualTo(3);
            assertThat(orthology.path("humanWithMultipleMouse").asInt()).isEqualTo(1);
            assertThat(orthology.path("mouseWithMultipleHuman").asInt()).isZero();
            assertThat(orthology.path("maxMousePerHuman").asInt()).isEqualTo(2);
            assertThat(orthology.path("maxHumanPerMouse").asInt()).isEqualTo(1);
            assertThat(orthology.path("pairsByMappingSource").path("mouse_to_human").asInt()).isEqualTo(1);
        }
    }
}
