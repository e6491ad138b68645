package de.conciso.genereconcile.service;

import de.conciso.genereconcile.config.ReconcilerProperties.Source;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.Polarity;
import de.conciso.genereconcile.report.CsvTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneSetRecordLoaderTest {

    private static final String HEADER = "gene_symbol,gene_set_name,source,category,organism\n";

    @TempDir
    Path rawData;

    private static Source source(String label, String file, Organism organism, Polarity polarity, boolean required) {
        return new Source(label, file, organism, polarity, required, null, null, null, null);
    }

    private GeneSetRecordLoader loader(Source... sources) {
        return new GeneSetRecordLoader(rawData, List.of(sources), new CsvTables());
    }

    private void write(String file, String content) throws IOException {
        Files.writeString(rawData.resolve(file), content);
    }

    @Nested
    @DisplayName("rows")
    class Rows {

        @Test
        void readsPolarityAndOrganismFromColumns() throws IOException {
            write("go_pro.csv", HEADER
                    + "TP53,GOBP_POSITIVE_REGULATION_OF_APOPTOTIC_PROCESS,GO_BP,pro,Human\n"
                    + "Bax,GOBP_POSITIVE_REGULATION_OF_APOPTOTIC_PROCESS,GO_BP,PRO,mouse\n");

            List<GeneSetRecord> records = loader(source("GO_Pro", "go_pro.csv", null, null, true)).load();

            assertThat(records).containsExactly(
                    new GeneSetRecord("TP53", "GOBP_POSITIVE_REGULATION_OF_APOPTOTIC_PROCESS", "GO_Pro",
                            Polarity.PRO, Organism.HUMAN),
                    new GeneSetRecord("Bax", "GOBP_POSITIVE_REGULATION_OF_APOPTOTIC_PROCESS", "GO_Pro",
                            Polarity.PRO, Organism.MOUSE));
        }

        @Test
        @DisplayName("the configured source label wins over the source column")
        void configuredLabelIsTheSource() throws IOException {
            write("kegg.csv", HEADER + "CASP3,KEGG_APOPTOSIS,KEGG_2021_Human,General,Human\n");

            List<GeneSetRecord> records = loader(source("KEGG", "kegg.csv", Organism.HUMAN, null, true)).load();

            assertThat(records).extracting(GeneSetRecord::source).containsExactly("KEGG");
        }

        @Test
        void fallsBackToConfiguredValues() throws IOException {
            write("minimal.csv", "gene_symbol,extra\nBCL2,ignored\n");

            List<GeneSetRecord> records = loader(
                    source("GO_Anti_Human", "minimal.csv", Organism.HUMAN, Polarity.ANTI, true)).load();

            assertThat(records).singleElement().satisfies(r -> {
                assertThat(r.polarity()).isEqualTo(Polarity.ANTI);
                assertThat(r.organism()).isEqualTo(Organism.HUMAN);
            });
        }

        @Test
        void skipsBlankSymbols() throws IOException {
            write("hallmark.csv", HEADER
                    + ",HALLMARK_APOPTOSIS,MSigDB,General,Human\n"
                    + "   ,HALLMARK_APOPTOSIS,MSigDB,General,Human\n"
                    + "AIFM1,HALLMARK_APOPTOSIS,MSigDB,General,Human\n");

            List<GeneSetRecord> records = loader(source("Hallmark", "hallmark.csv", null, null, true)).load();

            assertThat(records).extracting(GeneSetRecord::symbol).containsExactly("AIFM1");
        }

        @Test
        void unknownCategoryNamesFileAndLine() throws IOException {
            write("bad.csv", HEADER + "TP53,set,x,Pro,Human\nBAX,set,x,Maybe,Human\n");

            assertThatThrownBy(() -> loader(source("Bad", "bad.csv", null, null, true)).load())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("bad.csv:3")
                    .hasMessageContaining("Maybe");
        }
    }

    @Nested
    @DisplayName("files")
    class SourceFiles {

        @Test
        void missingRequiredFileIsFatal() {
            assertThatThrownBy(() -> loader(source("KEGG", "kegg.csv", Organism.HUMAN, Polarity.GENERAL, true)).load())
                    .isInstanceOf(InputMissingException.class)
                    .satisfies(e -> {
                        InputMissingException ime = (InputMissingException) e;
                        assertThat(ime.getPath()).isEqualTo(rawData.resolve("kegg.csv"));
                        assertThat(ime.getExitCode()).isEqualTo(2);
                    });
        }

        @Test
        void missingOptionalFileIsSkipped() throws IOException {
            write("kegg.csv", HEADER + "CASP8,KEGG_APOPTOSIS,KEGG,General,Human\n");

            List<GeneSetRecord> records = loader(
                    source("KEGG", "kegg.csv", Organism.HUMAN, Polarity.GENERAL, true),
                    source("GO_Pro_Mouse", "mouse_go_pro.csv", Organism.MOUSE, Polarity.PRO, false)).load();

            assertThat(records).hasSize(1);
        }

        @Test
        void noRecordsAtAllIsFatal() throws IOException {
            write("empty.csv", HEADER);

            assertThatThrownBy(() -> loader(source("Empty", "empty.csv", Organism.HUMAN, Polarity.PRO, true)).load())
                    .isInstanceOf(InputMissingException.class);
        }
    }
}
