package de.conciso.genereconcile.service;

import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.Classification;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.EvidenceProfile;
import de.conciso.genereconcile.model.EvidenceTable;
import de.conciso.genereconcile.model.Polarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryClassifierTest {

    private final CategoryClassifier classifier = new CategoryClassifier();

    static Stream<Arguments> combinations() {
        return Stream.of(
                Arguments.of(true, false, false, Category.PRO_APOPTOTIC),
                Arguments.of(false, true, false, Category.ANTI_APOPTOTIC),
                Arguments.of(false, false, true, Category.UNSPECIFIED),
                Arguments.of(true, true, false, Category.AMBIGUOUS),
                Arguments.of(true, false, true, Category.PRO_APOPTOTIC),
                Arguments.of(false, true, true, Category.ANTI_APOPTOTIC),
                Arguments.of(true, true, true, Category.AMBIGUOUS));
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest(name = "pro={0} anti={1} general={2} -> {3}")
        @MethodSource("de.conciso.genereconcile.service.CategoryClassifierTest#combinations")
        void everyNonEmptyCombinationHasExactlyOneCategory(boolean pro, boolean anti, boolean general,
                                                           Category expected) {
            EvidenceTable table = new EvidenceTable();
            EvidenceProfile profile = null;
            if (pro) profile = table.file("GENE", Polarity.PRO, "P");
            if (anti) profile = table.file("GENE", Polarity.ANTI, "A");
            if (general) profile = table.file("GENE", Polarity.GENERAL, "G");

            Classification c = classifier.classify(profile);

            assertThat(c.category()).isEqualTo(expected);
            assertThat(c.evidenceScore()).isEqualTo((pro ? 1 : 0) + (anti ? 1 : 0) + (general ? 1 : 0));
        }

        @Test
        @DisplayName("a source filing several polarities counts once")
        void scoreCountsDistinctSources() {
            EvidenceTable table = new EvidenceTable();
            table.file("BID", Polarity.PRO, "Reactome");
            EvidenceProfile profile = table.file("BID", Polarity.ANTI, "Reactome");

            Classification c = classifier.classify(profile);

            assertThat(c.category()).isEqualTo(Category.AMBIGUOUS);
            assertThat(c.evidenceScore()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("consolidate")
    class Consolidate {

        @Test
        void sortsByScoreThenSymbolIgnoringCase() {
            EvidenceTable table = new EvidenceTable();
            table.file("bax", Polarity.PRO, "GO_Pro_Human");
            table.file("CASP3", Polarity.PRO, "GO_Pro_Human");
            table.file("CASP3", Polarity.GENERAL, "KEGG");
            table.file("AIFM1", Polarity.GENERAL, "Hallmark");

            List<ConsolidatedGeneEntry> entries = classifier.consolidate(table);

            assertThat(entries).extracting(ConsolidatedGeneEntry::humanSymbol)
                    .containsExactly("CASP3", "AIFM1", "bax");
            assertThat(entries.get(0).sources()).containsExactly("GO_Pro_Human", "KEGG");
            assertThat(entries.get(0).evidenceScore()).isEqualTo(2);
        }

        @Test
        void emptyTableIsFatal() {
            assertThatThrownBy(() -> classifier.consolidate(new EvidenceTable()))
                    .isInstanceOf(NoEvidenceFoundException.class)
                    .satisfies(e -> assertThat(((NoEvidenceFoundException) e).getExitCode()).isEqualTo(4));
        }
    }
}
