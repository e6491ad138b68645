package de.conciso.genereconcile.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourcePatternTest {

    @Test
    void containsMatchesAnywhereInTheLabel() {
        SourcePattern kegg = new SourcePattern("KEGG", "KEGG", SourcePattern.MatchMode.CONTAINS);

        assertThat(kegg.matches("KEGG")).isTrue();
        assertThat(kegg.matches("Human_KEGG_2021")).isTrue();
        assertThat(kegg.matches("Reactome")).isFalse();
    }

    @Test
    void prefixOnlyMatchesTheStart() {
        SourcePattern go = new SourcePattern("GO", "GO_", SourcePattern.MatchMode.PREFIX);

        assertThat(go.matches("GO_Pro_Human")).isTrue();
        assertThat(go.matches("GO_Anti_Mouse")).isTrue();
        assertThat(go.matches("CUSTOM_GO_Pro")).isFalse();
    }
}
