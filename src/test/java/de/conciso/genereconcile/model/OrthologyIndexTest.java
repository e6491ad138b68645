package de.conciso.genereconcile.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrthologyIndexTest {

    private static OrthologPair pair(String human, String mouse) {
        return new OrthologPair(human, mouse, null, null, MappingDirection.HUMAN_TO_MOUSE);
    }

    @Test
    @DisplayName("forward lookup keeps every mouse ortholog")
    void forwardIsMultiValued() {
        OrthologyIndex index = OrthologyIndex.of(List.of(pair("BCL2L1", "Bcl2l1"), pair("BCL2L1", "Bcl2l1b")), 0);

        assertThat(index.mouseOrthologs("BCL2L1")).containsExactly("Bcl2l1", "Bcl2l1b");
        assertThat(index.mouseOrthologs("UNKNOWN")).isEmpty();
    }

    @Test
    @DisplayName("reverse lookup keeps the pair processed last")
    void reverseIsLastWriteWins() {
        OrthologyIndex index = OrthologyIndex.of(List.of(pair("CASP3", "Casp3"), pair("CASP3B", "Casp3")), 0);

        assertThat(index.humanOrtholog("Casp3")).contains("CASP3B");
        assertThat(index.mouseOrthologs("CASP3")).containsExactly("Casp3");
        assertThat(index.humanOrtholog("Trp53")).isEmpty();
    }

    @Test
    void emptyIndex() {
        OrthologyIndex index = OrthologyIndex.empty();

        assertThat(index.isEmpty()).isTrue();
        assertThat(index.duplicatesRemoved()).isZero();
        assertThat(index.pairs()).isEmpty();
        assertThat(index.mouseOrthologs("TP53")).isEmpty();
    }
}
