package de.conciso.genereconcile.model;

import java.util.Optional;

/**
 * Konsolidierter Eintrag plus Ensembl-Gen-IDs (best effort). Eine null-ID heißt: kein Treffer.
 */
public record AnnotatedGeneEntry(
        ConsolidatedGeneEntry entry,
        String humanEnsemblId,
        String mouseEnsemblId
) {
    public String humanSymbol() {
        return entry.humanSymbol();
    }

    public Category category() {
        return entry.category();
    }

    public Optional<String> humanEnsembl() {
        return Optional.ofNullable(humanEnsemblId);
    }

    public Optional<String> mouseEnsembl() {
        return Optional.ofNullable(mouseEnsemblId);
    }
}
