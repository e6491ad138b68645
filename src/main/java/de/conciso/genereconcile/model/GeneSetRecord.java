package de.conciso.genereconcile.model;

import java.util.Objects;

/**
 * Eine Gen-in-Set-Zugehörigkeit, wie sie eine Quelltabelle liefert.
 * {@code source} ist das konfigurierte Quellen-Label (z.B. GO_Pro_Human), nicht der Datenbankname.
 */
public record GeneSetRecord(
        String symbol,
        String geneSetName,
        String source,
        Polarity polarity,
        Organism organism
) {
    public GeneSetRecord {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(polarity, "polarity");
        Objects.requireNonNull(organism, "organism");
    }
}
