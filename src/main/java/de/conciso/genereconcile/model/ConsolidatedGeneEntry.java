package de.conciso.genereconcile.model;

import java.util.List;

/**
 * Eine Zeile der konsolidierten Tabelle. {@code mouseSymbols} und {@code sources} sind sortiert.
 */
public record ConsolidatedGeneEntry(
        String humanSymbol,
        List<String> mouseSymbols,
        Category category,
        List<String> sources,
        int evidenceScore
) {
    public ConsolidatedGeneEntry {
        mouseSymbols = List.copyOf(mouseSymbols);
        sources = List.copyOf(sources);
    }

    public boolean hasMouseOrtholog() {
        return !mouseSymbols.isEmpty();
    }

    public String mouseSymbolsJoined() {
        return String.join(",", mouseSymbols);
    }

    public String sourcesJoined() {
        return String.join(",", sources);
    }
}
