package de.conciso.genereconcile.model;

/**
 * Human/Maus-Symbolpaar. Bekannt ist nur die Entrez-ID der Seite, die als
 * speziesübergreifende ID nachgeschlagen wurde; die andere bleibt null.
 */
public record OrthologPair(
        String humanSymbol,
        String mouseSymbol,
        Long humanEntrez,
        Long mouseEntrez,
        MappingDirection direction
) {
    public PairKey key() {
        return new PairKey(humanSymbol, mouseSymbol);
    }

    /** Identität eines Paars, unabhängig von der Richtung, in der es gefunden wurde. */
    public record PairKey(String humanSymbol, String mouseSymbol) {}
}
