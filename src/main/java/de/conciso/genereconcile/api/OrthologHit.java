package de.conciso.genereconcile.api;

import java.util.List;

/**
 * Antwort der Ortholog-Suche für ein angefragtes Symbol.
 *
 * @param query            das Symbol wie gesendet
 * @param symbol           das offizielle Symbol laut Service (gleich query, wenn unbekannt)
 * @param targetEntrezIds  Entrez-IDs der Cluster-Mitglieder der Zielspezies, leer ohne Treffer
 */
public record OrthologHit(String query, String symbol, List<Long> targetEntrezIds) {

    public OrthologHit {
        targetEntrezIds = List.copyOf(targetEntrezIds);
    }

    public static OrthologHit notFound(String query) {
        return new OrthologHit(query, query, List.of());
    }

    public boolean found() {
        return !targetEntrezIds.isEmpty();
    }
}
