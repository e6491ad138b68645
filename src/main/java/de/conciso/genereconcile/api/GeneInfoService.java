package de.conciso.genereconcile.api;

import de.conciso.genereconcile.model.Organism;

import java.util.List;
import java.util.Map;

/**
 * Dienst für Gen-Identifier. Jeder Aufruf ist ein Batch. Implementierungen werfen bei
 * Transport- oder Service-Fehlern und lassen unbekannte Eingaben im Ergebnis weg.
 */
public interface GeneInfoService {

    /**
     * Symbol auf speziesübergreifende Entrez-IDs von {@code target}.
     */
    List<OrthologHit> findOrthologs(List<String> symbols, Organism organism, Organism target);

    /**
     * Entrez-ID auf offizielles Symbol.
     */
    Map<Long, String> resolveSymbols(List<Long> entrezIds, Organism organism);

    /**
     * Symbol auf Ensembl-Gen-ID.
     */
    Map<String, String> findEnsemblIds(List<String> symbols, Organism organism);
}
