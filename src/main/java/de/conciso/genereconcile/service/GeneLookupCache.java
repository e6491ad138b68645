package de.conciso.genereconcile.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.conciso.genereconcile.api.OrthologHit;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.Organism;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Antworten der Lookups, Schlüssel ist (Symbol oder ID, Organismus). Auch Fehltreffer
 * werden gecacht; ein Symbol aus mehreren Quelldateien wird pro Lauf nur einmal gesendet.
 */
@Component
public class GeneLookupCache {

    public record LookupKey(String value, Organism organism) {}

    private final Cache<LookupKey, OrthologHit> orthologs;
    private final Cache<LookupKey, Optional<String>> symbols;
    private final Cache<LookupKey, Optional<String>> ensemblIds;

    @Autowired
    public GeneLookupCache(ReconcilerProperties properties) {
        this(properties.cache().maxSize());
    }

    GeneLookupCache(long maxSize) {
        this.orthologs = Caffeine.newBuilder().maximumSize(maxSize).build();
        this.symbols = Caffeine.newBuilder().maximumSize(maxSize).build();
        this.ensemblIds = Caffeine.newBuilder().maximumSize(maxSize).build();
    }

    public Optional<OrthologHit> ortholog(String symbol, Organism organism) {
        return Optional.ofNullable(orthologs.getIfPresent(new LookupKey(symbol, organism)));
    }

    public void putOrtholog(Organism organism, OrthologHit hit) {
        orthologs.put(new LookupKey(hit.query(), organism), hit);
    }

    /**
     * @return die gecachten Antworten für bereits nachgeschlagene IDs; ein leeres
     * Optional markiert eine ID, die der Service nicht auflösen konnte
     */
    public Map<Long, Optional<String>> symbols(Collection<Long> entrezIds, Organism organism) {
        Map<Long, Optional<String>> found = new LinkedHashMap<>();
        for (Long id : entrezIds) {
            Optional<String> cached = symbols.getIfPresent(new LookupKey(String.valueOf(id), organism));
            if (cached != null) found.put(id, cached);
        }
        return found;
    }

    public void putSymbols(Organism organism, Collection<Long> queried, Map<Long, String> resolved) {
        for (Long id : queried) {
            symbols.put(new LookupKey(String.valueOf(id), organism), Optional.ofNullable(resolved.get(id)));
        }
    }

    public Map<String, Optional<String>> ensemblIds(Collection<String> geneSymbols, Organism organism) {
        Map<String, Optional<String>> found = new LinkedHashMap<>();
        for (String symbol : geneSymbols) {
            Optional<String> cached = ensemblIds.getIfPresent(new LookupKey(symbol, organism));
            if (cached != null) found.put(symbol, cached);
        }
        return found;
    }

    public void putEnsemblIds(Organism organism, Collection<String> queried, Map<String, String> mapped) {
        for (String symbol : queried) {
            ensemblIds.put(new LookupKey(symbol, organism), Optional.ofNullable(mapped.get(symbol)));
        }
    }
}
