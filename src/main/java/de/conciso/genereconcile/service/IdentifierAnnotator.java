package de.conciso.genereconcile.service;

import de.conciso.genereconcile.api.GeneInfoService;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.AnnotatedGeneEntry;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.CoverageStats;
import de.conciso.genereconcile.model.Organism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Ergänzt klassifizierte Einträge um Ensembl-Gen-IDs. Best effort: Fehler und unbekannte
 * Symbole senken nur die Abdeckung.
 */
@Service
public class IdentifierAnnotator {

    private static final Logger log = LoggerFactory.getLogger(IdentifierAnnotator.class);

    private final GeneInfoService geneInfoService;
    private final BatchDispatcher dispatcher;
    private final GeneLookupCache cache;
    private final int batchSize;

    @Autowired
    public IdentifierAnnotator(GeneInfoService geneInfoService, BatchDispatcher dispatcher,
                               GeneLookupCache cache, ReconcilerProperties properties) {
        this(geneInfoService, dispatcher, cache, properties.batch().annotationSize());
    }

    IdentifierAnnotator(GeneInfoService geneInfoService, BatchDispatcher dispatcher,
                        GeneLookupCache cache, int batchSize) {
        this.geneInfoService = geneInfoService;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.batchSize = batchSize;
    }

    public record Result(List<AnnotatedGeneEntry> entries, CoverageStats human, CoverageStats mouse) {}

    public Result annotate(List<ConsolidatedGeneEntry> entries) {
        List<String> humanSymbols = distinctSorted(entries.stream().map(ConsolidatedGeneEntry::humanSymbol).toList());
        List<String> mouseSymbols = distinctSorted(entries.stream()
                .flatMap(e -> e.mouseSymbols().stream()).toList());

        Map<String, String> humanIds = lookup(humanSymbols, Organism.HUMAN);
        Map<String, String> mouseIds = lookup(mouseSymbols, Organism.MOUSE);

        List<AnnotatedGeneEntry> annotated = new ArrayList<>(entries.size());
        int humanMapped = 0;
        int mouseMapped = 0;
        int withMouse = 0;
        for (ConsolidatedGeneEntry entry : entries) {
            String humanId = humanIds.get(entry.humanSymbol());
            String mouseId = null;
            if (entry.hasMouseOrtholog()) {
                withMouse++;
                String joined = entry.mouseSymbols().stream()
                        .map(mouseIds::get)
                        .filter(Objects::nonNull)
                        .collect(Collectors.joining(","));
                mouseId = joined.isEmpty() ? null : joined;
            }
            if (humanId != null) humanMapped++;
            if (mouseId != null) mouseMapped++;
            annotated.add(new AnnotatedGeneEntry(entry, humanId, mouseId));
        }

        CoverageStats human = new CoverageStats(Organism.HUMAN, humanMapped, entries.size());
        CoverageStats mouse = new CoverageStats(Organism.MOUSE, mouseMapped, withMouse);
        log.info("Ensembl id coverage - {}", human);
        log.info("Ensembl id coverage - {}", mouse);
        return new Result(List.copyOf(annotated), human, mouse);
    }

    private Map<String, String> lookup(List<String> symbols, Organism organism) {
        Map<String, String> mapped = new LinkedHashMap<>();
        List<String> toQuery = new ArrayList<>();
        Map<String, Optional<String>> cached = cache.ensemblIds(symbols, organism);
        for (String symbol : symbols) {
            Optional<String> hit = cached.get(symbol);
            if (hit == null) {
                toQuery.add(symbol);
            } else {
                hit.ifPresent(id -> mapped.put(symbol, id));
            }
        }

        log.info("Fetching Ensembl ids for {} {} symbols ({} cached)",
                symbols.size(), organism.label(), symbols.size() - toQuery.size());
        BatchOutcome<String, Map<String, String>> outcome = dispatcher.dispatch(
                organism.label() + " ensembl ids", toQuery, batchSize,
                batch -> geneInfoService.findEnsemblIds(batch, organism));
        for (BatchOutcome.Completed<String, Map<String, String>> done : outcome.completed()) {
            cache.putEnsemblIds(organism, done.items(), done.result());
            for (String symbol : done.items()) {
                String id = done.result().get(symbol);
                if (id != null && !id.isBlank()) mapped.put(symbol, id);
            }
        }
        if (outcome.failedBatches() > 0) {
            log.warn("{} of {} {} Ensembl batches failed", outcome.failedBatches(), outcome.totalBatches(),
                    organism.label());
        }
        log.info("  mapped {}/{} {} symbols", mapped.size(), symbols.size(), organism.label());
        return mapped;
    }

    private static List<String> distinctSorted(List<String> symbols) {
        return symbols.stream()
                .filter(s -> s != null && !s.isBlank())
                .collect(Collectors.toCollection(TreeSet::new))
                .stream().toList();
    }
}
