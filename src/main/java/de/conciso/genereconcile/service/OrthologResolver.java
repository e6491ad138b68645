package de.conciso.genereconcile.service;

import de.conciso.genereconcile.api.GeneInfoService;
import de.conciso.genereconcile.api.OrthologHit;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.MappingDirection;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.OrthologPair;
import de.conciso.genereconcile.model.OrthologyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Baut den Human/Maus-Ortholog-Index aus zwei Symbolmengen.
 * <p>
 * Abgefragt werden beide Richtungen, weil der Service nicht symmetrisch antwortet. Die
 * gefundenen Entrez-IDs der Zielspezies werden in einer zweiten Runde zu Symbolen aufgelöst;
 * IDs ohne Symbol fallen weg. Fehlgeschlagene Batches senken die Abdeckung. Abgebrochen wird
 * nur, wenn der Service gar nicht erreichbar war und kein Paar entstand.
 */
@Service
public class OrthologResolver {

    private static final Logger log = LoggerFactory.getLogger(OrthologResolver.class);

    private static final Comparator<OrthologPair> PAIR_ORDER =
            Comparator.comparing(OrthologPair::humanSymbol).thenComparing(OrthologPair::mouseSymbol);

    private final GeneInfoService geneInfoService;
    private final BatchDispatcher dispatcher;
    private final GeneLookupCache cache;
    private final int batchSize;

    @Autowired
    public OrthologResolver(GeneInfoService geneInfoService, BatchDispatcher dispatcher,
                            GeneLookupCache cache, ReconcilerProperties properties) {
        this(geneInfoService, dispatcher, cache, properties.batch().orthologSize());
    }

    OrthologResolver(GeneInfoService geneInfoService, BatchDispatcher dispatcher,
                     GeneLookupCache cache, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch size must be positive, was " + batchSize);
        }
        this.geneInfoService = geneInfoService;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.batchSize = batchSize;
    }

    public OrthologyIndex resolve(Set<String> humanSymbols, Set<String> mouseSymbols) {
        log.info("Building orthology mapping: {} human, {} mouse symbols", humanSymbols.size(), mouseSymbols.size());

        List<DirectionLookup> lookups = new ArrayList<>();
        for (MappingDirection direction : MappingDirection.values()) {
            Set<String> input = direction.source() == Organism.HUMAN ? humanSymbols : mouseSymbols;
            lookups.add(lookupDirection(direction, input));
        }

        List<OrthologPair> raw = new ArrayList<>();
        for (DirectionLookup lookup : lookups) {
            raw.addAll(lookup.pairs());
        }

        Map<OrthologPair.PairKey, OrthologPair> unique = new LinkedHashMap<>();
        for (OrthologPair pair : raw) {
            unique.putIfAbsent(pair.key(), pair);
        }
        int duplicates = raw.size() - unique.size();
        List<OrthologPair> pairs = new ArrayList<>(unique.values());
        pairs.sort(PAIR_ORDER);

        log.info("Ortholog pairs: {} total, {} duplicate pairs removed", pairs.size(), duplicates);

        if (pairs.isEmpty()) {
            boolean unreachable = lookups.stream().allMatch(DirectionLookup::unreachable)
                    && lookups.stream().anyMatch(DirectionLookup::attempted);
            if (unreachable) {
                throw new ServiceUnavailableException(
                        "Ortholog lookup failed for every batch in both directions; no pairs produced");
            }
            log.warn("No ortholog mappings found");
        }
        return OrthologyIndex.of(pairs, duplicates);
    }

    private DirectionLookup lookupDirection(MappingDirection direction, Set<String> symbols) {
        Organism source = direction.source();
        Organism target = direction.target();
        List<String> sorted = new ArrayList<>(new TreeSet<>(symbols));
        log.info("{} lookup for {} symbols", direction.label(), sorted.size());

        // Phase 1: Symbol -> Entrez-IDs der Zielspezies
        Map<String, OrthologHit> hitsByQuery = new LinkedHashMap<>();
        List<String> toQuery = new ArrayList<>();
        for (String symbol : sorted) {
            Optional<OrthologHit> cached = cache.ortholog(symbol, source);
            if (cached.isPresent()) {
                hitsByQuery.put(symbol, cached.get());
            } else {
                toQuery.add(symbol);
            }
        }

        BatchOutcome<String, List<OrthologHit>> hitOutcome = dispatcher.dispatch(
                direction.label() + " orthologs", toQuery, batchSize,
                batch -> geneInfoService.findOrthologs(batch, source, target));
        for (BatchOutcome.Completed<String, List<OrthologHit>> done : hitOutcome.completed()) {
            Map<String, OrthologHit> answered = new LinkedHashMap<>();
            for (OrthologHit hit : done.result()) {
                answered.putIfAbsent(hit.query(), hit);
            }
            for (String query : done.items()) {
                OrthologHit hit = answered.getOrDefault(query, OrthologHit.notFound(query));
                cache.putOrtholog(source, hit);
                hitsByQuery.put(query, hit);
            }
        }

        Map<String, Set<Long>> idsBySymbol = new LinkedHashMap<>();
        Set<Long> allTargetIds = new TreeSet<>();
        for (String symbol : sorted) {
            OrthologHit hit = hitsByQuery.get(symbol);
            if (hit == null || !hit.found()) continue;
            idsBySymbol.computeIfAbsent(hit.symbol(), k -> new LinkedHashSet<>()).addAll(hit.targetEntrezIds());
            allTargetIds.addAll(hit.targetEntrezIds());
        }
        log.info("{}: orthologs found for {}/{} symbols ({})", direction.label(),
                idsBySymbol.size(), sorted.size(), percent(idsBySymbol.size(), sorted.size()));

        // Phase 2: Entrez-ID der Zielspezies -> Symbol
        SymbolResolution resolution = resolveSymbols(direction, allTargetIds, target);

        List<OrthologPair> pairs = new ArrayList<>();
        idsBySymbol.forEach((sourceSymbol, ids) -> {
            for (Long id : ids) {
                String targetSymbol = resolution.symbols().get(id);
                if (targetSymbol == null || targetSymbol.isBlank()) continue;
                pairs.add(direction == MappingDirection.HUMAN_TO_MOUSE
                        ? new OrthologPair(sourceSymbol.toUpperCase(Locale.ROOT), targetSymbol, null, id, direction)
                        : new OrthologPair(targetSymbol.toUpperCase(Locale.ROOT), sourceSymbol, id, null, direction));
            }
        });
        log.info("{}: {} pairs built", direction.label(), pairs.size());

        boolean attempted = hitOutcome.totalBatches() > 0 || resolution.outcome().totalBatches() > 0;
        boolean unreachable = (hitOutcome.totalBatches() == 0 || hitOutcome.allFailed())
                && (resolution.outcome().totalBatches() == 0 || resolution.outcome().allFailed());
        return new DirectionLookup(pairs, attempted, unreachable);
    }

    private SymbolResolution resolveSymbols(MappingDirection direction, Collection<Long> ids, Organism organism) {
        Map<Long, String> symbols = new LinkedHashMap<>();
        List<Long> toQuery = new ArrayList<>();
        Map<Long, Optional<String>> cached = cache.symbols(ids, organism);
        for (Long id : ids) {
            Optional<String> hit = cached.get(id);
            if (hit == null) {
                toQuery.add(id);
            } else {
                hit.ifPresent(symbol -> symbols.put(id, symbol));
            }
        }

        BatchOutcome<Long, Map<Long, String>> outcome = dispatcher.dispatch(
                direction.label() + " symbols", toQuery, batchSize,
                batch -> geneInfoService.resolveSymbols(batch, organism));
        for (BatchOutcome.Completed<Long, Map<Long, String>> done : outcome.completed()) {
            cache.putSymbols(organism, done.items(), done.result());
            for (Long id : done.items()) {
                String symbol = done.result().get(id);
                if (symbol != null && !symbol.isBlank()) symbols.put(id, symbol);
            }
        }
        log.info("{}: resolved {}/{} {} entrez ids to symbols", direction.label(),
                symbols.size(), ids.size(), organism.label());
        return new SymbolResolution(symbols, outcome);
    }

    private static String percent(int part, int total) {
        return total == 0 ? "0.0%" : String.format("%.1f%%", 100.0 * part / total);
    }

    private record DirectionLookup(List<OrthologPair> pairs, boolean attempted, boolean unreachable) {}

    private record SymbolResolution(Map<Long, String> symbols, BatchOutcome<Long, Map<Long, String>> outcome) {}
}
