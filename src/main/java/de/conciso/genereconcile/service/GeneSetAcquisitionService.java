package de.conciso.genereconcile.service;

import de.conciso.genereconcile.api.GeneSetLibraryClient;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.report.CsvTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lädt die konfigurierten Bibliotheken und schreibt je Quelle eine Rohtabelle.
 * <p>
 * Pro Quelle werden zuerst die konfigurierten Bibliotheken der Reihe nach versucht, danach
 * die ersten gefundenen Bibliotheken des Organismus, deren Name alle {@code discover}-Begriffe
 * enthält. Die erste Bibliothek mit mindestens einem passenden Set gewinnt.
 */
@Service
public class GeneSetAcquisitionService {

    private static final Logger log = LoggerFactory.getLogger(GeneSetAcquisitionService.class);

    private final GeneSetLibraryClient libraryClient;
    private final CsvTables csvTables;
    private final Path rawDataDir;
    private final List<ReconcilerProperties.Source> sources;
    private final int discoveredCandidates;

    private final Map<LibraryKey, Optional<Map<String, List<String>>>> libraries = new HashMap<>();
    private final Map<Organism, List<String>> catalogs = new EnumMap<>(Organism.class);

    @Autowired
    public GeneSetAcquisitionService(GeneSetLibraryClient libraryClient, CsvTables csvTables,
                                     ReconcilerProperties properties) {
        this(libraryClient, csvTables, properties.paths().rawData(), properties.sources(),
                properties.enrichr().discoveredCandidates());
    }

    GeneSetAcquisitionService(GeneSetLibraryClient libraryClient, CsvTables csvTables,
                              Path rawDataDir, List<ReconcilerProperties.Source> sources,
                              int discoveredCandidates) {
        this.libraryClient = libraryClient;
        this.csvTables = csvTables;
        this.rawDataDir = rawDataDir;
        this.sources = sources;
        this.discoveredCandidates = discoveredCandidates;
    }

    /**
     * @return geschriebene Geneinträge je Quellen-Label; Quellen ohne Datei fehlen
     */
    public Map<String, Integer> acquire() throws IOException {
        Files.createDirectories(rawDataDir);
        libraries.clear();
        catalogs.clear();
        Map<String, Integer> written = new LinkedHashMap<>();

        for (ReconcilerProperties.Source source : sources) {
            if (!source.acquirable()) {
                log.info("{}: no library configured, skipping", source.label());
                continue;
            }
            if (source.polarity() == null || source.organism() == null) {
                log.warn("{}: polarity and organism are required for acquisition, skipping", source.label());
                continue;
            }

            Optional<Selection> selection = select(source);
            if (selection.isEmpty()) {
                log.warn("{}: no candidate library has a gene set matching {} / {}", source.label(),
                        source.requireAll(), source.requireAny());
                continue;
            }

            Selection chosen = selection.get();
            List<CsvTables.RawGeneSetRow> rows = new ArrayList<>();
            chosen.sets().forEach((name, genes) -> {
                log.info("  {}: {} ({} genes)", source.label(), name, genes.size());
                for (String gene : genes) {
                    rows.add(new CsvTables.RawGeneSetRow(gene, name, chosen.library(),
                            source.polarity().label(), source.organism().label()));
                }
            });
            Path file = rawDataDir.resolve(source.file());
            csvTables.writeRawGeneSets(file, rows);
            log.info("{}: saved {} gene entries from {} to {}", source.label(), rows.size(), chosen.library(), file);
            written.put(source.label(), rows.size());
        }
        return written;
    }

    private Optional<Selection> select(ReconcilerProperties.Source source) {
        List<String> tried = new ArrayList<>();
        for (String library : source.libraries()) {
            tried.add(library);
            Optional<Selection> hit = tryLibrary(source, library);
            if (hit.isPresent()) return hit;
        }
        if (source.discover().isEmpty()) return Optional.empty();

        List<String> discovered = catalog(source.organism()).stream()
                .filter(name -> containsAll(name, source.discover()))
                .filter(name -> !tried.contains(name))
                .limit(discoveredCandidates)
                .toList();
        log.info("{}: {} libraries found for {}: {}", source.label(), source.organism().label(),
                source.discover(), discovered);
        for (String library : discovered) {
            Optional<Selection> hit = tryLibrary(source, library);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    private Optional<Selection> tryLibrary(ReconcilerProperties.Source source, String library) {
        Optional<Map<String, List<String>>> sets = libraries.computeIfAbsent(
                new LibraryKey(source.organism(), library), key -> fetch(source, key));
        if (sets.isEmpty()) return Optional.empty();

        Map<String, List<String>> matching = new LinkedHashMap<>();
        sets.get().forEach((name, genes) -> {
            if (matchesName(name, source)) matching.put(name, genes);
        });
        if (matching.isEmpty()) {
            log.info("{}: no gene set in {} matches, trying next library", source.label(), library);
            return Optional.empty();
        }
        return Optional.of(new Selection(library, matching));
    }

    private Optional<Map<String, List<String>>> fetch(ReconcilerProperties.Source source, LibraryKey key) {
        try {
            return Optional.of(libraryClient.fetchLibrary(key.organism(), key.name()));
        } catch (RestClientException e) {
            log.warn("{}: library {} could not be retrieved: {}", source.label(), key.name(), e.toString());
            return Optional.empty();
        }
    }

    private List<String> catalog(Organism organism) {
        return catalogs.computeIfAbsent(organism, o -> {
            try {
                return libraryClient.listLibraries(o);
            } catch (RestClientException e) {
                log.warn("Library catalog for {} could not be retrieved: {}", o.label(), e.toString());
                return List.of();
            }
        });
    }

    static boolean matchesName(String setName, ReconcilerProperties.Source source) {
        boolean any = source.requireAny().isEmpty()
                || source.requireAny().stream().anyMatch(t -> containsAll(setName, List.of(t)));
        return containsAll(setName, source.requireAll()) && any;
    }

    private static boolean containsAll(String name, List<String> terms) {
        String upper = name.toUpperCase(Locale.ROOT);
        return terms.stream().allMatch(t -> upper.contains(t.toUpperCase(Locale.ROOT)));
    }

    private record LibraryKey(Organism organism, String name) {}

    private record Selection(String library, Map<String, List<String>> sets) {}
}
