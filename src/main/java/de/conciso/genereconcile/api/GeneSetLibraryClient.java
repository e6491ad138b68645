package de.conciso.genereconcile.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.Organism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lädt Gen-Set-Bibliotheken von Enrichr im Textformat:
 * ein Set pro Zeile, {@code name \t beschreibung \t gen \t gen ...}.
 * Jeder Organismus hat seinen eigenen Endpunkt.
 */
@Component
public class GeneSetLibraryClient {

    private static final Logger log = LoggerFactory.getLogger(GeneSetLibraryClient.class);

    private final Map<Organism, RestClient> restClients = new EnumMap<>(Organism.class);

    @Autowired
    public GeneSetLibraryClient(ReconcilerProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.enrichr().timeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        for (Organism organism : Organism.values()) {
            restClients.put(organism, RestClient.builder()
                    .baseUrl(properties.enrichr().url(organism))
                    .requestFactory(requestFactory)
                    .build());
        }
    }

    GeneSetLibraryClient(RestClient restClient) {
        for (Organism organism : Organism.values()) {
            restClients.put(organism, restClient);
        }
    }

    /**
     * Namen aller Bibliotheken, die der Endpunkt des Organismus anbietet, in Server-Reihenfolge.
     */
    public List<String> listLibraries(Organism organism) {
        DatasetStatistics stats = restClients.get(organism).get()
                .uri("/datasetStatistics")
                .retrieve()
                .body(DatasetStatistics.class);

        if (stats == null || stats.statistics() == null) {
            log.warn("Empty library catalog for {}", organism.label());
            return List.of();
        }
        List<String> names = stats.statistics().stream()
                .map(LibraryInfo::libraryName)
                .filter(Objects::nonNull)
                .toList();
        log.info("{} libraries available for {}", names.size(), organism.label());
        return names;
    }

    /**
     * @return Set-Name auf Gensymbole, in Bibliotheks-Reihenfolge
     */
    public Map<String, List<String>> fetchLibrary(Organism organism, String libraryName) {
        String raw = restClients.get(organism).get()
                .uri(uri -> uri.path("/geneSetLibrary")
                        .queryParam("mode", "text")
                        .queryParam("libraryName", libraryName)
                        .build())
                .retrieve()
                .body(String.class);

        if (raw == null || raw.isBlank()) {
            log.warn("Empty library response for: {}", libraryName);
            return Map.of();
        }
        Map<String, List<String>> sets = parseLibrary(raw);
        log.info("Library {} ({}): {} gene sets", libraryName, organism.label(), sets.size());
        return sets;
    }

    static Map<String, List<String>> parseLibrary(String raw) {
        Map<String, List<String>> sets = new LinkedHashMap<>();
        for (String line : raw.split("\\R")) {
            if (line.isBlank()) continue;
            String[] cols = line.split("\t", -1);
            String name = cols[0].trim();
            if (name.isEmpty()) continue;
            List<String> genes = new ArrayList<>();
            for (int i = 2; i < cols.length; i++) {
                // manche Bibliotheken hängen ein Gewicht an: "SYMBOL,1.0"
                String gene = cols[i].split(",", 2)[0].trim();
                if (!gene.isEmpty()) genes.add(gene);
            }
            sets.computeIfAbsent(name, k -> new ArrayList<>()).addAll(genes);
        }
        return sets;
    }

    // -------------------------------------------------------------------------
    // JSON-Antwort von /datasetStatistics
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DatasetStatistics(List<LibraryInfo> statistics) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LibraryInfo(String libraryName) {}
}
