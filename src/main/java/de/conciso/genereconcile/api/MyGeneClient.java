package de.conciso.genereconcile.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.Organism;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Client für MyGene.info v3. Nutzt die Batch-Endpunkte {@code POST /query} (Symbol-Scope)
 * und {@code POST /gene} (Entrez-IDs).
 */
@Component
public class MyGeneClient implements GeneInfoService {

    private static final Logger log = LoggerFactory.getLogger(MyGeneClient.class);

    private static final ParameterizedTypeReference<List<QueryHit>> HIT_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    @Autowired
    public MyGeneClient(ReconcilerProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = (int) properties.mygene().timeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restClient = RestClient.builder()
                .baseUrl(properties.mygene().url())
                .requestFactory(requestFactory)
                .build();
    }

    MyGeneClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<OrthologHit> findOrthologs(List<String> symbols, Organism organism, Organism target) {
        if (symbols.isEmpty()) return List.of();

        List<QueryHit> hits = post("/query", Map.of(
                "q", String.join(",", symbols),
                "scopes", "symbol",
                "fields", "symbol,homologene",
                "species", String.valueOf(organism.taxonId())));

        // eine Anfrage kann mehrere Treffer liefern; deren Cluster werden zusammengeführt
        Map<String, String> symbolByQuery = new LinkedHashMap<>();
        Map<String, Set<Long>> idsByQuery = new LinkedHashMap<>();
        for (QueryHit hit : hits) {
            if (hit.query() == null || hit.isNotFound()) continue;
            symbolByQuery.putIfAbsent(hit.query(), hit.symbol() != null ? hit.symbol() : hit.query());
            Set<Long> ids = idsByQuery.computeIfAbsent(hit.query(), k -> new LinkedHashSet<>());
            if (hit.homologene() != null && hit.homologene().genes() != null) {
                for (List<Long> member : hit.homologene().genes()) {
                    if (member != null && member.size() >= 2 && member.get(0) != null
                            && member.get(0) == target.taxonId() && member.get(1) != null) {
                        ids.add(member.get(1));
                    }
                }
            }
        }

        List<OrthologHit> result = new ArrayList<>();
        symbolByQuery.forEach((query, symbol) ->
                result.add(new OrthologHit(query, symbol, List.copyOf(idsByQuery.get(query)))));
        log.debug("ortholog batch {} -> {}: {} queried, {} answered", organism, target, symbols.size(), result.size());
        return result;
    }

    @Override
    public Map<Long, String> resolveSymbols(List<Long> entrezIds, Organism organism) {
        if (entrezIds.isEmpty()) return Map.of();

        List<QueryHit> hits = post("/gene", Map.of(
                "ids", entrezIds.stream().map(String::valueOf).collect(Collectors.joining(",")),
                "fields", "symbol",
                "species", String.valueOf(organism.taxonId())));

        Map<Long, String> result = new LinkedHashMap<>();
        for (QueryHit hit : hits) {
            if (hit.isNotFound() || hit.symbol() == null || hit.symbol().isBlank()) continue;
            Long id = parseId(hit.query() != null ? hit.query() : hit.id());
            if (id != null) {
                result.putIfAbsent(id, hit.symbol());
            }
        }
        log.debug("symbol batch {}: {} ids, {} resolved", organism, entrezIds.size(), result.size());
        return result;
    }

    @Override
    public Map<String, String> findEnsemblIds(List<String> symbols, Organism organism) {
        if (symbols.isEmpty()) return Map.of();

        List<QueryHit> hits = post("/query", Map.of(
                "q", String.join(",", symbols),
                "scopes", "symbol",
                "fields", "ensembl.gene",
                "species", String.valueOf(organism.taxonId())));

        Map<String, String> result = new LinkedHashMap<>();
        for (QueryHit hit : hits) {
            if (hit.query() == null || hit.isNotFound()) continue;
            String geneId = firstEnsemblGene(hit.ensembl());
            if (geneId != null) {
                result.putIfAbsent(hit.query(), geneId);
            }
        }
        log.debug("ensembl batch {}: {} symbols, {} mapped", organism, symbols.size(), result.size());
        return result;
    }

    // --- Hilfsmethoden ---

    private List<QueryHit> post(String path, Map<String, String> params) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        params.forEach(form::add);
        List<QueryHit> hits = restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(HIT_LIST);
        return hits == null ? List.of() : hits;
    }

    /** Das Feld ensembl ist ein Objekt oder eine Liste von Objekten; das erste Gen gewinnt. */
    static String firstEnsemblGene(JsonNode ensembl) {
        if (ensembl == null || ensembl.isNull()) return null;
        JsonNode first = ensembl.isArray() ? (ensembl.isEmpty() ? null : ensembl.get(0)) : ensembl;
        if (first == null) return null;
        JsonNode gene = first.get("gene");
        return gene != null && gene.isTextual() && !gene.asText().isBlank() ? gene.asText() : null;
    }

    private static Long parseId(String value) {
        if (value == null) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric gene id '{}'", value);
            return null;
        }
    }

    // --- Antwort-Records ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QueryHit(
            String query,
            @JsonProperty("_id") String id,
            Boolean notfound,
            String symbol,
            Homologene homologene,
            JsonNode ensembl
    ) {
        boolean isNotFound() {
            return Boolean.TRUE.equals(notfound);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Homologene(Long id, List<List<Long>> genes) {}
}
