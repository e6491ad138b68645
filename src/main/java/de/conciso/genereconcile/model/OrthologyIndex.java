package de.conciso.genereconcile.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nachschlagen in beide Richtungen über eine deduplizierte Paarliste.
 * <p>
 * Human → Maus behält alle Maus-Symbole. Maus → Human ist einwertig:
 * teilen sich mehrere Human-Symbole ein Maus-Symbol, gewinnt das zuletzt verarbeitete Paar.
 */
public final class OrthologyIndex {

    private final List<OrthologPair> pairs;
    private final Map<String, Set<String>> humanToMouse;
    private final Map<String, String> mouseToHuman;
    private final int duplicatesRemoved;

    private OrthologyIndex(List<OrthologPair> pairs,
                           Map<String, Set<String>> humanToMouse,
                           Map<String, String> mouseToHuman,
                           int duplicatesRemoved) {
        this.pairs = pairs;
        this.humanToMouse = humanToMouse;
        this.mouseToHuman = mouseToHuman;
        this.duplicatesRemoved = duplicatesRemoved;
    }

    public static OrthologyIndex empty() {
        return of(List.of(), 0);
    }

    /**
     * Baut den Index aus bereits deduplizierten Paaren, in Verarbeitungsreihenfolge.
     */
    public static OrthologyIndex of(List<OrthologPair> pairs, int duplicatesRemoved) {
        Map<String, Set<String>> h2m = new LinkedHashMap<>();
        Map<String, String> m2h = new LinkedHashMap<>();
        for (OrthologPair pair : pairs) {
            h2m.computeIfAbsent(pair.humanSymbol(), k -> new LinkedHashSet<>()).add(pair.mouseSymbol());
            m2h.put(pair.mouseSymbol(), pair.humanSymbol());
        }
        h2m.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return new OrthologyIndex(List.copyOf(pairs),
                Collections.unmodifiableMap(h2m),
                Collections.unmodifiableMap(m2h),
                duplicatesRemoved);
    }

    public List<OrthologPair> pairs() {
        return pairs;
    }

    public Set<String> mouseOrthologs(String humanSymbol) {
        return humanToMouse.getOrDefault(humanSymbol, Set.of());
    }

    public Optional<String> humanOrtholog(String mouseSymbol) {
        return Optional.ofNullable(mouseToHuman.get(mouseSymbol));
    }

    public int duplicatesRemoved() {
        return duplicatesRemoved;
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }
}
