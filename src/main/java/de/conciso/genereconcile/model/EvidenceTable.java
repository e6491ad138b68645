package de.conciso.genereconcile.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Eigene Map der Evidenzprofile, Schlüssel ist das großgeschriebene Human-Symbol.
 * Ein Profil entsteht nur über {@link #file} und enthält daher immer Evidenz.
 * Angezeigt wird die Schreibweise des ersten Eintrags.
 */
public final class EvidenceTable {

    private final Map<String, EvidenceProfile> profiles = new LinkedHashMap<>();

    /**
     * Legt ein Evidenzstück ab und erzeugt das Profil beim ersten Zugriff.
     *
     * @return das Profil, unter dem die Evidenz abgelegt wurde
     */
    public EvidenceProfile file(String humanSymbol, Polarity polarity, String source) {
        EvidenceProfile profile = getOrInsert(humanSymbol);
        profile.file(polarity, source);
        return profile;
    }

    public void addMouseSymbol(EvidenceProfile profile, String mouseSymbol) {
        profile.addMouseSymbol(mouseSymbol);
    }

    private EvidenceProfile getOrInsert(String humanSymbol) {
        String key = key(humanSymbol);
        EvidenceProfile existing = profiles.get(key);
        if (existing != null) return existing;
        EvidenceProfile created = new EvidenceProfile(humanSymbol);
        profiles.put(key, created);
        return created;
    }

    public Optional<EvidenceProfile> get(String humanSymbol) {
        return Optional.ofNullable(profiles.get(key(humanSymbol)));
    }

    static String key(String humanSymbol) {
        return humanSymbol.toUpperCase(Locale.ROOT);
    }

    public Collection<EvidenceProfile> profiles() {
        return Collections.unmodifiableCollection(profiles.values());
    }

    public int size() {
        return profiles.size();
    }
}
