package de.conciso.genereconcile.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Gesammelte Evidenz für ein kanonisches (Human-)Symbol.
 * Instanzen werden nur von {@link EvidenceTable} erzeugt und befüllt.
 */
public final class EvidenceProfile {

    private final String humanSymbol;
    private final Set<String> pro = new TreeSet<>();
    private final Set<String> anti = new TreeSet<>();
    private final Set<String> general = new TreeSet<>();
    private final Set<String> mouseSymbols = new TreeSet<>();

    EvidenceProfile(String humanSymbol) {
        this.humanSymbol = humanSymbol;
    }

    void file(Polarity polarity, String source) {
        switch (polarity) {
            case PRO -> pro.add(source);
            case ANTI -> anti.add(source);
            case GENERAL -> general.add(source);
        }
    }

    void addMouseSymbol(String mouseSymbol) {
        mouseSymbols.add(mouseSymbol);
    }

    public String humanSymbol() {
        return humanSymbol;
    }

    public Set<String> pro() {
        return Collections.unmodifiableSet(pro);
    }

    public Set<String> anti() {
        return Collections.unmodifiableSet(anti);
    }

    public Set<String> general() {
        return Collections.unmodifiableSet(general);
    }

    public Set<String> mouseSymbols() {
        return Collections.unmodifiableSet(mouseSymbols);
    }

    /** Eindeutige Quellen-Labels über alle drei Polaritäten, sortiert. */
    public Set<String> sources() {
        Set<String> all = new TreeSet<>(pro);
        all.addAll(anti);
        all.addAll(general);
        return Collections.unmodifiableSet(all);
    }

    public boolean isEmpty() {
        return pro.isEmpty() && anti.isEmpty() && general.isEmpty();
    }
}
