package de.conciso.genereconcile.model;

import java.util.Locale;

public enum Organism {
    HUMAN("Human", 9606),
    MOUSE("Mouse", 10090);

    private final String label;
    private final int taxonId;

    Organism(String label, int taxonId) {
        this.label = label;
        this.taxonId = taxonId;
    }

    public String label() {
        return label;
    }

    public int taxonId() {
        return taxonId;
    }

    public Organism other() {
        return this == HUMAN ? MOUSE : HUMAN;
    }

    /** Akzeptiert "Human"/"Mouse" in beliebiger Schreibweise, sonst null. */
    public static Organism parse(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Organism o : values()) {
            if (o.label.toLowerCase(Locale.ROOT).equals(v)) return o;
        }
        return null;
    }
}
