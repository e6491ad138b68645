package de.conciso.genereconcile.model;

import java.util.Locale;

/**
 * Funktionale Richtung, die eine Quelle ihren Gen-Sets zuweist.
 * In den Rohtabellen steht sie in der Spalte {@code category} als Pro, Anti oder General.
 */
public enum Polarity {
    PRO("Pro"),
    ANTI("Anti"),
    GENERAL("General");

    private final String label;

    Polarity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Polarity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing polarity");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Polarity p : values()) {
            if (p.label.toLowerCase(Locale.ROOT).equals(v)) return p;
        }
        throw new IllegalArgumentException("Unknown polarity: '" + value + "' (expected Pro, Anti or General)");
    }
}
