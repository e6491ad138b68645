package de.conciso.genereconcile.model;

/**
 * Funktionale Kategorie eines konsolidierten Gens. Die Deklarationsreihenfolge
 * ist die Reihenfolge in der Aufschlüsselung und in den Zusammenfassungen.
 */
public enum Category {
    PRO_APOPTOTIC("Pro-apoptotic"),
    ANTI_APOPTOTIC("Anti-apoptotic"),
    AMBIGUOUS("Ambiguous"),
    UNSPECIFIED("Unspecified");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Category parse(String label) {
        for (Category c : values()) {
            if (c.label.equalsIgnoreCase(label.trim())) return c;
        }
        throw new IllegalArgumentException("Unknown category: " + label);
    }
}
