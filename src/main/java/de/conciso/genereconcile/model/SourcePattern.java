package de.conciso.genereconcile.model;

/**
 * Ordnet einem Report-Label die Quellen-Labels zu, die es abdeckt, z.B. GO -> Präfix "GO_".
 */
public record SourcePattern(String label, String pattern, MatchMode mode) {

    public enum MatchMode {
        CONTAINS,
        PREFIX
    }

    public boolean matches(String source) {
        return switch (mode) {
            case CONTAINS -> source.contains(pattern);
            case PREFIX -> source.startsWith(pattern);
        };
    }
}
