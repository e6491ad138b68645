package de.conciso.genereconcile.model;

import java.util.Locale;

public record CoverageStats(Organism organism, int mapped, int total) {

    public double percent() {
        return total == 0 ? 0.0 : 100.0 * mapped / total;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s: %d/%d (%.1f%%)", organism.label(), mapped, total, percent());
    }
}
