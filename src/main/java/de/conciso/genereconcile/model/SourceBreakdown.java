package de.conciso.genereconcile.model;

import java.util.List;
import java.util.Map;

public record SourceBreakdown(
        SourcePattern pattern,
        List<AnnotatedGeneEntry> entries,
        Map<Category, Integer> categoryCounts
) {
    public String label() {
        return pattern.label();
    }

    public int total() {
        return entries.size();
    }
}
