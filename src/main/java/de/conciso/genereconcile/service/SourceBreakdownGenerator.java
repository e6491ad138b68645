package de.conciso.genereconcile.service;

import de.conciso.genereconcile.model.AnnotatedGeneEntry;
import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.SourceBreakdown;
import de.conciso.genereconcile.model.SourcePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projiziert die finale Tabelle auf die konfigurierten Quellen-Labels. Die Kategorien
 * bleiben die globalen; ein Eintrag erscheint unter jedem Label, das eine seiner Quellen trifft.
 */
@Service
public class SourceBreakdownGenerator {

    private static final Logger log = LoggerFactory.getLogger(SourceBreakdownGenerator.class);

    public static final Comparator<AnnotatedGeneEntry> BREAKDOWN_ORDER =
            Comparator.comparing(AnnotatedGeneEntry::category)
                    .thenComparing(AnnotatedGeneEntry::humanSymbol);

    public Map<String, SourceBreakdown> breakdown(List<AnnotatedGeneEntry> entries, List<SourcePattern> patterns) {
        Map<String, SourceBreakdown> result = new LinkedHashMap<>();
        for (SourcePattern pattern : patterns) {
            List<AnnotatedGeneEntry> filtered = entries.stream()
                    .filter(e -> e.entry().sources().stream().anyMatch(pattern::matches))
                    .sorted(BREAKDOWN_ORDER)
                    .toList();

            Map<Category, Integer> counts = new EnumMap<>(Category.class);
            for (Category category : Category.values()) {
                counts.put(category, 0);
            }
            for (AnnotatedGeneEntry e : filtered) {
                counts.merge(e.category(), 1, Integer::sum);
            }

            SourceBreakdown breakdown = new SourceBreakdown(pattern, filtered, Collections.unmodifiableMap(counts));
            log.info("{}: {} genes {}", breakdown.label(), breakdown.total(), counts);
            result.put(breakdown.label(), breakdown);
        }
        return Collections.unmodifiableMap(result);
    }
}
