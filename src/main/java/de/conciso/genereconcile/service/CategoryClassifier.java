package de.conciso.genereconcile.service;

import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.Classification;
import de.conciso.genereconcile.model.ClassificationRule;
import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.EvidenceProfile;
import de.conciso.genereconcile.model.EvidenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class CategoryClassifier {

    private static final Logger log = LoggerFactory.getLogger(CategoryClassifier.class);

    /** Höchste Evidenz zuerst, dann Symbol ohne Groß-/Kleinschreibung; das Rohsymbol entscheidet den Rest. */
    public static final Comparator<ConsolidatedGeneEntry> TABLE_ORDER =
            Comparator.comparingInt(ConsolidatedGeneEntry::evidenceScore).reversed()
                    .thenComparing(e -> e.humanSymbol().toUpperCase(Locale.ROOT))
                    .thenComparing(ConsolidatedGeneEntry::humanSymbol);

    public Classification classify(EvidenceProfile profile) {
        for (ClassificationRule rule : ClassificationRule.values()) {
            if (rule.matches(profile)) {
                return new Classification(rule.category(), profile.sources().size());
            }
        }
        throw new IllegalStateException("Evidence profile without evidence: " + profile.humanSymbol());
    }

    public List<ConsolidatedGeneEntry> consolidate(EvidenceTable table) {
        if (table.size() == 0) {
            throw new NoEvidenceFoundException("No gene received any evidence; nothing to classify");
        }

        List<ConsolidatedGeneEntry> entries = new ArrayList<>(table.size());
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (EvidenceProfile profile : table.profiles()) {
            Classification c = classify(profile);
            entries.add(new ConsolidatedGeneEntry(
                    profile.humanSymbol(),
                    List.copyOf(profile.mouseSymbols()),
                    c.category(),
                    List.copyOf(profile.sources()),
                    c.evidenceScore()));
            counts.merge(c.category(), 1, Integer::sum);
        }
        entries.sort(TABLE_ORDER);

        log.info("Classified {} genes", entries.size());
        for (Category category : Category.values()) {
            int n = counts.getOrDefault(category, 0);
            log.info("  {}: {} ({})", category.label(), n, String.format("%.1f%%", 100.0 * n / entries.size()));
        }
        return List.copyOf(entries);
    }
}
