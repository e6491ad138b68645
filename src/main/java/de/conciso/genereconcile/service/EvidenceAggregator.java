package de.conciso.genereconcile.service;

import de.conciso.genereconcile.model.EvidenceProfile;
import de.conciso.genereconcile.model.EvidenceTable;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.OrthologyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Legt jeden Eintrag unter seinem kanonischen Human-Symbol ab. Maus-Einträge laufen
 * zuerst durch den Rückwärts-Index und fallen weg, wenn dieser keinen Eintrag hat.
 */
@Service
public class EvidenceAggregator {

    private static final Logger log = LoggerFactory.getLogger(EvidenceAggregator.class);

    public EvidenceTable aggregate(List<GeneSetRecord> records, OrthologyIndex index) {
        EvidenceTable table = new EvidenceTable();
        Map<String, SourceCounts> counts = new TreeMap<>();

        for (GeneSetRecord rec : records) {
            SourceCounts sc = counts.computeIfAbsent(rec.source(), k -> new SourceCounts());
            if (rec.organism() == Organism.HUMAN) {
                EvidenceProfile profile = table.file(rec.symbol(), rec.polarity(), rec.source());
                for (String mouse : index.mouseOrthologs(rec.symbol().toUpperCase(Locale.ROOT))) {
                    table.addMouseSymbol(profile, mouse);
                }
                sc.direct++;
            } else {
                Optional<String> human = index.humanOrtholog(rec.symbol());
                if (human.isPresent()) {
                    EvidenceProfile profile = table.file(human.get(), rec.polarity(), rec.source());
                    table.addMouseSymbol(profile, rec.symbol());
                    sc.mapped++;
                } else {
                    sc.unmapped++;
                }
            }
        }

        counts.forEach((source, sc) -> {
            if (sc.mapped + sc.unmapped > 0) {
                log.info("  {}: {} mouse records mapped, {} unmapped", source, sc.mapped, sc.unmapped);
            } else {
                log.info("  {}: {} human records", source, sc.direct);
            }
        });
        log.info("Evidence collected for {} human genes from {} records", table.size(), records.size());
        return table;
    }

    private static final class SourceCounts {
        int direct;
        int mapped;
        int unmapped;
    }
}
