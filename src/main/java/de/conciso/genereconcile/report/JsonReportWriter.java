package de.conciso.genereconcile.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.genereconcile.config.ReconcilerProperties;
import de.conciso.genereconcile.model.Category;
import de.conciso.genereconcile.model.CoverageStats;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class JsonReportWriter {

    private final ObjectMapper objectMapper;
    private final ReconcilerProperties properties;

    public JsonReportWriter(ReconcilerProperties properties) {
        this.properties = properties;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReportData data, Path path) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", data.timestamp().toString());
        json.put("configuration", configuration());
        json.put("recordsBySource", data.recordsBySource());

        OrthologSummary o = data.orthology();
        Map<String, Object> orthology = new LinkedHashMap<>();
        orthology.put("totalPairs", o.totalPairs());
        orthology.put("duplicatesRemoved", o.duplicatesRemoved());
        Map<String, Integer> byDirection = new LinkedHashMap<>();
        o.pairsByDirection().forEach((d, n) -> byDirection.put(d.label(), n));
        orthology.put("pairsByMappingSource", byDirection);
        orthology.put("humanInput", o.humanInput());
        orthology.put("humanInputCovered", o.humanInputCovered());
        orthology.put("humanCoveragePercent", r(o.humanCoveragePercent()));
        orthology.put("mouseInput", o.mouseInput());
        orthology.put("mouseInputCovered", o.mouseInputCovered());
        orthology.put("mouseCoveragePercent", r(o.mouseCoveragePercent()));
        orthology.put("humanWithOrthologs", o.humanWithOrthologs());
        orthology.put("mouseWithOrthologs", o.mouseWithOrthologs());
        orthology.put("humanWithMultipleMouse", o.humanWithMultipleMouse());
        orthology.put("mouseWithMultipleHuman", o.mouseWithMultipleHuman());
        orthology.put("maxMousePerHuman", o.maxMousePerHuman());
        orthology.put("maxHumanPerMouse", o.maxHumanPerMouse());
        json.put("orthology", orthology);

        Map<String, Object> consolidation = new LinkedHashMap<>();
        consolidation.put("totalGenes", data.totalGenes());
        consolidation.put("genesWithMouseOrtholog", data.genesWithMouseOrtholog());
        consolidation.put("avgEvidenceScore", r(data.avgEvidenceScore()));
        consolidation.put("multiSourceGenes", data.multiSourceGenes());
        consolidation.put("categories", labelled(data.categoryCounts()));
        consolidation.put("evidenceScoreDistribution", data.scoreDistribution());
        json.put("consolidation", consolidation);

        Map<String, Object> annotation = new LinkedHashMap<>();
        annotation.put("human", coverage(data.humanCoverage()));
        annotation.put("mouse", coverage(data.mouseCoverage()));
        json.put("ensemblCoverage", annotation);

        Map<String, Object> breakdown = new LinkedHashMap<>();
        data.breakdownCounts().forEach((label, counts) -> breakdown.put(label, labelled(counts)));
        json.put("sourceBreakdown", breakdown);

        objectMapper.writeValue(path.toFile(), json);
    }

    private Map<String, Object> configuration() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("rawData", properties.paths().rawData().toString());
        m.put("output", properties.paths().output().toString());
        m.put("mygeneUrl", properties.mygene().url());
        m.put("orthologBatchSize", properties.batch().orthologSize());
        m.put("annotationBatchSize", properties.batch().annotationSize());
        m.put("maxConcurrency", properties.batch().maxConcurrency());
        m.put("retryMaxAttempts", properties.retry().maxAttempts());
        m.put("reuseExistingOrthology", properties.orthology().reuseExisting());
        m.put("sources", properties.sources().stream().map(ReconcilerProperties.Source::label).toList());
        return m;
    }

    private Map<String, Object> coverage(CoverageStats stats) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("mapped", stats.mapped());
        m.put("total", stats.total());
        m.put("percent", r(stats.percent()));
        return m;
    }

    private Map<String, Integer> labelled(Map<Category, Integer> counts) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (Category c : Category.values()) {
            m.put(c.label(), counts.getOrDefault(c, 0));
        }
        return m;
    }

    private double r(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
