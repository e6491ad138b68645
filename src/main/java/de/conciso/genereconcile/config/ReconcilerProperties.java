package de.conciso.genereconcile.config;

import de.conciso.genereconcile.model.Organism;
import de.conciso.genereconcile.model.Polarity;
import de.conciso.genereconcile.model.SourcePattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Laufkonfiguration aus {@code genereconciler.*}, wird jeder Komponente
 * über den Konstruktor übergeben.
 */
@ConfigurationProperties(prefix = "genereconciler")
public record ReconcilerProperties(
        @DefaultValue("reconcile") String mode,
        @DefaultValue Paths paths,
        @DefaultValue MyGene mygene,
        @DefaultValue Enrichr enrichr,
        @DefaultValue Batch batch,
        @DefaultValue Retry retry,
        @DefaultValue Cache cache,
        @DefaultValue Orthology orthology,
        List<Source> sources,
        List<Breakdown> breakdown
) {
    public ReconcilerProperties {
        sources = sources == null ? List.of() : List.copyOf(sources);
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
    }

    public record Paths(
            @DefaultValue("workflow/raw_data") Path rawData,
            @DefaultValue("results") Path output
    ) {}

    public record MyGene(
            @DefaultValue("https://mygene.info/v3") String url,
            @DefaultValue("30s") Duration timeout
    ) {}

    /**
     * Enrichr-Endpunkte je Organismus. Die Maus-Bibliotheken liegen standardmäßig
     * auf demselben Server.
     */
    public record Enrichr(
            @DefaultValue("https://maayanlab.cloud/Enrichr") String url,
            @DefaultValue("https://maayanlab.cloud/Enrichr") String mouseUrl,
            @DefaultValue("60s") Duration timeout,
            @DefaultValue("3") int discoveredCandidates
    ) {
        public Enrichr {
            requirePositive("genereconciler.enrichr.discovered-candidates", discoveredCandidates);
        }

        public String url(Organism organism) {
            return organism == Organism.MOUSE ? mouseUrl : url;
        }
    }

    public record Batch(
            @DefaultValue("500") int orthologSize,
            @DefaultValue("200") int annotationSize,
            @DefaultValue("4") int maxConcurrency
    ) {
        public Batch {
            requirePositive("genereconciler.batch.ortholog-size", orthologSize);
            requirePositive("genereconciler.batch.annotation-size", annotationSize);
            requirePositive("genereconciler.batch.max-concurrency", maxConcurrency);
        }
    }

    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff,
            @DefaultValue("2.0") double multiplier
    ) {
        public Retry {
            requirePositive("genereconciler.retry.max-attempts", maxAttempts);
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("genereconciler.retry.multiplier must be >= 1.0, was " + multiplier);
            }
        }
    }

    public record Cache(@DefaultValue("100000") long maxSize) {}

    public record Orthology(@DefaultValue("false") boolean reuseExisting) {}

    /**
     * Eine kuratierte Gen-Set-Quelle. {@code file} wird relativ zu {@code paths.raw-data} gelesen.
     * <p>
     * Nur im Acquire-Modus relevant: {@code libraries} sind die Bibliotheken in der Reihenfolge,
     * in der sie versucht werden. Liefert keine davon ein passendes Set, werden die verfügbaren
     * Bibliotheken des Organismus durchsucht, deren Name alle {@code discover}-Begriffe enthält.
     * {@code requireAll} und {@code requireAny} filtern die Set-Namen.
     */
    public record Source(
            String label,
            String file,
            Organism organism,
            Polarity polarity,
            @DefaultValue("true") boolean required,
            List<String> libraries,
            List<String> discover,
            List<String> requireAll,
            List<String> requireAny
    ) {
        public Source {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("genereconciler.sources[].label must be set");
            }
            if (file == null || file.isBlank()) {
                throw new IllegalArgumentException("genereconciler.sources[" + label + "].file must be set");
            }
            libraries = libraries == null ? List.of() : List.copyOf(libraries);
            discover = discover == null ? List.of() : List.copyOf(discover);
            requireAll = requireAll == null ? List.of() : List.copyOf(requireAll);
            requireAny = requireAny == null ? List.of() : List.copyOf(requireAny);
        }

        public boolean acquirable() {
            return !libraries.isEmpty() || !discover.isEmpty();
        }
    }

    public record Breakdown(
            String label,
            String pattern,
            @DefaultValue("CONTAINS") SourcePattern.MatchMode match
    ) {
        public SourcePattern toPattern() {
            return new SourcePattern(label, pattern, match);
        }
    }

    public List<SourcePattern> breakdownPatterns() {
        return breakdown.stream().map(Breakdown::toPattern).toList();
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be a positive integer, was " + value);
        }
    }
}
