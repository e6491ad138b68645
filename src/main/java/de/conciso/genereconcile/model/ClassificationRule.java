package de.conciso.genereconcile.model;

import java.util.function.Predicate;

/**
 * Vorrang der Kategorien. Die Regeln werden in Deklarationsreihenfolge geprüft, der erste Treffer gewinnt.
 */
public enum ClassificationRule {
    PRO_AND_ANTI(p -> !p.pro().isEmpty() && !p.anti().isEmpty(), Category.AMBIGUOUS),
    PRO_ONLY(p -> !p.pro().isEmpty(), Category.PRO_APOPTOTIC),
    ANTI_ONLY(p -> !p.anti().isEmpty(), Category.ANTI_APOPTOTIC),
    GENERAL_ONLY(p -> !p.general().isEmpty(), Category.UNSPECIFIED);

    private final Predicate<EvidenceProfile> condition;
    private final Category category;

    ClassificationRule(Predicate<EvidenceProfile> condition, Category category) {
        this.condition = condition;
        this.category = category;
    }

    public boolean matches(EvidenceProfile profile) {
        return condition.test(profile);
    }

    public Category category() {
        return category;
    }
}
