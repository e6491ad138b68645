package de.conciso.genereconcile.service;

import java.util.List;

/**
 * Ergebnis eines Batch-Lookups. {@code completed} ist in Batch-Reihenfolge; fehlgeschlagene Batches werden nur gezählt.
 */
public record BatchOutcome<I, R>(List<Completed<I, R>> completed, int totalBatches, int failedBatches) {

    public record Completed<I, R>(int offset, List<I> items, R result) {}

    public static <I, R> BatchOutcome<I, R> empty() {
        return new BatchOutcome<>(List.of(), 0, 0);
    }

    /** True, wenn etwas zu senden war und jeder Batch fehlschlug. */
    public boolean allFailed() {
        return totalBatches > 0 && failedBatches == totalBatches;
    }
}
