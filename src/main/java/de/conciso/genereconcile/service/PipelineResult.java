package de.conciso.genereconcile.service;

import de.conciso.genereconcile.model.ConsolidatedGeneEntry;
import de.conciso.genereconcile.model.GeneSetRecord;
import de.conciso.genereconcile.model.OrthologyIndex;
import de.conciso.genereconcile.model.SourceBreakdown;

import java.util.List;
import java.util.Map;

public record PipelineResult(
        List<GeneSetRecord> records,
        OrthologyIndex orthology,
        List<ConsolidatedGeneEntry> consolidated,
        IdentifierAnnotator.Result annotation,
        Map<String, SourceBreakdown> breakdowns
) {}
