package de.mirkosertic.mcp.blobsearch.ingest;

import java.util.List;

/**
 * Aggregate of one batch run. Outcomes are in completion order, not input order.
 */
public record BatchSummary(
        int totalDocuments,
        int processedCount,
        int failedCount,
        int skippedCount,
        List<ProcessingOutcome> outcomes
) {

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0, List.of());
    }

    public static BatchSummary of(final int totalDocuments, final List<ProcessingOutcome> outcomes) {
        int processed = 0;
        int failed = 0;
        int skipped = 0;
        for (final ProcessingOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCESS -> processed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new BatchSummary(totalDocuments, processed, failed, skipped, List.copyOf(outcomes));
    }
}
