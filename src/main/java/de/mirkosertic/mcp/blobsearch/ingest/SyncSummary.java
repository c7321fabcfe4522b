package de.mirkosertic.mcp.blobsearch.ingest;

import java.time.Instant;

/**
 * Result of one store-to-index reconciliation.
 *
 * @param storeDocumentCount   documents listed in the store before the run
 * @param indexedDocumentCount documents in the index before the run
 * @param added                keys newly indexed successfully
 * @param removed              index records deleted successfully
 * @param completedAt          end of the run
 */
public record SyncSummary(
        int storeDocumentCount,
        int indexedDocumentCount,
        int added,
        int removed,
        Instant completedAt
) {
}
