package de.mirkosertic.mcp.blobsearch.ingest;

public enum ProcessingStatus {
    SUCCESS,
    /**
     * Reserved. Unchanged documents currently report {@link #SUCCESS}.
     */
    SKIPPED,
    FAILED
}
