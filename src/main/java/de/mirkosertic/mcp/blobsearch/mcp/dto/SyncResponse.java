package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.ingest.SyncSummary;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

public record SyncResponse(
        boolean success,
        SyncSummary summary,
        Long durationMs,
        String error
) implements ToolResponse {

    public static SyncResponse success(final SyncSummary summary, final long durationMs) {
        return new SyncResponse(true, summary, durationMs, null);
    }

    public static SyncResponse error(final String errorMessage) {
        return new SyncResponse(false, null, null, errorMessage);
    }
}
