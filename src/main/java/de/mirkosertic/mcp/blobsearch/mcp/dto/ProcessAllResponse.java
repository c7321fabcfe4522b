package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.ingest.BatchSummary;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

public record ProcessAllResponse(
        boolean success,
        BatchSummary summary,
        Long durationMs,
        String error
) implements ToolResponse {

    public static ProcessAllResponse success(final BatchSummary summary, final long durationMs) {
        return new ProcessAllResponse(true, summary, durationMs, null);
    }

    public static ProcessAllResponse error(final String errorMessage) {
        return new ProcessAllResponse(false, null, null, errorMessage);
    }
}
