package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.ingest.ProcessingOutcome;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

/**
 * A document that could not be processed is still a successful tool call; the outcome carries the reason.
 */
public record ProcessDocumentResponse(
        boolean success,
        ProcessingOutcome outcome,
        String error
) implements ToolResponse {

    public static ProcessDocumentResponse success(final ProcessingOutcome outcome) {
        return new ProcessDocumentResponse(true, outcome, null);
    }

    public static ProcessDocumentResponse error(final String errorMessage) {
        return new ProcessDocumentResponse(false, null, errorMessage);
    }
}
