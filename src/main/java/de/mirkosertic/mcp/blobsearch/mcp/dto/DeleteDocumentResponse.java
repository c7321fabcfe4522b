package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

public record DeleteDocumentResponse(
        boolean success,
        String key,
        Boolean deleted,
        String error
) implements ToolResponse {

    public static DeleteDocumentResponse success(final String key, final boolean deleted) {
        return new DeleteDocumentResponse(true, key, deleted, null);
    }

    public static DeleteDocumentResponse error(final String errorMessage) {
        return new DeleteDocumentResponse(false, null, null, errorMessage);
    }
}
