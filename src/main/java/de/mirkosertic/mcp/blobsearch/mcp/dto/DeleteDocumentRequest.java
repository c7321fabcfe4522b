package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.Description;

import java.util.Map;

public record DeleteDocumentRequest(
        @Description("Store key of the document to remove from the index. The stored object itself is not touched.")
        String key
) {
    public static DeleteDocumentRequest fromMap(final Map<String, Object> args) {
        return new DeleteDocumentRequest((String) args.get("key"));
    }
}
