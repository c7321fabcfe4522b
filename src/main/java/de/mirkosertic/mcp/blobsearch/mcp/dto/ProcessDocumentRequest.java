package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.Description;

import java.util.Map;

public record ProcessDocumentRequest(
        @Description("Store key of the document, for example 'reports/2024/q1.pdf'")
        String key
) {
    public static ProcessDocumentRequest fromMap(final Map<String, Object> args) {
        return new ProcessDocumentRequest((String) args.get("key"));
    }
}
