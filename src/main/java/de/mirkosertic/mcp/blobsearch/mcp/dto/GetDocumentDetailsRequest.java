package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getDocumentDetails tool.
 */
public record GetDocumentDetailsRequest(
        @Description("Store key of the document, exactly as returned by search")
        String key
) {
    public static GetDocumentDetailsRequest fromMap(final Map<String, Object> args) {
        return new GetDocumentDetailsRequest((String) args.get("key"));
    }
}
