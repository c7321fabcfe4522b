package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("Keywords to search for in document content and file names. Lucene query syntax is accepted, unquoted terms tolerate small typos.")
        String query,

        @Nullable
        @Description("Maximum number of hits to return (1-100). Default is 10.")
        Integer size,

        @Nullable
        @Description("Number of hits to skip, for paging (0-10000). Default is 0.")
        Integer offset
) {
    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                (String) args.get("query"),
                args.get("size") != null ? ((Number) args.get("size")).intValue() : null,
                args.get("offset") != null ? ((Number) args.get("offset")).intValue() : null
        );
    }

    public int effectiveSize() {
        return size != null ? size : 10;
    }

    public int effectiveOffset() {
        return offset != null ? offset : 0;
    }
}
