package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.index.SearchHit;
import de.mirkosertic.mcp.blobsearch.index.SearchResult;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

import java.util.List;

public record SearchResponse(
        boolean success,
        String query,
        Long totalHits,
        Integer offset,
        Integer size,
        List<SearchHit> hits,
        Long searchTimeMs,
        String error
) implements ToolResponse {

    public static SearchResponse success(final SearchResult result, final long searchTimeMs) {
        return new SearchResponse(true, result.query(), result.totalHits(), result.offset(), result.size(),
                result.hits(), searchTimeMs, null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, null, null, null, null, null, null, errorMessage);
    }
}
