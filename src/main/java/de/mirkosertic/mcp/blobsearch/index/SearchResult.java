package de.mirkosertic.mcp.blobsearch.index;

import java.util.List;

public record SearchResult(String query, long totalHits, int offset, int size, List<SearchHit> hits) {

    public SearchResult withHits(final List<SearchHit> newHits) {
        return new SearchResult(query, totalHits, offset, size, newHits);
    }
}
