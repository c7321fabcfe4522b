package de.mirkosertic.mcp.blobsearch.index;

import java.time.Instant;
import java.util.List;

/**
 * A ranked search match. Highlights are content fragments with matched terms wrapped in {@code <em>} tags,
 * file name highlights are empty unless the file name itself matched.
 */
public record SearchHit(
        String key,
        String fileName,
        String fileExtension,
        long size,
        Instant modifiedAt,
        String url,
        float score,
        List<String> highlights,
        List<String> fileNameHighlights
) {

    public SearchHit withUrl(final String newUrl) {
        return new SearchHit(key, fileName, fileExtension, size, modifiedAt, newUrl, score, highlights,
                fileNameHighlights);
    }
}
