package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the processAll tool.
 */
public record ProcessAllRequest(
        @Nullable
        @Description("Number of documents processed in parallel (1-20). Default is 5.")
        Integer concurrency
) {
    public static ProcessAllRequest fromMap(final Map<String, Object> args) {
        return new ProcessAllRequest(
                args.get("concurrency") != null ? ((Number) args.get("concurrency")).intValue() : null);
    }

    public int effectiveConcurrency(final int defaultConcurrency) {
        return concurrency != null ? concurrency : defaultConcurrency;
    }
}
