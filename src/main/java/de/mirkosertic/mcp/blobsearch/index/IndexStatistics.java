package de.mirkosertic.mcp.blobsearch.index;

public record IndexStatistics(long documentCount, long sizeBytes) {
}
