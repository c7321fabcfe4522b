package de.mirkosertic.mcp.blobsearch.store;

/**
 * Bucket level information. Counts cover every object, not only supported file types.
 */
public record StoreStatistics(String bucketName, String region, long objectCount, long totalSizeBytes) {
}
