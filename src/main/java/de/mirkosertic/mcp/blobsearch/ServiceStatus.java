package de.mirkosertic.mcp.blobsearch;

import de.mirkosertic.mcp.blobsearch.index.IndexStatistics;
import de.mirkosertic.mcp.blobsearch.store.StoreStatistics;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Snapshot of store, index and limits.
 *
 * @param store               bucket information, {@code null} if the store could not be queried
 * @param storeError          reason the store could not be queried, {@code null} otherwise
 * @param index               index statistics
 * @param supportedExtensions file extensions picked up from the store
 * @param maxFileSizeBytes    documents larger than this are not processed
 * @param batchRunning        whether a batch currently holds the exclusive section
 */
public record ServiceStatus(
        @Nullable StoreStatistics store,
        @Nullable String storeError,
        IndexStatistics index,
        List<String> supportedExtensions,
        long maxFileSizeBytes,
        boolean batchRunning
) {
}
