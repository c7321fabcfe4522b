package de.mirkosertic.mcp.blobsearch.ingest;

import com.google.common.collect.Sets;
import de.mirkosertic.mcp.blobsearch.index.SearchIndex;
import de.mirkosertic.mcp.blobsearch.store.DocumentDescriptor;
import de.mirkosertic.mcp.blobsearch.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converges the index onto the current store contents.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>List the store and enumerate every key in the index.</li>
 *   <li>Keys only in the store are indexed through the {@link BatchCoordinator}.</li>
 *   <li>Keys only in the index are deleted one by one; a failed delete is logged and the rest continue.</li>
 *   <li>The index is refreshed so the result is visible to searches.</li>
 * </ol>
 * Keys present on both sides are not touched; content changes under an existing key are picked up by
 * a full "process all" run through the fingerprint check.
 * <p>
 * Failures to list the store or enumerate the index propagate; no partial summary is produced.
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final DocumentStore store;
    private final SearchIndex index;
    private final BatchCoordinator coordinator;
    private final int syncConcurrency;
    private final Clock clock;

    public Reconciler(final DocumentStore store,
                      final SearchIndex index,
                      final BatchCoordinator coordinator,
                      final int syncConcurrency,
                      final Clock clock) {
        this.store = store;
        this.index = index;
        this.coordinator = coordinator;
        this.syncConcurrency = syncConcurrency;
        this.clock = clock;
    }

    public SyncSummary sync() throws IOException {
        final long startTime = System.currentTimeMillis();

        final Map<String, DocumentDescriptor> storeDocuments = new LinkedHashMap<>();
        for (final DocumentDescriptor descriptor : store.list()) {
            storeDocuments.put(descriptor.key(), descriptor);
        }
        final Set<String> indexedKeys = index.listAllKeys();
        logger.info("Sync snapshot: {} documents in store, {} in index", storeDocuments.size(), indexedKeys.size());

        final Set<String> toAdd = Sets.difference(storeDocuments.keySet(), indexedKeys).immutableCopy();
        final Set<String> toRemove = Sets.difference(indexedKeys, storeDocuments.keySet()).immutableCopy();
        logger.info("Sync diff: add={}, remove={}", toAdd.size(), toRemove.size());

        final List<DocumentDescriptor> additions = toAdd.stream().map(storeDocuments::get).toList();
        final BatchSummary batch = coordinator.processBatch(additions, syncConcurrency);

        final int removed = applyDeletions(toRemove);

        index.refresh();

        final SyncSummary summary = new SyncSummary(
                storeDocuments.size(),
                indexedKeys.size(),
                batch.processedCount(),
                removed,
                clock.instant());
        logger.info("Sync completed in {}ms: added={}, removed={}",
                System.currentTimeMillis() - startTime, summary.added(), summary.removed());
        return summary;
    }

    private int applyDeletions(final Set<String> keys) {
        if (keys.isEmpty()) {
            logger.debug("No orphan deletions to apply");
            return 0;
        }
        int removed = 0;
        for (final String key : keys) {
            try {
                if (index.delete(key)) {
                    removed++;
                } else {
                    logger.debug("Orphan {} was already gone", key);
                }
            } catch (final IOException | RuntimeException e) {
                logger.warn("Failed to delete orphan {} from index", key, e);
            }
        }
        return removed;
    }
}
