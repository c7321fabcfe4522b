package de.mirkosertic.mcp.blobsearch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.mcp.blobsearch.index.IndexRecord;
import de.mirkosertic.mcp.blobsearch.index.IndexStatistics;
import de.mirkosertic.mcp.blobsearch.index.SearchHit;
import de.mirkosertic.mcp.blobsearch.index.SearchIndex;
import de.mirkosertic.mcp.blobsearch.index.SearchResult;
import de.mirkosertic.mcp.blobsearch.ingest.BatchCoordinator;
import de.mirkosertic.mcp.blobsearch.ingest.BatchSummary;
import de.mirkosertic.mcp.blobsearch.ingest.DocumentProcessor;
import de.mirkosertic.mcp.blobsearch.ingest.ProcessingOutcome;
import de.mirkosertic.mcp.blobsearch.ingest.Reconciler;
import de.mirkosertic.mcp.blobsearch.ingest.SyncSummary;
import de.mirkosertic.mcp.blobsearch.store.DocumentStore;
import de.mirkosertic.mcp.blobsearch.store.StoreStatistics;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The operations offered to callers: batch ingestion, single-document ingestion, sync, search and
 * index maintenance. Validates requests before any work starts.
 */
public class DocumentSearchService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSearchService.class);

    public static final int MAX_SEARCH_SIZE = 100;
    public static final int MAX_SEARCH_OFFSET = 10_000;

    private final DocumentStore store;
    private final SearchIndex index;
    private final DocumentProcessor processor;
    private final BatchCoordinator coordinator;
    private final Reconciler reconciler;
    private final List<String> supportedExtensions;
    private final long maxFileSizeBytes;
    private final int maxConcurrency;
    private final Duration urlTtl;
    private final Cache<String, String> urlCache;

    public DocumentSearchService(final DocumentStore store,
                                 final SearchIndex index,
                                 final DocumentProcessor processor,
                                 final BatchCoordinator coordinator,
                                 final Reconciler reconciler,
                                 final List<String> supportedExtensions,
                                 final long maxFileSizeBytes,
                                 final int maxConcurrency,
                                 final Duration urlTtl) {
        this.store = store;
        this.index = index;
        this.processor = processor;
        this.coordinator = coordinator;
        this.reconciler = reconciler;
        this.supportedExtensions = List.copyOf(supportedExtensions);
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxConcurrency = maxConcurrency;
        this.urlTtl = urlTtl;
        // URLs are handed out for at least half their lifetime
        this.urlCache = Caffeine.newBuilder()
                .expireAfterWrite(urlTtl.dividedBy(2))
                .maximumSize(10_000)
                .build();
    }

    /**
     * Processes every supported document in the store, then refreshes the index.
     */
    public BatchSummary processAll(final int concurrency) throws IOException {
        if (concurrency < 1 || concurrency > maxConcurrency) {
            throw new ValidationException("concurrency must be between 1 and " + maxConcurrency + ", was " + concurrency);
        }

        // Listed under the batch lock, a caller queued behind a running batch sees that batch's effects
        final BatchSummary summary = coordinator.processListing(store::list, concurrency);
        if (summary.totalDocuments() == 0) {
            logger.info("No documents found in store");
            return summary;
        }
        index.refresh();
        return summary;
    }

    public ProcessingOutcome processOne(final String key) throws IOException {
        requireKey(key);
        final ProcessingOutcome outcome = processor.processKey(key);
        if (outcome.isSuccess()) {
            index.refresh();
        }
        logger.info("Processed {}: {} ({})", key, outcome.status(), outcome.message());
        return outcome;
    }

    public SyncSummary sync() throws IOException {
        return reconciler.sync();
    }

    public SearchResult search(final String query, final int size, final int offset) throws IOException {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        if (size < 1 || size > MAX_SEARCH_SIZE) {
            throw new ValidationException("size must be between 1 and " + MAX_SEARCH_SIZE + ", was " + size);
        }
        if (offset < 0 || offset > MAX_SEARCH_OFFSET) {
            throw new ValidationException("offset must be between 0 and " + MAX_SEARCH_OFFSET + ", was " + offset);
        }

        final SearchResult result = index.search(query.trim(), size, offset);
        final List<SearchHit> hits = new ArrayList<>(result.hits().size());
        for (final SearchHit hit : result.hits()) {
            hits.add(hit.withUrl(currentUrl(hit.key(), hit.url())));
        }
        return result.withHits(List.copyOf(hits));
    }

    /**
     * Removes a document from the index only. The store object is never touched.
     *
     * @return true if a record was removed
     */
    public boolean deleteFromIndex(final String key) throws IOException {
        requireKey(key);
        final boolean deleted = index.delete(key);
        if (deleted) {
            index.refresh();
            urlCache.invalidate(key);
        }
        logger.info("Delete of {} from index: {}", key, deleted ? "removed" : "not present");
        return deleted;
    }

    @Nullable
    public IndexRecord documentDetails(final String key) throws IOException {
        requireKey(key);
        return index.get(key);
    }

    public ServiceStatus status() throws IOException {
        StoreStatistics storeStatistics = null;
        String storeError = null;
        try {
            storeStatistics = store.statistics();
        } catch (final IOException e) {
            logger.warn("Store statistics unavailable", e);
            storeError = e.getMessage();
        }
        final IndexStatistics indexStatistics = index.stats();
        return new ServiceStatus(storeStatistics, storeError, indexStatistics, supportedExtensions,
                maxFileSizeBytes, coordinator.isBusy());
    }

    /**
     * A fresh (cached) access URL. Falls back to the URL stored at indexing time when the store cannot sign one.
     */
    private String currentUrl(final String key, final String storedUrl) {
        final String cached = urlCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        try {
            final String url = store.urlFor(key, urlTtl);
            urlCache.put(key, url);
            return url;
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not generate URL for {}: {}", key, e.getMessage());
            return storedUrl == null ? "" : storedUrl;
        }
    }

    private static void requireKey(final String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("key must not be blank");
        }
    }
}
