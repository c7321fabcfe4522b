package de.mirkosertic.mcp.blobsearch.ingest;

import de.mirkosertic.mcp.blobsearch.extract.TextExtractor;
import de.mirkosertic.mcp.blobsearch.index.IndexRecord;
import de.mirkosertic.mcp.blobsearch.index.SearchIndex;
import de.mirkosertic.mcp.blobsearch.store.DocumentDescriptor;
import de.mirkosertic.mcp.blobsearch.store.DocumentStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs the pipeline for a single document: change check, size check, fetch, extract, upsert.
 * <p>
 * {@link #process(DocumentDescriptor)} never throws. Every failure ends up in a {@link ProcessingOutcome},
 * so one document can never take down a batch. Safe for concurrent use on distinct keys.
 */
public class DocumentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentProcessor.class);

    static final String MSG_UNCHANGED = "already indexed, unchanged";
    static final String MSG_INDEXED = "processed and indexed";
    static final String MSG_NO_TEXT = "no extractable text";
    static final String MSG_INDEX_WRITE_FAILED = "index write failed";
    static final String MSG_NOT_IN_STORE = "not found in store";

    private final DocumentStore store;
    private final TextExtractor extractor;
    private final SearchIndex index;
    private final long maxFileSizeBytes;
    private final Duration urlTtl;
    private final Clock clock;

    public DocumentProcessor(final DocumentStore store,
                             final TextExtractor extractor,
                             final SearchIndex index,
                             final long maxFileSizeBytes,
                             final Duration urlTtl,
                             final Clock clock) {
        this.store = store;
        this.extractor = extractor;
        this.index = index;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.urlTtl = urlTtl;
        this.clock = clock;
    }

    public ProcessingOutcome process(final DocumentDescriptor descriptor) {
        final String key = descriptor.key();
        try {
            return doProcess(descriptor);
        } catch (final RuntimeException e) {
            logger.error("Unexpected error processing {}", key, e);
            return failed(key, describe(e));
        }
    }

    /**
     * Resolves the current descriptor from the store first, then processes it.
     */
    public ProcessingOutcome processKey(final String key) {
        final DocumentDescriptor descriptor;
        try {
            descriptor = store.describe(key);
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not read metadata of {}: {}", key, e.getMessage());
            return failed(key, describe(e));
        }
        if (descriptor == null) {
            return failed(key, MSG_NOT_IN_STORE + ": " + key);
        }
        return process(descriptor);
    }

    private ProcessingOutcome doProcess(final DocumentDescriptor descriptor) {
        final String key = descriptor.key();

        final IndexRecord existing = lookup(key);
        if (existing != null && Objects.equals(existing.fingerprint(), descriptor.fingerprint())) {
            logger.debug("{} unchanged (fingerprint {})", key, descriptor.fingerprint());
            return success(key, MSG_UNCHANGED);
        }

        if (descriptor.size() > maxFileSizeBytes) {
            logger.warn("{} is too large: {} bytes", key, descriptor.size());
            return failed(key, "too large: " + descriptor.size() + " bytes (max " + maxFileSizeBytes + ")");
        }

        final byte[] content;
        try {
            content = store.fetch(key);
        } catch (final IOException e) {
            logger.warn("Failed to fetch {}: {}", key, e.getMessage());
            return failed(key, describe(e));
        }

        final String text = extractor.extract(content, descriptor.fileName());
        if (text == null || text.isBlank()) {
            logger.warn("No text extracted from {}", key);
            return failed(key, MSG_NO_TEXT);
        }

        final IndexRecord record = new IndexRecord(
                key,
                descriptor.fileName(),
                text,
                descriptor.fileExtension(),
                descriptor.size(),
                descriptor.modifiedAt(),
                descriptor.fingerprint(),
                accessUrl(key),
                clock.instant());

        try {
            index.upsert(record);
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to index {}", key, e);
            return failed(key, MSG_INDEX_WRITE_FAILED + ": " + describe(e));
        }

        logger.debug("Indexed {} ({} characters)", key, text.length());
        return success(key, MSG_INDEXED);
    }

    @Nullable
    private IndexRecord lookup(final String key) {
        try {
            return index.get(key);
        } catch (final IOException | RuntimeException e) {
            // Reprocessing is idempotent, so an unknown state is handled as "not indexed"
            logger.warn("Index lookup for {} failed, processing anyway: {}", key, e.getMessage());
            return null;
        }
    }

    private String accessUrl(final String key) {
        try {
            return store.urlFor(key, urlTtl);
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not generate URL for {}: {}", key, e.getMessage());
            return "";
        }
    }

    private ProcessingOutcome success(final String key, final String message) {
        return ProcessingOutcome.success(key, message, clock.instant());
    }

    private ProcessingOutcome failed(final String key, final String message) {
        return ProcessingOutcome.failed(key, message, clock.instant());
    }

    private static String describe(final Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
