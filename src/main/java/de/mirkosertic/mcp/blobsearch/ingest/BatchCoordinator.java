package de.mirkosertic.mcp.blobsearch.ingest;

import de.mirkosertic.mcp.blobsearch.store.DocumentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans a list of documents out to a bounded pool of workers and aggregates the outcomes.
 * <p>
 * Each call gets its own fixed pool of {@code concurrency} threads, torn down when the batch ends.
 * Batches on the same coordinator never overlap: a second caller waits until the running batch is done.
 */
public class BatchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    private final DocumentProcessor processor;
    private final Clock clock;
    private final ReentrantLock batchLock = new ReentrantLock(true);

    public BatchCoordinator(final DocumentProcessor processor, final Clock clock) {
        this.processor = processor;
        this.clock = clock;
    }

    /**
     * Source of the documents for one batch, read once the batch holds the exclusive section.
     */
    @FunctionalInterface
    public interface DocumentListing {

        List<DocumentDescriptor> list() throws IOException;
    }

    /**
     * Processes all descriptors with at most {@code concurrency} documents in flight.
     * Blocks until every document has an outcome.
     *
     * @throws IllegalArgumentException if {@code concurrency < 1}
     * @throws IOException              if the calling thread is interrupted while waiting
     */
    public BatchSummary processBatch(final List<DocumentDescriptor> descriptors, final int concurrency)
            throws IOException {
        requireConcurrency(concurrency);
        if (descriptors.isEmpty()) {
            return BatchSummary.empty();
        }
        return processListing(() -> descriptors, concurrency);
    }

    /**
     * Like {@link #processBatch}, but reads the documents only after a running batch has finished.
     *
     * @throws IOException if the listing fails or the calling thread is interrupted while waiting
     */
    public BatchSummary processListing(final DocumentListing listing, final int concurrency) throws IOException {
        requireConcurrency(concurrency);
        try {
            batchLock.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the running batch to finish", e);
        }
        try {
            final List<DocumentDescriptor> descriptors = listing.list();
            if (descriptors.isEmpty()) {
                return BatchSummary.empty();
            }
            return runBatch(descriptors, concurrency);
        } finally {
            batchLock.unlock();
        }
    }

    private static void requireConcurrency(final int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
    }

    /**
     * @return true while a batch holds the exclusive section
     */
    public boolean isBusy() {
        return batchLock.isLocked();
    }

    private BatchSummary runBatch(final List<DocumentDescriptor> descriptors, final int concurrency)
            throws IOException {
        final long startTime = System.currentTimeMillis();
        logger.info("Starting batch of {} documents with {} workers", descriptors.size(), concurrency);

        final ExecutorService executor = Executors.newFixedThreadPool(concurrency, workerThreadFactory());
        try {
            final CompletionService<ProcessingOutcome> completionService = new ExecutorCompletionService<>(executor);
            final Map<Future<ProcessingOutcome>, DocumentDescriptor> pending = new IdentityHashMap<>();
            for (final DocumentDescriptor descriptor : descriptors) {
                pending.put(completionService.submit(() -> processor.process(descriptor)), descriptor);
            }

            final List<ProcessingOutcome> outcomes = new ArrayList<>(descriptors.size());
            for (int i = 0; i < descriptors.size(); i++) {
                final Future<ProcessingOutcome> done = completionService.take();
                outcomes.add(outcomeOf(done, pending.get(done)));
            }

            final BatchSummary summary = BatchSummary.of(descriptors.size(), outcomes);
            logger.info("Batch completed in {}ms: {} processed, {} failed, {} skipped",
                    System.currentTimeMillis() - startTime,
                    summary.processedCount(), summary.failedCount(), summary.skippedCount());
            return summary;
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for batch results", e);
        } finally {
            shutdown(executor);
        }
    }

    private ProcessingOutcome outcomeOf(final Future<ProcessingOutcome> future, final DocumentDescriptor descriptor)
            throws InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Worker failed on {}", descriptor.key(), cause);
            final String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return ProcessingOutcome.failed(descriptor.key(), message, clock.instant());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            final Thread thread = new Thread(r, "batch-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    private static void shutdown(final ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Batch workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
