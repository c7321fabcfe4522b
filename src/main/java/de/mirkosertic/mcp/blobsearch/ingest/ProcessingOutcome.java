package de.mirkosertic.mcp.blobsearch.ingest;

import java.time.Instant;

/**
 * Result of processing one document.
 */
public record ProcessingOutcome(String key, ProcessingStatus status, String message, Instant completedAt) {

    public static ProcessingOutcome success(final String key, final String message, final Instant completedAt) {
        return new ProcessingOutcome(key, ProcessingStatus.SUCCESS, message, completedAt);
    }

    public static ProcessingOutcome failed(final String key, final String message, final Instant completedAt) {
        return new ProcessingOutcome(key, ProcessingStatus.FAILED, message, completedAt);
    }

    public boolean isSuccess() {
        return status == ProcessingStatus.SUCCESS;
    }

    public boolean isFailed() {
        return status == ProcessingStatus.FAILED;
    }
}
