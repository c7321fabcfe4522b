package de.mirkosertic.mcp.blobsearch.index;

import java.time.Instant;

/**
 * The searchable representation of one store document.
 *
 * @param key           store key, unique within the index
 * @param fileName      last path segment of the key
 * @param extractedText normalized text content
 * @param fileExtension lower-case suffix without the dot
 * @param size          content length in bytes at indexing time
 * @param modifiedAt    store modification time at indexing time
 * @param fingerprint   store fingerprint the record was built from
 * @param url           access URL generated at indexing time, empty when unavailable
 * @param indexedAt     time of the upsert
 */
public record IndexRecord(
        String key,
        String fileName,
        String extractedText,
        String fileExtension,
        long size,
        Instant modifiedAt,
        String fingerprint,
        String url,
        Instant indexedAt
) {
}
