package de.mirkosertic.mcp.blobsearch.store;

import java.time.Instant;
import java.util.Locale;

/**
 * Metadata of one document as currently listed by the store.
 *
 * @param key         store-unique identifier, the join key between store and index
 * @param size        content length in bytes
 * @param modifiedAt  last modification time reported by the store
 * @param fingerprint opaque content version token (the S3 ETag without quotes)
 */
public record DocumentDescriptor(String key, long size, Instant modifiedAt, String fingerprint) {

    /**
     * Last path segment of the key.
     */
    public String fileName() {
        return fileNameOf(key);
    }

    /**
     * Lower-case suffix of the file name without the dot, empty when there is none.
     */
    public String fileExtension() {
        return extensionOf(key);
    }

    public static String fileNameOf(final String key) {
        final int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    public static String extensionOf(final String key) {
        final String fileName = fileNameOf(key);
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
