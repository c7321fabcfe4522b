package de.mirkosertic.mcp.blobsearch.index;

import de.mirkosertic.mcp.blobsearch.CollaboratorUnavailableException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Keyed document index with full-text search.
 * <p>
 * Writes become visible to {@link #search} and {@link #listKeys} after {@link #refresh()} at the latest.
 * Concurrent writes to different keys are safe.
 */
public interface SearchIndex {

    int DEFAULT_PAGE_SIZE = 1000;

    /**
     * Reads the record as of the call. Upserts that completed before it are visible without a {@link #refresh()}.
     *
     * @return the record stored under the key, or {@code null} if there is none
     */
    @Nullable
    IndexRecord get(String key) throws IOException;

    /**
     * Creates or fully replaces the record with the same key.
     */
    void upsert(IndexRecord record) throws IOException;

    /**
     * @return {@code true} if a record was deleted, {@code false} if the key was absent
     */
    boolean delete(String key) throws IOException;

    /**
     * Enumerates keys in ascending order, starting after the given key.
     *
     * @param afterKey exclusive lower bound, {@code null} to start at the beginning
     * @param pageSize maximum number of keys to return
     * @throws CollaboratorUnavailableException if the index cannot be read
     */
    KeyPage listKeys(@Nullable String afterKey, int pageSize) throws IOException;

    /**
     * Collects every key by following {@link #listKeys} pages until the enumeration is exhausted.
     */
    default Set<String> listAllKeys() throws IOException {
        final Set<String> keys = new HashSet<>();
        String afterKey = null;
        do {
            final KeyPage page = listKeys(afterKey, DEFAULT_PAGE_SIZE);
            keys.addAll(page.keys());
            afterKey = page.nextAfterKey();
        } while (afterKey != null);
        return keys;
    }

    /**
     * Visibility barrier: every write completed before this call is searchable afterwards.
     */
    void refresh() throws IOException;

    IndexStatistics stats() throws IOException;

    SearchResult search(String query, int size, int offset) throws IOException;
}
