package de.mirkosertic.mcp.blobsearch.index;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of index keys in ascending order.
 *
 * @param keys         the keys of this page
 * @param nextAfterKey cursor for the next page, {@code null} when the enumeration is complete
 */
public record KeyPage(List<String> keys, @Nullable String nextAfterKey) {

    public boolean hasMore() {
        return nextAfterKey != null;
    }
}
