package de.mirkosertic.mcp.blobsearch;

import java.io.IOException;

/**
 * The blob store or the search index cannot be reached at all.
 * <p>
 * Unlike per-document failures this aborts a whole batch or sync run; no partial summary is produced.
 */
public class CollaboratorUnavailableException extends IOException {

    public CollaboratorUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
