package de.mirkosertic.mcp.blobsearch.store;

import de.mirkosertic.mcp.blobsearch.CollaboratorUnavailableException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Read-only view of the remote blob store holding the source documents.
 * Documents are never modified or deleted through this interface.
 */
public interface DocumentStore {

    /**
     * Lists all documents whose file extension is on the configured allow-list.
     *
     * @throws CollaboratorUnavailableException if the store cannot be listed
     */
    List<DocumentDescriptor> list() throws IOException;

    /**
     * Current metadata of a single document, or {@code null} if the key does not exist.
     */
    @Nullable
    DocumentDescriptor describe(String key) throws IOException;

    /**
     * Downloads the complete content of a document.
     *
     * @throws DocumentNotFoundException if the key does not exist
     * @throws IOException               on any other transfer failure
     */
    byte[] fetch(String key) throws IOException;

    /**
     * A time-limited access URL for the document.
     */
    String urlFor(String key, Duration ttl) throws IOException;

    StoreStatistics statistics() throws IOException;
}
