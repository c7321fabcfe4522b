package de.mirkosertic.mcp.blobsearch.store;

import java.io.IOException;

public class DocumentNotFoundException extends IOException {

    private final String key;

    public DocumentNotFoundException(final String key) {
        super("Document not found in store: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
