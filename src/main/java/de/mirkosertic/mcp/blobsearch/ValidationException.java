package de.mirkosertic.mcp.blobsearch;

/**
 * Rejected request parameters. Thrown before any work starts.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(final String message) {
        super(message);
    }
}
