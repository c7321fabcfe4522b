package de.mirkosertic.mcp.blobsearch.extract;

/**
 * Turns raw document bytes into searchable plain text.
 */
public interface TextExtractor {

    /**
     * Extracts the text content of a document.
     * <p>
     * Implementations never throw. Unsupported, corrupt or text-free content yields an empty string.
     *
     * @param content  the raw bytes
     * @param fileName file name used as type hint (its suffix selects the parser)
     * @return the extracted text, possibly empty
     */
    String extract(byte[] content, String fileName);
}
