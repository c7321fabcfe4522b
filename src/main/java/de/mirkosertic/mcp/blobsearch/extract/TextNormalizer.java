package de.mirkosertic.mcp.blobsearch.extract;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans up artifacts common in PDF and Office extraction before text reaches the index.
 */
public final class TextNormalizer {

    // C0 and C1 control characters except tab and newline
    private static final Pattern CONTROL_CHARS =
            Pattern.compile("[\u0000-\u0008\u000B\u000C\u000E-\u001F\u007F-\u009F\uFFFD]");

    private static final Pattern UNICODE_SPACES =
            Pattern.compile("[\u00A0\u1680\u2000-\u200B\u202F\u205F\u3000\uFEFF]");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t ]+");

    private static final Pattern LINE_BREAKS = Pattern.compile(" *(\\r?\\n *)+");

    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * NFKC-normalizes the text (expanding ligatures and full-width forms), strips control characters,
     * maps exotic spaces to ASCII space and collapses whitespace while keeping single line breaks.
     *
     * @return the normalized text, empty for {@code null} input
     */
    public static String normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = UNICODE_SPACES.matcher(result).replaceAll(" ");
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = LINE_BREAKS.matcher(result).replaceAll("\n");
        return result.trim();
    }

    /**
     * Single-line variant used for highlight snippets.
     */
    public static String toSingleLine(final String text) {
        final String normalized = normalize(text);
        return ANY_WHITESPACE.matcher(normalized).replaceAll(" ");
    }
}
