package de.mirkosertic.mcp.blobsearch.index;

import de.mirkosertic.mcp.blobsearch.extract.TextNormalizer;
import org.apache.lucene.search.uhighlight.Passage;
import org.apache.lucene.search.uhighlight.PassageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Formats each highlighter passage on its own instead of concatenating them like
 * {@link org.apache.lucene.search.uhighlight.DefaultPassageFormatter}.
 * <p>
 * The UnifiedHighlighter's public API returns one string per document, so passages are joined with
 * {@link #SEPARATOR} and split again by {@link #split(String)}.
 */
class HighlightFormatter extends PassageFormatter {

    static final String SEPARATOR = "\u2063";

    private static final Pattern SEPARATOR_PATTERN = Pattern.compile(SEPARATOR);

    private final int maxPassageLength;

    HighlightFormatter(final int maxPassageLength) {
        this.maxPassageLength = maxPassageLength;
    }

    @Override
    public Object format(final Passage[] passages, final String content) {
        final StringBuilder result = new StringBuilder();
        for (final Passage passage : passages) {
            if (result.length() > 0) {
                result.append(SEPARATOR);
            }
            result.append(formatPassage(passage, content));
        }
        return result.toString();
    }

    private String formatPassage(final Passage passage, final String content) {
        final StringBuilder sb = new StringBuilder();
        int pos = passage.getStartOffset();
        final int limit = Math.min(passage.getEndOffset(), passage.getStartOffset() + maxPassageLength);

        if (pos > 0) {
            sb.append("...");
        }

        for (int i = 0; i < passage.getNumMatches(); i++) {
            final int start = passage.getMatchStarts()[i];
            final int end = passage.getMatchEnds()[i];
            if (start >= limit) {
                break;
            }
            // Overlapping matches are merged into the previous tag
            if (start > pos) {
                sb.append(content, pos, start);
            }
            if (end > pos) {
                sb.append("<em>");
                sb.append(content, Math.max(pos, start), end);
                sb.append("</em>");
                pos = end;
            }
        }

        if (limit > pos) {
            sb.append(content, pos, limit);
        }
        if (limit < passage.getEndOffset() || passage.getEndOffset() < content.length()) {
            sb.append("...");
        }

        return TextNormalizer.toSingleLine(sb.toString());
    }

    static List<String> split(final String formatted) {
        if (formatted == null || formatted.isEmpty()) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        for (final String passage : SEPARATOR_PATTERN.split(formatted)) {
            if (!passage.isBlank()) {
                result.add(passage);
            }
        }
        return List.copyOf(result);
    }
}
