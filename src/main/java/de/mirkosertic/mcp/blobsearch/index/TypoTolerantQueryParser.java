package de.mirkosertic.mcp.blobsearch.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.Query;

import java.util.Map;

/**
 * Multi-field parser that turns every unquoted term into a {@link FuzzyQuery}.
 * <p>
 * The allowed edit distance grows with the term length: none up to two characters, one up to five, two beyond.
 * Quoted text keeps exact term matching. Instances are not thread-safe, create one per query.
 */
class TypoTolerantQueryParser extends MultiFieldQueryParser {

    private static final int PREFIX_LENGTH = 0;
    private static final int MAX_EXPANSIONS = 50;

    private boolean quoted;

    TypoTolerantQueryParser(final String[] fields, final Analyzer analyzer, final Map<String, Float> boosts) {
        super(fields, analyzer, boosts);
    }

    static int editDistanceFor(final String term) {
        final int length = term.codePointCount(0, term.length());
        if (length <= 2) {
            return 0;
        }
        return length <= 5 ? 1 : 2;
    }

    @Override
    protected Query getFieldQuery(final String field, final String queryText, final boolean quotedText)
            throws ParseException {
        final boolean previous = quoted;
        quoted = quotedText;
        try {
            return super.getFieldQuery(field, queryText, quotedText);
        } finally {
            quoted = previous;
        }
    }

    @Override
    protected Query getFieldQuery(final String field, final String queryText, final int slop) throws ParseException {
        // Quoted text arrives here, with or without an explicit slop
        final boolean previous = quoted;
        quoted = true;
        try {
            return super.getFieldQuery(field, queryText, slop);
        } finally {
            quoted = previous;
        }
    }

    @Override
    protected Query newTermQuery(final Term term, final float boost) {
        final int edits = quoted ? 0 : editDistanceFor(term.text());
        if (edits == 0) {
            return super.newTermQuery(term, boost);
        }
        final Query fuzzy = new FuzzyQuery(term, edits, PREFIX_LENGTH, MAX_EXPANSIONS, true);
        return boost == 1.0f ? fuzzy : new BoostQuery(fuzzy, boost);
    }
}
