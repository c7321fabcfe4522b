package de.mirkosertic.mcp.blobsearch.index;

import de.mirkosertic.mcp.blobsearch.CollaboratorUnavailableException;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TermRangeQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.uhighlight.UnifiedHighlighter;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link SearchIndex} on an embedded Lucene index.
 * <p>
 * A single {@link IndexWriter} serves all workers; a {@link SearcherManager} opened on that writer gives
 * near-real-time reads and is refreshed in the background every {@code nrtRefreshIntervalMs}.
 */
public class LuceneSearchIndex implements SearchIndex, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LuceneSearchIndex.class);

    private static final Map<String, Float> FIELD_BOOSTS = Map.of(
            IndexRecordMapper.FIELD_CONTENT, 2.0f,
            IndexRecordMapper.FIELD_FILE_NAME, 1.5f
    );
    private static final Sort RELEVANCE_THEN_NEWEST = new Sort(
            SortField.FIELD_SCORE,
            new SortField(IndexRecordMapper.FIELD_MODIFIED_AT_SORT, SortField.Type.LONG, true)
    );
    private static final int MAX_HIGHLIGHTS = 3;
    private static final int MAX_HIGHLIGHT_LENGTH = 150;

    private final Path indexPath;
    private final long nrtRefreshIntervalMs;
    private final int keyPageSize;
    private final Analyzer analyzer;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService refreshScheduler;

    public LuceneSearchIndex(final Path indexPath, final long nrtRefreshIntervalMs, final int keyPageSize) {
        this.indexPath = indexPath;
        this.nrtRefreshIntervalMs = nrtRefreshIntervalMs;
        this.keyPageSize = keyPageSize;
        this.analyzer = new StandardAnalyzer(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
    }

    /**
     * Opens (or creates) the index. Must be called before using the index.
     */
    public void init() throws IOException {
        if (!Files.exists(indexPath)) {
            Files.createDirectories(indexPath);
            logger.info("Created index directory: {}", indexPath.toAbsolutePath());
        }

        directory = FSDirectory.open(indexPath);
        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        refreshScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "lucene-nrt-refresh");
            t.setDaemon(true);
            return t;
        });
        refreshScheduler.scheduleAtFixedRate(this::maybeRefreshSearcher,
                nrtRefreshIntervalMs, nrtRefreshIntervalMs, TimeUnit.MILLISECONDS);

        logger.info("Lucene index opened at {} (schema version {}, NRT refresh every {}ms)",
                indexPath.toAbsolutePath(), IndexRecordMapper.SCHEMA_VERSION, nrtRefreshIntervalMs);
    }

    private void maybeRefreshSearcher() {
        try {
            searcherManager.maybeRefresh();
        } catch (final IOException | AlreadyClosedException e) {
            logger.warn("Failed to refresh SearcherManager", e);
        }
    }

    @Override
    @Nullable
    public IndexRecord get(final String key) throws IOException {
        // Upserts from other workers or tool calls must be visible to the fingerprint check
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(new TermQuery(IndexRecordMapper.keyTerm(key)), 1);
            if (topDocs.scoreDocs.length == 0) {
                return null;
            }
            return IndexRecordMapper.fromDocument(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void upsert(final IndexRecord record) throws IOException {
        indexWriter.updateDocument(IndexRecordMapper.keyTerm(record.key()), IndexRecordMapper.toDocument(record));
        logger.debug("Upserted {}", record.key());
    }

    @Override
    public boolean delete(final String key) throws IOException {
        searcherManager.maybeRefreshBlocking();
        final boolean present;
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            present = searcher.count(new TermQuery(IndexRecordMapper.keyTerm(key))) > 0;
        } finally {
            searcherManager.release(searcher);
        }
        if (!present) {
            return false;
        }
        indexWriter.deleteDocuments(IndexRecordMapper.keyTerm(key));
        logger.debug("Deleted {}", key);
        return true;
    }

    @Override
    public KeyPage listKeys(@Nullable final String afterKey, final int pageSize) throws IOException {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        try {
            if (afterKey == null) {
                // A fresh enumeration must see every write completed so far
                searcherManager.maybeRefreshBlocking();
            }
            final Query query = afterKey == null
                    ? new MatchAllDocsQuery()
                    : TermRangeQuery.newStringRange(IndexRecordMapper.FIELD_KEY, afterKey, null, false, true);
            final Sort byKey = new Sort(new SortField(IndexRecordMapper.FIELD_KEY, SortField.Type.STRING));

            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(query, pageSize, byKey);
                final List<String> keys = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    keys.add(searcher.storedFields().document(scoreDoc.doc).get(IndexRecordMapper.FIELD_KEY));
                }
                final String next = keys.size() == pageSize ? keys.get(keys.size() - 1) : null;
                return new KeyPage(List.copyOf(keys), next);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException | AlreadyClosedException e) {
            throw new CollaboratorUnavailableException("Failed to enumerate index keys", e);
        }
    }

    @Override
    public Set<String> listAllKeys() throws IOException {
        final Set<String> keys = new HashSet<>();
        String afterKey = null;
        do {
            final KeyPage page = listKeys(afterKey, keyPageSize);
            keys.addAll(page.keys());
            afterKey = page.nextAfterKey();
        } while (afterKey != null);
        return keys;
    }

    @Override
    public void refresh() throws IOException {
        try {
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (final AlreadyClosedException e) {
            throw new CollaboratorUnavailableException("Index is closed", e);
        }
    }

    @Override
    public IndexStatistics stats() throws IOException {
        final long documentCount;
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            documentCount = searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }

        long sizeBytes = 0;
        for (final String file : directory.listAll()) {
            try {
                sizeBytes += directory.fileLength(file);
            } catch (final NoSuchFileException e) {
                // Merged away between listAll() and fileLength()
                logger.debug("Index file {} vanished while computing size", file);
            }
        }
        return new IndexStatistics(documentCount, sizeBytes);
    }

    @Override
    public SearchResult search(final String queryString, final int size, final int offset) throws IOException {
        if (size < 1 || offset < 0) {
            throw new IllegalArgumentException("size must be positive and offset non-negative, was "
                    + size + "/" + offset);
        }
        final Query query = parseQuery(queryString);
        // Clamped, offset + size must not overflow into a negative hit count
        final int window = (int) Math.min((long) offset + size, Integer.MAX_VALUE);

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(query, window, RELEVANCE_THEN_NEWEST, true);
            final long totalHits = topDocs.totalHits.value;
            if (offset >= topDocs.scoreDocs.length) {
                return new SearchResult(queryString, totalHits, offset, size, List.of());
            }

            final UnifiedHighlighter highlighter = UnifiedHighlighter.builder(searcher, analyzer)
                    .withFormatter(new HighlightFormatter(MAX_HIGHLIGHT_LENGTH))
                    .build();
            final Map<String, String[]> highlights = highlighter.highlightFields(
                    new String[]{IndexRecordMapper.FIELD_CONTENT, IndexRecordMapper.FIELD_FILE_NAME},
                    query, topDocs, new int[]{MAX_HIGHLIGHTS, 1});
            final String[] contentHighlights = highlights.get(IndexRecordMapper.FIELD_CONTENT);
            final String[] fileNameHighlights = highlights.get(IndexRecordMapper.FIELD_FILE_NAME);

            final List<SearchHit> hits = new ArrayList<>();
            final ScoreDoc[] scoreDocs = topDocs.scoreDocs;
            for (int i = offset; i < scoreDocs.length; i++) {
                final Document doc = searcher.storedFields().document(scoreDocs[i].doc);
                hits.add(IndexRecordMapper.toHit(doc, scoreDocs[i].score,
                        HighlightFormatter.split(contentHighlights[i]),
                        matchedOnly(HighlightFormatter.split(fileNameHighlights[i]))));
            }

            logger.debug("Query '{}' matched {} documents, returning {} from offset {}",
                    queryString, totalHits, hits.size(), offset);
            return new SearchResult(queryString, totalHits, offset, size, List.copyOf(hits));
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Drops passages without a match, the highlighter falls back to the leading text otherwise.
     */
    private static List<String> matchedOnly(final List<String> passages) {
        return passages.stream()
                .filter(passage -> passage.contains("<em>"))
                .toList();
    }

    Query parseQuery(final String queryString) {
        final MultiFieldQueryParser parser = new TypoTolerantQueryParser(
                new String[]{IndexRecordMapper.FIELD_CONTENT, IndexRecordMapper.FIELD_FILE_NAME},
                analyzer, FIELD_BOOSTS);
        try {
            return parser.parse(queryString);
        } catch (final ParseException e) {
            // User input with unbalanced quotes or operators is searched literally
            logger.debug("Query '{}' is not valid query syntax, searching escaped: {}", queryString, e.getMessage());
            try {
                return parser.parse(QueryParser.escape(queryString));
            } catch (final ParseException escaped) {
                throw new IllegalArgumentException("Cannot parse query: " + queryString, escaped);
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (refreshScheduler != null) {
            refreshScheduler.shutdown();
            try {
                if (!refreshScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    refreshScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                refreshScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Lucene index closed");
    }
}
