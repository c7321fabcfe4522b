package de.mirkosertic.mcp.blobsearch.ingest;

import de.mirkosertic.mcp.blobsearch.extract.TextExtractor;
import de.mirkosertic.mcp.blobsearch.index.IndexRecord;
import de.mirkosertic.mcp.blobsearch.store.DocumentDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentProcessor")
class DocumentProcessorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final long MAX_SIZE = 64;

    private final TextExtractor plainTextExtractor = (content, fileName) -> new String(content, StandardCharsets.UTF_8);

    private InMemoryDocumentStore store;
    private InMemorySearchIndex index;
    private DocumentProcessor processor;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        index = new InMemorySearchIndex();
        processor = newProcessor(plainTextExtractor);
    }

    private DocumentProcessor newProcessor(final TextExtractor extractor) {
        return new DocumentProcessor(store, extractor, index, MAX_SIZE, Duration.ofHours(1),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("indexing")
    class Indexing {

        @Test
        @DisplayName("should index a new document with its metadata")
        void shouldIndexNewDocument() throws IOException {
            // Given
            store.put("reports/q1.txt", "quarterly revenue grew");

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("reports/q1.txt"));

            // Then
            assertThat(outcome.status()).isEqualTo(ProcessingStatus.SUCCESS);
            assertThat(outcome.message()).isEqualTo(DocumentProcessor.MSG_INDEXED);
            assertThat(outcome.completedAt()).isEqualTo(NOW);

            final IndexRecord record = index.get("reports/q1.txt");
            assertThat(record).isNotNull();
            assertThat(record.fileName()).isEqualTo("q1.txt");
            assertThat(record.fileExtension()).isEqualTo("txt");
            assertThat(record.extractedText()).isEqualTo("quarterly revenue grew");
            assertThat(record.fingerprint()).isEqualTo(store.descriptorOf("reports/q1.txt").fingerprint());
            assertThat(record.url()).startsWith("https://example-bucket.s3.amazonaws.com/reports/q1.txt");
            assertThat(record.indexedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should not fetch an unchanged document a second time")
        void shouldSkipUnchangedDocument() throws IOException {
            // Given
            store.put("a.txt", "alpha");
            processor.process(store.descriptorOf("a.txt"));
            final IndexRecord first = index.get("a.txt");

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.message()).isEqualTo(DocumentProcessor.MSG_UNCHANGED);
            assertThat(store.fetchCount("a.txt")).isEqualTo(1);
            assertThat(index.upsertCount()).isEqualTo(1);
            assertThat(index.get("a.txt")).isEqualTo(first);
        }

        @Test
        @DisplayName("should reprocess a document whose fingerprint changed")
        void shouldReprocessChangedDocument() throws IOException {
            // Given
            store.put("a.txt", "first version");
            processor.process(store.descriptorOf("a.txt"));
            store.put("a.txt", "second version");

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.message()).isEqualTo(DocumentProcessor.MSG_INDEXED);
            assertThat(store.fetchCount("a.txt")).isEqualTo(2);
            assertThat(index.get("a.txt").extractedText()).isEqualTo("second version");
        }

        @Test
        @DisplayName("should process anyway when the index lookup fails")
        void shouldProcessWhenLookupFails() {
            // Given
            store.put("a.txt", "alpha");
            index.failLookup();

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(store.fetchCount("a.txt")).isEqualTo(1);
        }

        @Test
        @DisplayName("should index with an empty URL when signing fails")
        void shouldIndexWithEmptyUrlWhenSigningFails() throws IOException {
            // Given
            store.put("a.txt", "alpha");
            store.failUrlGeneration();

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(index.get("a.txt").url()).isEmpty();
        }
    }

    @Nested
    @DisplayName("size limit")
    class SizeLimit {

        @Test
        @DisplayName("should process a document exactly at the limit")
        void shouldProcessDocumentAtLimit() {
            // Given
            store.put("exact.txt", "x".repeat((int) MAX_SIZE));

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("exact.txt"));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should reject a document one byte over the limit without fetching it")
        void shouldRejectOversizedDocument() {
            // Given
            store.put("big.txt", "x".repeat((int) MAX_SIZE + 1));

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("big.txt"));

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo("too large: 65 bytes (max 64)");
            assertThat(store.fetchCount("big.txt")).isZero();
            assertThat(index.keys()).isEmpty();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should report a fetch failure with its message")
        void shouldReportFetchFailure() {
            // Given
            store.put("a.txt", "alpha");
            store.failFetch("a.txt", new IOException("connection reset"));

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo("connection reset");
        }

        @Test
        @DisplayName("should fail a document that vanished between listing and fetch")
        void shouldFailVanishedDocument() {
            // Given
            store.put("gone.txt", "alpha");
            final DocumentDescriptor descriptor = store.descriptorOf("gone.txt");
            store.remove("gone.txt");

            // When
            final ProcessingOutcome outcome = processor.process(descriptor);

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).contains("gone.txt");
        }

        @Test
        @DisplayName("should fail a document without extractable text")
        void shouldFailBlankText() {
            // Given
            store.put("blank.txt", "   \n  ");

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("blank.txt"));

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo(DocumentProcessor.MSG_NO_TEXT);
            assertThat(index.keys()).isEmpty();
        }

        @Test
        @DisplayName("should report an index write failure")
        void shouldReportIndexWriteFailure() {
            // Given
            store.put("a.txt", "alpha");
            index.failUpsert("a.txt");

            // When
            final ProcessingOutcome outcome = processor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo("index write failed: disk full");
        }

        @Test
        @DisplayName("should turn an unexpected extractor exception into a failed outcome")
        void shouldCatchUnexpectedException() {
            // Given
            store.put("a.txt", "alpha");
            final DocumentProcessor failingProcessor = newProcessor((content, fileName) -> {
                throw new IllegalStateException("parser crashed");
            });

            // When
            final ProcessingOutcome outcome = failingProcessor.process(store.descriptorOf("a.txt"));

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo("parser crashed");
        }
    }

    @Nested
    @DisplayName("processKey")
    class ProcessKey {

        @Test
        @DisplayName("should resolve the descriptor from the store")
        void shouldResolveDescriptor() throws IOException {
            // Given
            store.put("docs/readme.txt", "hello");

            // When
            final ProcessingOutcome outcome = processor.processKey("docs/readme.txt");

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(index.get("docs/readme.txt")).isNotNull();
        }

        @Test
        @DisplayName("should fail for a key that is not in the store")
        void shouldFailForUnknownKey() {
            // When
            final ProcessingOutcome outcome = processor.processKey("missing.txt");

            // Then
            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.message()).isEqualTo("not found in store: missing.txt");
            assertThat(store.totalFetches()).isZero();
        }
    }
}
