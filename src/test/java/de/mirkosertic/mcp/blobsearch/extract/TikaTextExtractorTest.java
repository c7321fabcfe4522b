package de.mirkosertic.mcp.blobsearch.extract;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TikaTextExtractor} covering the supported document formats.
 */
@DisplayName("TikaTextExtractor")
class TikaTextExtractorTest {

    private static TikaTextExtractor extractor;

    @BeforeAll
    static void setUp() {
        extractor = new TikaTextExtractor(-1);
    }

    @FunctionalInterface
    interface DocumentFactory {
        byte[] create() throws IOException;
    }

    static Stream<Arguments> documentFormats() {
        return Stream.of(
                Arguments.of("test.txt", (DocumentFactory) TestDocumentGenerator::createTxt),
                Arguments.of("test.csv", (DocumentFactory) TestDocumentGenerator::createCsv),
                Arguments.of("test.pdf", (DocumentFactory) TestDocumentGenerator::createPdf),
                Arguments.of("test.docx", (DocumentFactory) TestDocumentGenerator::createDocx),
                Arguments.of("test.xlsx", (DocumentFactory) TestDocumentGenerator::createXlsx)
        );
    }

    @ParameterizedTest(name = "should extract text from {0}")
    @MethodSource("documentFormats")
    void shouldExtractText(final String fileName, final DocumentFactory factory) throws IOException {
        // Given
        final byte[] content = factory.create();

        // When
        final String text = extractor.extract(content, fileName);

        // Then
        assertThat(text)
                .as("Extracted text of %s", fileName)
                .contains(TestDocumentGenerator.TEST_CONTENT);
    }

    @Test
    @DisplayName("should return empty text for empty content")
    void shouldHandleEmptyContent() {
        assertThat(extractor.extract(new byte[0], "empty.txt")).isEmpty();
    }

    @Test
    @DisplayName("should return empty text for a corrupt PDF")
    void shouldHandleCorruptPdf() {
        // Given
        final byte[] garbage = "%PDF-1.7 this is not really a pdf".getBytes(StandardCharsets.US_ASCII);

        // When
        final String text = extractor.extract(garbage, "broken.pdf");

        // Then
        assertThat(text).isEmpty();
    }

    @Test
    @DisplayName("should truncate at the configured content length")
    void shouldTruncateLongContent() {
        // Given
        final TikaTextExtractor limited = new TikaTextExtractor(20);
        final byte[] content = "word ".repeat(1000).getBytes(StandardCharsets.UTF_8);

        // When
        final String text = limited.extract(content, "long.txt");

        // Then
        assertThat(text).isNotEmpty().hasSizeLessThanOrEqualTo(20).startsWith("word");
    }

    @Test
    @DisplayName("should normalize whitespace of extracted text")
    void shouldNormalizeText() {
        // Given
        final byte[] content = "first   line\n\n\nsecond\tline".getBytes(StandardCharsets.UTF_8);

        // When
        final String text = extractor.extract(content, "spacing.txt");

        // Then
        assertThat(text).isEqualTo("first line\nsecond line");
    }
}
