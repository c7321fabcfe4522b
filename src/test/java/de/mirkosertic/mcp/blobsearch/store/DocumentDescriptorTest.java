package de.mirkosertic.mcp.blobsearch.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentDescriptor")
class DocumentDescriptorTest {

    @ParameterizedTest(name = "{0} -> name ''{1}'', extension ''{2}''")
    @CsvSource({
            "report.pdf, report.pdf, pdf",
            "a/b/c/Scan.JPEG, Scan.JPEG, jpeg",
            "archive.tar.gz, archive.tar.gz, gz",
            "folder/README, README, ''",
            "folder/trailing., trailing., ''",
            ".hidden, .hidden, hidden"
    })
    void shouldDeriveNameAndExtension(final String key, final String fileName, final String extension) {
        assertThat(DocumentDescriptor.fileNameOf(key)).isEqualTo(fileName);
        assertThat(DocumentDescriptor.extensionOf(key)).isEqualTo(extension);
    }
}
