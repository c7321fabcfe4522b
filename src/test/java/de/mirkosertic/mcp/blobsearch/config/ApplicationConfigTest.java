package de.mirkosertic.mcp.blobsearch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    private static ApplicationConfig fromYaml(final String yaml) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        return config;
    }

    @Nested
    @DisplayName("YAML")
    class YamlLoading {

        @Test
        @DisplayName("should read store, index and processing settings")
        void shouldReadAllSections() {
            // Given
            final String yaml = """
                    blobsearch:
                      store:
                        bucket: team-documents
                        region: eu-west-1
                        endpoint: http://localhost:9000
                        path-style-access: true
                        prefix: shared/
                        url-ttl-seconds: 900
                      index:
                        path: /var/lib/blobsearch/index
                        nrt-refresh-interval-ms: 250
                        key-page-size: 500
                      processing:
                        supported-extensions: [ "TXT", ".pdf", "pdf" ]
                        max-file-size-mb: 10
                        max-content-length: 200000
                        default-concurrency: 4
                        max-concurrency: 12
                        sync-concurrency: 2
                    """;

            // When
            final ApplicationConfig config = fromYaml(yaml);

            // Then
            assertThat(config.getBucket()).isEqualTo("team-documents");
            assertThat(config.getRegion()).isEqualTo("eu-west-1");
            assertThat(config.getEndpoint()).isEqualTo("http://localhost:9000");
            assertThat(config.isPathStyleAccess()).isTrue();
            assertThat(config.getPrefix()).isEqualTo("shared/");
            assertThat(config.getUrlTtl()).isEqualTo(Duration.ofMinutes(15));
            assertThat(config.getIndexPath()).isEqualTo("/var/lib/blobsearch/index");
            assertThat(config.getNrtRefreshIntervalMs()).isEqualTo(250);
            assertThat(config.getKeyPageSize()).isEqualTo(500);
            assertThat(config.getSupportedExtensions()).containsExactly(".txt", ".pdf");
            assertThat(config.getMaxFileSizeMb()).isEqualTo(10);
            assertThat(config.getMaxFileSizeBytes()).isEqualTo(10L * 1024 * 1024);
            assertThat(config.getMaxContentLength()).isEqualTo(200_000);
            assertThat(config.getDefaultConcurrency()).isEqualTo(4);
            assertThat(config.getMaxConcurrency()).isEqualTo(12);
            assertThat(config.getSyncConcurrency()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep defaults for missing sections")
        void shouldKeepDefaults() {
            // When
            final ApplicationConfig config = fromYaml("other: value\n");

            // Then
            assertThat(config.getRegion()).isEqualTo("us-east-1");
            assertThat(config.getUrlTtl()).isEqualTo(Duration.ofHours(1));
            assertThat(config.getMaxFileSizeMb()).isEqualTo(100);
            assertThat(config.getDefaultConcurrency()).isEqualTo(5);
            assertThat(config.getMaxConcurrency()).isEqualTo(ApplicationConfig.HARD_MAX_CONCURRENCY);
            assertThat(config.getSupportedExtensions())
                    .containsExactly(".txt", ".csv", ".pdf", ".png", ".jpg", ".jpeg", ".docx", ".xlsx");
        }

        @Test
        @DisplayName("should load the bundled application.yaml")
        void shouldLoadBundledDefaults() {
            // When
            final ApplicationConfig config = new ApplicationConfig();
            config.applyYaml(ApplicationConfigTest.class.getClassLoader().getResourceAsStream("application.yaml"));

            // Then
            assertThat(config.getKeyPageSize()).isEqualTo(1000);
            assertThat(config.getSyncConcurrency()).isEqualTo(3);
            assertThat(config.getIndexPath()).endsWith("index").doesNotContain("${");
        }
    }

    @Nested
    @DisplayName("limits")
    class Limits {

        @Test
        @DisplayName("should clamp concurrency settings into the allowed range")
        void shouldClampConcurrency() {
            // Given
            final ApplicationConfig config = fromYaml("""
                    blobsearch:
                      processing:
                        max-concurrency: 50
                        default-concurrency: 0
                        sync-concurrency: 30
                    """);

            // When
            config.clampLimits();

            // Then
            assertThat(config.getMaxConcurrency()).isEqualTo(ApplicationConfig.HARD_MAX_CONCURRENCY);
            assertThat(config.getDefaultConcurrency()).isEqualTo(5);
            assertThat(config.getSyncConcurrency()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not raise defaults above a small maximum")
        void shouldRespectSmallMaximum() {
            // Given
            final ApplicationConfig config = fromYaml("""
                    blobsearch:
                      processing:
                        max-concurrency: 2
                        default-concurrency: 10
                        sync-concurrency: 10
                    """);

            // When
            config.clampLimits();

            // Then
            assertThat(config.getMaxConcurrency()).isEqualTo(2);
            assertThat(config.getDefaultConcurrency()).isEqualTo(2);
            assertThat(config.getSyncConcurrency()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("helpers")
    class Helpers {

        @Test
        @DisplayName("should normalize extensions")
        void shouldNormalizeExtensions() {
            assertThat(ApplicationConfig.normalizeExtensions(Arrays.asList(" PDF ", ".Txt", "", null, "pdf", "docx")))
                    .containsExactly(".pdf", ".txt", ".docx");
        }

        @Test
        @DisplayName("should use the default of an unset variable")
        void shouldResolveDefault() {
            assertThat(ApplicationConfig.resolveVariables("s3-${BLOBSEARCH_TEST_SURELY_UNSET_VARIABLE:fallback}-bucket"))
                    .isEqualTo("s3-fallback-bucket");
        }

        @Test
        @DisplayName("should resolve system properties")
        void shouldResolveSystemProperty() {
            assertThat(ApplicationConfig.resolveVariables("${user.home}/index"))
                    .isEqualTo(System.getProperty("user.home") + "/index");
        }

        @Test
        @DisplayName("should leave plain values alone")
        void shouldLeavePlainValues() {
            assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
            assertThat(ApplicationConfig.resolveVariables(null)).isNull();
        }

        @Test
        @DisplayName("should place the user config below the home directory")
        void shouldLocateUserConfig() {
            assertThat(ApplicationConfig.getUserConfigPath().toString())
                    .startsWith(System.getProperty("user.home"))
                    .endsWith("config.yaml");
            assertThat(ApplicationConfig.getConfigDirectory().getFileName()).hasToString(".mcpblobsearch");
        }
    }
}
