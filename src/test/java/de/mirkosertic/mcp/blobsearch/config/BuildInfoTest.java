package de.mirkosertic.mcp.blobsearch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BuildInfo.
 */
@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp")
    void shouldLoadVersionAndTimestamp() {
        // When: Access build info of the running build
        final String version = BuildInfo.getVersion();
        final String timestamp = BuildInfo.getBuildTimestamp();

        // Then: Either the filtered Maven values or the IDE fallbacks
        assertThat(version)
                .as("Version should be either Maven version or 'dev'")
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(timestamp)
                .as("Timestamp should be either ISO format or 'unknown'")
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }

    @Test
    @DisplayName("Should read filtered values")
    void shouldReadFilteredValues() {
        final BuildInfo info = BuildInfo.load("buildinfo/filtered.properties");

        assertThat(info.version()).isEqualTo("1.2.3");
        assertThat(info.buildTimestamp()).isEqualTo("2024-06-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should fall back for unfiltered placeholders")
    void shouldFallBackForPlaceholders() {
        final BuildInfo info = BuildInfo.load("buildinfo/unfiltered.properties");

        assertThat(info.version()).isEqualTo("dev");
        assertThat(info.buildTimestamp()).isEqualTo("unknown");
    }

    @Test
    @DisplayName("Should fall back when the resource is missing")
    void shouldFallBackForMissingResource() {
        final BuildInfo info = BuildInfo.load("buildinfo/does-not-exist.properties");

        assertThat(info.version()).isEqualTo("dev");
        assertThat(info.buildTimestamp()).isEqualTo("unknown");
    }
}
