package de.mirkosertic.mcp.blobsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, read from the Maven-filtered {@code build-info.properties}.
 * Running from an IDE without resource filtering yields "dev" and "unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String RESOURCE = "build-info.properties";
    private static final String UNFILTERED_MARKER = "${";

    private static final BuildInfo INSTANCE = load(RESOURCE);

    private final String version;
    private final String buildTimestamp;

    BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    static BuildInfo load(final String resourceName) {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (input == null) {
                logger.debug("{} not found, running in dev mode", resourceName);
            } else {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to read {}", resourceName, e);
        }
        return new BuildInfo(
                valueOrDefault(props.getProperty("build.version"), "dev"),
                valueOrDefault(props.getProperty("build.timestamp"), "unknown"));
    }

    private static String valueOrDefault(final String value, final String defaultValue) {
        if (value == null || value.isBlank() || value.contains(UNFILTERED_MARKER)) {
            return defaultValue;
        }
        return value.trim();
    }

    public static String getVersion() {
        return INSTANCE.version;
    }

    public static String getBuildTimestamp() {
        return INSTANCE.buildTimestamp;
    }

    String version() {
        return version;
    }

    String buildTimestamp() {
        return buildTimestamp;
    }
}
