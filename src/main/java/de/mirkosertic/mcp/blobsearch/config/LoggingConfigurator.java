package de.mirkosertic.mcp.blobsearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file-only output when the server runs in deployed mode.
 * <p>
 * STDOUT carries the MCP JSON-RPC stream in that mode, so nothing may be logged to the console.
 * Development runs keep the classpath default {@code logback.xml}.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param deployedMode true when running with the STDIO transport in production
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        createLogDirectory(logDirectory());
        reconfigure(DEPLOYED_CONFIG);
    }

    static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    static boolean createLogDirectory(final Path logDir) {
        try {
            Files.createDirectories(logDir);
            return true;
        } catch (final IOException e) {
            // Logback is not configured yet, stderr is the only safe channel
            System.err.println("Warning: could not create log directory " + logDir + ": " + e.getMessage());
            return false;
        }
    }

    static boolean reconfigure(final String resourceName) {
        final URL resource = LoggingConfigurator.class.getClassLoader().getResource(resourceName);
        if (resource == null) {
            System.err.println("Warning: " + resourceName + " not found on classpath, keeping default logging");
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream in = resource.openStream()) {
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(in);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: failed to apply " + resourceName + ": " + e.getMessage());
            return false;
        }
    }
}
