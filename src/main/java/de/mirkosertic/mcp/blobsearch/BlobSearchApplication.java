package de.mirkosertic.mcp.blobsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.blobsearch.config.ApplicationConfig;
import de.mirkosertic.mcp.blobsearch.config.BuildInfo;
import de.mirkosertic.mcp.blobsearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.blobsearch.extract.TikaTextExtractor;
import de.mirkosertic.mcp.blobsearch.index.LuceneSearchIndex;
import de.mirkosertic.mcp.blobsearch.ingest.BatchCoordinator;
import de.mirkosertic.mcp.blobsearch.ingest.DocumentProcessor;
import de.mirkosertic.mcp.blobsearch.ingest.Reconciler;
import de.mirkosertic.mcp.blobsearch.store.S3DocumentStore;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Main entry point for the MCP Blob Search Server.
 * Wires store, extractor, index and ingestion services once and exposes them as MCP tools over STDIO.
 */
public class BlobSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(BlobSearchApplication.class);

    private final S3DocumentStore store;
    private final LuceneSearchIndex index;
    private final DocumentSearchService service;
    private final DocumentSearchTools tools;
    private McpSyncServer mcpServer;

    public BlobSearchApplication(final ApplicationConfig config) {
        final Clock clock = Clock.systemUTC();

        this.store = S3DocumentStore.create(config);
        this.index = new LuceneSearchIndex(Path.of(config.getIndexPath()),
                config.getNrtRefreshIntervalMs(), config.getKeyPageSize());

        final DocumentProcessor processor = new DocumentProcessor(
                store,
                new TikaTextExtractor(config.getMaxContentLength()),
                index,
                config.getMaxFileSizeBytes(),
                config.getUrlTtl(),
                clock);
        final BatchCoordinator coordinator = new BatchCoordinator(processor, clock);
        final Reconciler reconciler = new Reconciler(store, index, coordinator, config.getSyncConcurrency(), clock);

        this.service = new DocumentSearchService(
                store,
                index,
                processor,
                coordinator,
                reconciler,
                config.getSupportedExtensions(),
                config.getMaxFileSizeBytes(),
                config.getMaxConcurrency(),
                config.getUrlTtl());
        this.tools = new DocumentSearchTools(service, config.getDefaultConcurrency());
    }

    public void init() throws IOException {
        logger.info("Initializing MCP Blob Search Server...");
        index.init();
        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Blob Search Server",
                BuildInfo.getVersion()
        );

        final StdioServerTransportProvider transportProvider =
                new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public DocumentSearchService getService() {
        return service;
    }

    /**
     * Shutdown all services in reverse order of initialization.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Blob Search Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final RuntimeException e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            index.close();
        } catch (final IOException | RuntimeException e) {
            logger.error("Error closing index", e);
        }

        try {
            store.close();
        } catch (final RuntimeException e) {
            logger.error("Error closing S3 clients", e);
        }

        logger.info("MCP Blob Search Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything else logs
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!config.isDeployedMode()) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
                logger.info("Bucket: {}", config.getBucket());
            }

            final BlobSearchApplication app = new BlobSearchApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode the console is the MCP channel, stderr is the only safe place
            System.err.println("Failed to start MCP Blob Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
