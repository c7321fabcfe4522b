package de.mirkosertic.mcp.blobsearch;

import de.mirkosertic.mcp.blobsearch.config.BuildInfo;
import de.mirkosertic.mcp.blobsearch.index.IndexRecord;
import de.mirkosertic.mcp.blobsearch.index.SearchResult;
import de.mirkosertic.mcp.blobsearch.ingest.BatchSummary;
import de.mirkosertic.mcp.blobsearch.ingest.ProcessingOutcome;
import de.mirkosertic.mcp.blobsearch.ingest.SyncSummary;
import de.mirkosertic.mcp.blobsearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResultHelper;
import de.mirkosertic.mcp.blobsearch.mcp.dto.DeleteDocumentRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.DeleteDocumentResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.GetDocumentDetailsRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.GetDocumentDetailsResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.ProcessAllRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.ProcessAllResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.ProcessDocumentRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.ProcessDocumentResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.StatusResponse;
import de.mirkosertic.mcp.blobsearch.mcp.dto.SyncResponse;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools over {@link DocumentSearchService}.
 * Provides ingestion, synchronization, search and index maintenance.
 */
public class DocumentSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search the documents of the configured S3 bucket by keyword. \
            Matches in the extracted document text weigh more than matches in the file name. \
            Supports Lucene query syntax: \
            - Simple terms: 'invoice 2024' (small typos are tolerated) \
            - Phrases: '"exact phrase"' (matched exactly) \
            - Boolean: 'term1 AND term2', 'term1 OR term2', 'NOT term' \
            - Wildcards: 'report*' \
            Returns: ranked hits (newer documents first on equal relevance) with store key, file name, size, \
            modification time, a time-limited download URL, up to three highlighted content fragments \
            and the highlighted file name when it matched (<em> marks matches).""";

    private final DocumentSearchService service;
    private final int defaultConcurrency;

    public DocumentSearchTools(final DocumentSearchService service, final int defaultConcurrency) {
        this.service = service;
        this.defaultConcurrency = defaultConcurrency;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(tool("processAll",
                "Download, extract and index every supported document in the S3 bucket. "
                        + "Unchanged documents are recognized by their ETag and not downloaded again. "
                        + "Blocks until the whole batch is done; a second call waits for a running batch.",
                SchemaGenerator.generateSchema(ProcessAllRequest.class),
                this::processAll));

        tools.add(tool("processDocument",
                "Download, extract and index a single document identified by its store key.",
                SchemaGenerator.generateSchema(ProcessDocumentRequest.class),
                this::processDocument));

        tools.add(tool("sync",
                "Synchronize the index with the bucket: index documents that are missing from the index "
                        + "and remove index entries whose document no longer exists in the bucket.",
                SchemaGenerator.emptySchema(),
                args -> sync()));

        tools.add(tool("search",
                SEARCH_DESCRIPTION,
                SchemaGenerator.generateSchema(SearchRequest.class),
                this::search));

        tools.add(tool("deleteDocument",
                "Remove a document from the search index. The document in the bucket is NOT deleted.",
                SchemaGenerator.generateSchema(DeleteDocumentRequest.class),
                this::deleteDocument));

        tools.add(tool("getStatus",
                "Get bucket information, index statistics, supported file types, size limit and server version.",
                SchemaGenerator.emptySchema(),
                args -> getStatus()));

        tools.add(tool("getDocumentDetails",
                "Get the indexed record of a document including its full extracted text (truncated above 500,000 characters).",
                SchemaGenerator.generateSchema(GetDocumentDetailsRequest.class),
                this::getDocumentDetails));

        return tools;
    }

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> args);
    }

    private static McpServerFeatures.SyncToolSpecification tool(final String name,
                                                                final String description,
                                                                final McpSchema.JsonSchema inputSchema,
                                                                final ToolHandler handler) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(inputSchema)
                        .build())
                .callHandler((exchange, request) -> {
                    final Map<String, Object> args = request.arguments() != null ? request.arguments() : Map.of();
                    try {
                        return handler.handle(args);
                    } catch (final RuntimeException e) {
                        logger.error("Unexpected error in tool {}", name, e);
                        return ToolResultHelper.createErrorResult("Unexpected error: " + e.getMessage());
                    }
                })
                .build();
    }

    McpSchema.CallToolResult processAll(final Map<String, Object> args) {
        final ProcessAllRequest request = ProcessAllRequest.fromMap(args);
        final int concurrency = request.effectiveConcurrency(defaultConcurrency);
        logger.info("Process all request: concurrency={}", concurrency);

        try {
            final long startTime = System.nanoTime();
            final BatchSummary summary = service.processAll(concurrency);
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            return ToolResultHelper.createResult(ProcessAllResponse.success(summary, durationMs));
        } catch (final ValidationException e) {
            logger.warn("Invalid processAll request: {}", e.getMessage());
            return ToolResultHelper.createResult(ProcessAllResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Batch processing failed", e);
            return ToolResultHelper.createResult(ProcessAllResponse.error("Processing failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult processDocument(final Map<String, Object> args) {
        final ProcessDocumentRequest request = ProcessDocumentRequest.fromMap(args);
        logger.info("Process document request: key='{}'", request.key());

        try {
            final ProcessingOutcome outcome = service.processOne(request.key());
            return ToolResultHelper.createResult(ProcessDocumentResponse.success(outcome));
        } catch (final ValidationException e) {
            return ToolResultHelper.createResult(ProcessDocumentResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Processing of {} failed", request.key(), e);
            return ToolResultHelper.createResult(ProcessDocumentResponse.error("Processing failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult sync() {
        logger.info("Sync request");
        try {
            final long startTime = System.nanoTime();
            final SyncSummary summary = service.sync();
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            return ToolResultHelper.createResult(SyncResponse.success(summary, durationMs));
        } catch (final IOException e) {
            logger.error("Sync failed", e);
            return ToolResultHelper.createResult(SyncResponse.error("Sync failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchRequest request = SearchRequest.fromMap(args);
        logger.info("Search request: query='{}', size={}, offset={}",
                request.query(), request.effectiveSize(), request.effectiveOffset());

        try {
            final long startTime = System.nanoTime();
            final SearchResult result = service.search(request.query(), request.effectiveSize(),
                    request.effectiveOffset());
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            logger.info("Search completed in {}ms: {} total hits, returning {}",
                    durationMs, result.totalHits(), result.hits().size());
            return ToolResultHelper.createResult(SearchResponse.success(result, durationMs));
        } catch (final ValidationException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult deleteDocument(final Map<String, Object> args) {
        final DeleteDocumentRequest request = DeleteDocumentRequest.fromMap(args);
        logger.info("Delete document request: key='{}'", request.key());

        try {
            final boolean deleted = service.deleteFromIndex(request.key());
            return ToolResultHelper.createResult(DeleteDocumentResponse.success(request.key(), deleted));
        } catch (final ValidationException e) {
            return ToolResultHelper.createResult(DeleteDocumentResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Failed to delete {} from index", request.key(), e);
            return ToolResultHelper.createResult(DeleteDocumentResponse.error("Delete failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getStatus() {
        try {
            final ServiceStatus status = service.status();
            return ToolResultHelper.createResult(
                    StatusResponse.success(status, BuildInfo.getVersion(), BuildInfo.getBuildTimestamp()));
        } catch (final IOException e) {
            logger.error("Failed to collect status", e);
            return ToolResultHelper.createResult(StatusResponse.error("Failed to collect status: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getDocumentDetails(final Map<String, Object> args) {
        final GetDocumentDetailsRequest request = GetDocumentDetailsRequest.fromMap(args);
        logger.info("Get document details request: key='{}'", request.key());

        try {
            final IndexRecord record = service.documentDetails(request.key());
            if (record == null) {
                logger.warn("Document not found in index: {}", request.key());
                return ToolResultHelper.createResult(
                        GetDocumentDetailsResponse.error("Document not found in index: " + request.key()));
            }
            return ToolResultHelper.createResult(GetDocumentDetailsResponse.success(record));
        } catch (final ValidationException e) {
            return ToolResultHelper.createResult(GetDocumentDetailsResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error retrieving document details", e);
            return ToolResultHelper.createResult(
                    GetDocumentDetailsResponse.error("Error retrieving document: " + e.getMessage()));
        }
    }
}
