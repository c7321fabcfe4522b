package de.mirkosertic.mcp.blobsearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes tool response DTOs into MCP tool results.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ToolResultHelper() {
    }

    /**
     * Wraps the JSON form of a response in a text content. Responses reporting {@code success=false}
     * are flagged as errors.
     */
    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", errorMessage);
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(body))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }
}
