package de.mirkosertic.mcp.blobsearch.mcp;

import de.mirkosertic.mcp.blobsearch.mcp.dto.DeleteDocumentRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.ProcessAllRequest;
import de.mirkosertic.mcp.blobsearch.mcp.dto.SearchRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator")
class SchemaGeneratorTest {

    @Test
    @DisplayName("should mark only non-nullable components as required")
    void shouldDeriveRequiredFields() {
        // When
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SearchRequest.class);

        // Then
        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.properties()).containsOnlyKeys("query", "size", "offset");
        assertThat(schema.required()).containsExactly("query");
    }

    @Test
    @DisplayName("should map component types and descriptions")
    @SuppressWarnings("unchecked")
    void shouldMapTypesAndDescriptions() {
        // When
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SearchRequest.class);

        // Then
        final Map<String, Object> query = (Map<String, Object>) schema.properties().get("query");
        final Map<String, Object> size = (Map<String, Object>) schema.properties().get("size");
        assertThat(query).containsEntry("type", "string").containsKey("description");
        assertThat(size).containsEntry("type", "integer");
    }

    @Test
    @DisplayName("should allow calls without any argument for optional-only requests")
    void shouldHaveNoRequiredFieldsForOptionalRequest() {
        assertThat(SchemaGenerator.generateSchema(ProcessAllRequest.class).required()).isEmpty();
        assertThat(SchemaGenerator.generateSchema(DeleteDocumentRequest.class).required()).containsExactly("key");
    }

    @Test
    @DisplayName("should produce an empty object schema")
    void shouldProduceEmptySchema() {
        final McpSchema.JsonSchema schema = SchemaGenerator.emptySchema();

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.properties()).isEmpty();
        assertThat(schema.required()).isEmpty();
    }
}
