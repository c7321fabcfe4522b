package de.mirkosertic.mcp.blobsearch.mcp;

/**
 * Implemented by every tool response DTO so failed calls can be flagged as MCP errors.
 */
public interface ToolResponse {

    boolean success();
}
