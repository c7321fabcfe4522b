package de.mirkosertic.mcp.blobsearch.mcp.dto;

import de.mirkosertic.mcp.blobsearch.ServiceStatus;
import de.mirkosertic.mcp.blobsearch.mcp.ToolResponse;

/**
 * Response DTO for the getStatus tool.
 */
public record StatusResponse(
        boolean success,
        ServiceStatus status,
        String serverVersion,
        String serverBuildTimestamp,
        String error
) implements ToolResponse {

    public static StatusResponse success(final ServiceStatus status, final String version, final String buildTimestamp) {
        return new StatusResponse(true, status, version, buildTimestamp, null);
    }

    public static StatusResponse error(final String errorMessage) {
        return new StatusResponse(false, null, null, null, errorMessage);
    }
}
