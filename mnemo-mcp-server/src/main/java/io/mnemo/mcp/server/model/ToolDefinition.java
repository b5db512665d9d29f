package io.mnemo.mcp.server.model;

import java.util.Map;

public record ToolDefinition(
    String name,
    String description,
    Map<String, Object> inputSchema,
    String group,
    boolean mutating
) {
}
